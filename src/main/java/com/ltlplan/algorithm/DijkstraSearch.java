package com.ltlplan.algorithm;

import com.google.common.base.Stopwatch;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.TransitionSystem;
import com.ltlplan.symbolic.CostLayers;
import com.ltlplan.util.Cancellation;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cost-optimal search over non-negative action weights. Open states are kept in {@link CostLayers}; the cheapest
 * layer is expanded first and every state is expanded at most once.
 */
public final class DijkstraSearch extends SymbolicSearch {
  private static final Logger log = Logger.getLogger(DijkstraSearch.class.getName());

  public DijkstraSearch(ProductGraph product, TransitionSystem system) {
    super(product, system);
  }

  @Override
  protected int cost(int action) {
    return system.weight(action);
  }

  @Override
  protected Optional<Plan> expand() {
    CostLayers open = new CostLayers(manager);
    open.add(0, product.initial());
    int closed = manager.falseNode();
    try {
      while (true) {
        OptionalInt lowest = open.lowestCost();
        if (lowest.isEmpty()) {
          log.log(Level.FINE, "All reachable states expanded without reaching the target");
          return Optional.empty();
        }
        int cost = lowest.getAsInt();
        Cancellation.check("dijkstra layer of cost " + cost);
        Stopwatch stopwatch = Stopwatch.createStarted();
        int layer = open.remove(cost);
        int frontier = manager.andNot(layer, closed);
        manager.release(layer);
        if (manager.isFalse(frontier)) {
          continue;
        }
        int newClosed = manager.or(closed, frontier);
        manager.release(closed);
        closed = newClosed;

        int hit = manager.and(frontier, product.target());
        if (!manager.isFalse(hit)) {
          record(cost, frontier, stopwatch.elapsed());
          manager.release(frontier);
          log.log(Level.FINE, () -> "Target reached at cost %d".formatted(cost));
          Plan plan = reconstruct(hit);
          manager.release(hit);
          return Optional.of(plan);
        }
        for (int action = 0; action < system.actions().size(); action++) {
          int image = image(frontier, action);
          int fresh = manager.andNot(image, closed);
          manager.release(image);
          if (!manager.isFalse(fresh)) {
            open.add(cost + system.weight(action), fresh);
          }
          manager.release(fresh);
        }
        record(cost, frontier, stopwatch.elapsed());
        manager.release(frontier);
      }
    } finally {
      manager.release(closed);
      open.asMap().keySet().forEach(cost -> manager.release(open.get(cost)));
    }
  }
}
