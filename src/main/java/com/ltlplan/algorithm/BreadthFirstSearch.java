package com.ltlplan.algorithm;

import com.google.common.base.Stopwatch;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.TransitionSystem;
import com.ltlplan.util.Cancellation;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Layered breadth-first search for a plan with the fewest actions. */
public final class BreadthFirstSearch extends SymbolicSearch {
  private static final Logger log = Logger.getLogger(BreadthFirstSearch.class.getName());

  public BreadthFirstSearch(ProductGraph product, TransitionSystem system) {
    super(product, system);
  }

  @Override
  protected int cost(int action) {
    return 1;
  }

  @Override
  protected Optional<Plan> expand() {
    int frontier = manager.retain(product.initial());
    int visited = manager.falseNode();
    int layer = 0;
    try {
      while (!manager.isFalse(frontier)) {
        Cancellation.check("breadth-first layer " + layer);
        Stopwatch stopwatch = Stopwatch.createStarted();
        int newVisited = manager.or(visited, frontier);
        manager.release(visited);
        visited = newVisited;

        int hit = manager.and(frontier, product.target());
        if (!manager.isFalse(hit)) {
          record(layer, frontier, stopwatch.elapsed());
          int foundLayer = layer;
          log.log(Level.FINE, () -> "Target reached in layer %d".formatted(foundLayer));
          Plan plan = reconstruct(hit);
          manager.release(hit);
          return Optional.of(plan);
        }

        int next = manager.falseNode();
        for (int action = 0; action < system.actions().size(); action++) {
          int image = image(frontier, action);
          int newNext = manager.or(next, image);
          manager.release(image);
          manager.release(next);
          next = newNext;
        }
        record(layer, frontier, stopwatch.elapsed());
        manager.release(frontier);
        frontier = manager.andNot(next, visited);
        manager.release(next);
        layer++;
      }
      int layers = layer;
      log.log(Level.FINE, () -> "Fixed point after %d layers without reaching the target".formatted(layers));
      return Optional.empty();
    } finally {
      manager.release(frontier);
      manager.release(visited);
    }
  }
}
