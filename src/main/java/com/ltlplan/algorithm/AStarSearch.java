package com.ltlplan.algorithm;

import com.google.common.base.Stopwatch;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.TransitionSystem;
import com.ltlplan.util.Cancellation;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cost-optimal search guided by {@link AutomatonHeuristic}. Open states are bucketed by {@code (f, g)} and the
 * bucket with the lowest {@code f}, then lowest {@code g}, is expanded first. Because the heuristic is consistent the
 * search stops at the first target state it expands.
 */
public final class AStarSearch extends SymbolicSearch {
  private static final Logger log = Logger.getLogger(AStarSearch.class.getName());

  private final AutomatonHeuristic heuristic;
  private final NavigableMap<Integer, NavigableMap<Integer, Integer>> open = new TreeMap<>();

  public AStarSearch(ProductGraph product, TransitionSystem system) {
    super(product, system);
    this.heuristic = AutomatonHeuristic.of(product, system.minimumWeight());
  }

  @Override
  protected int cost(int action) {
    return system.weight(action);
  }

  private void insert(int g, int set) {
    for (Map.Entry<Integer, Integer> region : heuristic.regions().entrySet()) {
      int part = manager.and(set, region.getValue());
      if (manager.isFalse(part)) {
        continue;
      }
      NavigableMap<Integer, Integer> bucket = open.computeIfAbsent(g + region.getKey(), f -> new TreeMap<>());
      Integer existing = bucket.get(g);
      if (existing == null) {
        bucket.put(g, part);
      } else {
        bucket.put(g, manager.or(existing, part));
        manager.release(existing);
        manager.release(part);
      }
    }
  }

  @Override
  protected Optional<Plan> expand() {
    insert(0, product.initial());
    int closed = manager.falseNode();
    try {
      while (!open.isEmpty()) {
        Map.Entry<Integer, NavigableMap<Integer, Integer>> lowest = open.firstEntry();
        int f = lowest.getKey();
        NavigableMap<Integer, Integer> bucket = lowest.getValue();
        int g = bucket.firstKey();
        int set = bucket.remove(g);
        if (bucket.isEmpty()) {
          open.remove(f);
        }
        Cancellation.check("A* bucket (%d, %d)".formatted(f, g));
        Stopwatch stopwatch = Stopwatch.createStarted();
        int frontier = manager.andNot(set, closed);
        manager.release(set);
        if (manager.isFalse(frontier)) {
          continue;
        }
        int newClosed = manager.or(closed, frontier);
        manager.release(closed);
        closed = newClosed;

        int hit = manager.and(frontier, product.target());
        if (!manager.isFalse(hit)) {
          record(g, frontier, stopwatch.elapsed());
          manager.release(frontier);
          log.log(Level.FINE, () -> "Target reached at cost %d".formatted(g));
          Plan plan = reconstruct(hit);
          manager.release(hit);
          return Optional.of(plan);
        }
        for (int action = 0; action < system.actions().size(); action++) {
          int image = image(frontier, action);
          int fresh = manager.andNot(image, closed);
          manager.release(image);
          if (!manager.isFalse(fresh)) {
            insert(g + system.weight(action), fresh);
          }
          manager.release(fresh);
        }
        record(g, frontier, stopwatch.elapsed());
        manager.release(frontier);
      }
      log.log(Level.FINE, "Open buckets exhausted without reaching the target");
      return Optional.empty();
    } finally {
      manager.release(closed);
      open.values().forEach(bucket -> bucket.values().forEach(manager::release));
      open.clear();
    }
  }
}
