package com.ltlplan.algorithm;

import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.SymbolicAutomaton;
import com.ltlplan.symbolic.BddManager;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Estimates the remaining cost as the minimum action weight times the largest number of steps any automaton still
 * needs to accept. Automaton states that cannot reach acceptance get no value and are pruned. The estimate never
 * decreases by more than one step per action, so it is consistent.
 */
public final class AutomatonHeuristic {
  private final NavigableMap<Integer, Integer> regions;

  private AutomatonHeuristic(NavigableMap<Integer, Integer> regions) {
    this.regions = regions;
  }

  public static AutomatonHeuristic of(ProductGraph product, int minimumWeight) {
    BddManager manager = product.manager();
    int maximum = 0;
    for (SymbolicAutomaton automaton : product.automata()) {
      for (int q = 0; q < automaton.size(); q++) {
        if (automaton.distance(q) != Integer.MAX_VALUE) {
          maximum = Math.max(maximum, automaton.distance(q));
        }
      }
    }
    NavigableMap<Integer, Integer> regions = new TreeMap<>();
    int previous = manager.falseNode();
    for (int steps = 0; steps <= maximum; steps++) {
      int atMost = manager.trueNode();
      for (SymbolicAutomaton automaton : product.automata()) {
        int close = manager.falseNode();
        for (int q = 0; q < automaton.size(); q++) {
          if (automaton.distance(q) <= steps) {
            int newClose = manager.or(close, automaton.states().cube(q));
            manager.release(close);
            close = newClose;
          }
        }
        int newAtMost = manager.and(atMost, close);
        manager.release(atMost);
        manager.release(close);
        atMost = newAtMost;
      }
      int exact = manager.andNot(atMost, previous);
      manager.release(previous);
      previous = atMost;
      if (manager.isFalse(exact)) {
        continue;
      }
      int value = steps * minimumWeight;
      Integer existing = regions.get(value);
      if (existing == null) {
        regions.put(value, exact);
      } else {
        regions.put(value, manager.or(existing, exact));
        manager.release(existing);
        manager.release(exact);
      }
    }
    manager.release(previous);
    return new AutomatonHeuristic(regions);
  }

  /** Heuristic value to the region of automaton states carrying it; regions are disjoint. */
  public NavigableMap<Integer, Integer> regions() {
    return Collections.unmodifiableNavigableMap(regions);
  }
}
