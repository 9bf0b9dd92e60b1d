package com.ltlplan.symbolic;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Partition of a state set by non-negative integer cost: each state lives in at most one layer, the one with its
 * lowest known cost. Acts as the weighted decision diagram of the search engines.
 */
public final class CostLayers {
  private final BddManager manager;
  private final NavigableMap<Integer, Integer> layers = new TreeMap<>();

  public CostLayers(BddManager manager) {
    this.manager = manager;
  }

  /**
   * Pointwise minimum of the current costs and {@code cost} for all states in {@code set}. Returns whether any state
   * obtained a lower cost.
   */
  public boolean add(int cost, int set) {
    checkArgument(cost >= 0, "Negative cost %s", cost);
    int fresh = manager.retain(set);
    for (Map.Entry<Integer, Integer> entry : layers.headMap(cost, true).entrySet()) {
      int reduced = manager.andNot(fresh, entry.getValue());
      manager.release(fresh);
      fresh = reduced;
    }
    if (manager.isFalse(fresh)) {
      return false;
    }
    for (Map.Entry<Integer, Integer> entry : layers.tailMap(cost, false).entrySet()) {
      int reduced = manager.andNot(entry.getValue(), fresh);
      manager.release(entry.getValue());
      entry.setValue(reduced);
    }
    Integer existing = layers.get(cost);
    if (existing == null) {
      layers.put(cost, fresh);
    } else {
      layers.put(cost, manager.or(existing, fresh));
      manager.release(existing);
      manager.release(fresh);
    }
    layers.values().removeIf(manager::isFalse);
    return true;
  }

  public OptionalInt lowestCost() {
    return layers.isEmpty() ? OptionalInt.empty() : OptionalInt.of(layers.firstKey());
  }

  /** Removes and returns the layer with the given cost; ownership of the node moves to the caller. */
  public int remove(int cost) {
    Integer node = layers.remove(cost);
    return node == null ? manager.falseNode() : node;
  }

  public int get(int cost) {
    return layers.getOrDefault(cost, manager.falseNode());
  }

  public OptionalInt costOf(int state) {
    for (Map.Entry<Integer, Integer> entry : layers.entrySet()) {
      int common = manager.and(entry.getValue(), state);
      boolean hit = !manager.isFalse(common);
      manager.release(common);
      if (hit) {
        return OptionalInt.of(entry.getKey());
      }
    }
    return OptionalInt.empty();
  }

  public NavigableMap<Integer, Integer> asMap() {
    return Collections.unmodifiableNavigableMap(layers);
  }

  public boolean isEmpty() {
    return layers.isEmpty();
  }

  public int size() {
    return layers.size();
  }

  @Override
  public String toString() {
    return "CostLayers" + layers.keySet();
  }
}
