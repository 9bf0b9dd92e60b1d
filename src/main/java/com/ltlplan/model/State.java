package com.ltlplan.model;

import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;

/** A transition-system state: the set of predicates that currently hold. */
public final class State {
  private final int[] predicates;
  private final int hashCode;

  private State(int[] predicates) {
    this.predicates = predicates;
    this.hashCode = Arrays.hashCode(predicates);
  }

  public static State of(int... predicates) {
    return new State(Arrays.stream(predicates).sorted().distinct().toArray());
  }

  public static State of(Collection<Integer> predicates) {
    return new State(predicates.stream().mapToInt(Integer::intValue).sorted().distinct().toArray());
  }

  public boolean contains(int predicate) {
    return Arrays.binarySearch(predicates, predicate) >= 0;
  }

  public boolean containsAll(Collection<Integer> predicates) {
    for (int predicate : predicates) {
      if (!contains(predicate)) {
        return false;
      }
    }
    return true;
  }

  /** Successor after deleting, then adding, the effects of the given action. */
  public State apply(Action action) {
    IntSortedSet result = new IntAVLTreeSet(predicates);
    action.deleteEffects().forEach(result::remove);
    action.addEffects().forEach(result::add);
    return new State(result.toIntArray());
  }

  public int size() {
    return predicates.length;
  }

  public int[] predicates() {
    return predicates.clone();
  }

  public String format(PredicateTable table) {
    return Arrays.stream(predicates).mapToObj(table::predicate).collect(Collectors.joining(" ", "{", "}"));
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof State that && hashCode == that.hashCode
        && Arrays.equals(predicates, that.predicates));
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return Arrays.toString(predicates);
  }
}
