package com.ltlplan.model;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Bidirectional mapping between grounded predicate strings like {@code (on b0 l1)} and dense integer ids. Ids are
 * assigned in registration order.
 */
public final class PredicateTable {
  private final Object2IntMap<String> ids;
  private final List<String> predicates;

  private PredicateTable(Object2IntMap<String> ids, List<String> predicates) {
    this.ids = ids;
    this.predicates = predicates;
  }

  public static PredicateTable of(Collection<String> predicates) {
    Object2IntMap<String> ids = new Object2IntLinkedOpenHashMap<>();
    ids.defaultReturnValue(-1);
    List<String> list = new ArrayList<>();
    for (String predicate : predicates) {
      if (!isWellFormed(predicate)) {
        throw new InvariantViolationException("Malformed predicate %s".formatted(predicate));
      }
      if (!ids.containsKey(predicate)) {
        ids.put(predicate, list.size());
        list.add(predicate);
      }
    }
    return new PredicateTable(ids, List.copyOf(list));
  }

  static boolean isWellFormed(String predicate) {
    return predicate.length() > 2 && predicate.startsWith("(") && predicate.endsWith(")")
        && !predicate.substring(1, predicate.length() - 1).isBlank();
  }

  public int id(String predicate) {
    int id = ids.getInt(predicate);
    if (id < 0) {
      throw new InvariantViolationException("Unknown predicate %s".formatted(predicate));
    }
    return id;
  }

  public boolean contains(String predicate) {
    return ids.containsKey(predicate);
  }

  public String predicate(int id) {
    return predicates.get(id);
  }

  public int size() {
    return predicates.size();
  }

  public List<String> predicates() {
    return predicates;
  }

  @Override
  public String toString() {
    return predicates.toString();
  }
}
