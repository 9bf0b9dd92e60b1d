package com.ltlplan.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A grounded action. Names follow the {@code (schema arg1 arg2 ...)} convention; the schema determines the weight
 * and the {@link ActionKind}.
 */
public record Action(String name, String schema, ActionKind kind, List<String> arguments, Player player,
                     ImmutableSet<Integer> preconditions, ImmutableSet<Integer> addEffects,
                     ImmutableSet<Integer> deleteEffects) {
  public Action {
    checkArgument(!name.isBlank(), "Empty action name");
    arguments = List.copyOf(arguments);
  }

  public static Action of(String name, Player player, Iterable<Integer> preconditions,
      Iterable<Integer> addEffects, Iterable<Integer> deleteEffects) {
    List<String> tokens = tokens(name);
    String schema = tokens.get(0);
    return new Action(name, schema, ActionKind.ofSchema(schema), tokens.subList(1, tokens.size()), player,
        ImmutableSet.copyOf(preconditions), ImmutableSet.copyOf(addEffects), ImmutableSet.copyOf(deleteEffects));
  }

  public static Action of(String name, Iterable<Integer> preconditions, Iterable<Integer> addEffects,
      Iterable<Integer> deleteEffects) {
    List<String> tokens = tokens(name);
    return of(name, ActionKind.ofSchema(tokens.get(0)).defaultPlayer(), preconditions, addEffects, deleteEffects);
  }

  static List<String> tokens(String name) {
    String trimmed = name.strip();
    if (!PredicateTable.isWellFormed(trimmed)) {
      throw new InvariantViolationException("Malformed action name %s".formatted(name));
    }
    return Arrays.stream(trimmed.substring(1, trimmed.length() - 1).strip().split("\\s+")).toList();
  }

  public boolean isApplicable(State state) {
    return state.containsAll(preconditions);
  }

  /** The object manipulated by this action, if its kind moves one. */
  public Optional<String> object() {
    return kind.movesObject() && !arguments.isEmpty() ? Optional.of(arguments.get(0)) : Optional.empty();
  }

  /** The location the action places its object on, if it has to be free. */
  public Optional<String> destination() {
    return kind.requiresFreeDestination() && arguments.size() >= 2
        ? Optional.of(arguments.get(arguments.size() - 1))
        : Optional.empty();
  }

  @Override
  public String toString() {
    return name;
  }
}
