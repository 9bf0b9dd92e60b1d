package com.ltlplan.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A grounded planning problem: predicates, actions, initial state, goal facts and the observation map that turns
 * predicates into atomic propositions.
 */
public final class PlanningProblem {
  private final String name;
  private final PredicateTable predicates;
  private final List<Action> actions;
  private final State initialState;
  private final ImmutableSet<Integer> goal;
  private final ImmutableMap<Integer, String> observations;
  private final List<String> objects;
  @Nullable
  private final Integer stateCapacity;
  @Nullable
  private final Integer labelCapacity;

  public PlanningProblem(String name, PredicateTable predicates, List<Action> actions, State initialState,
      Set<Integer> goal, Map<Integer, String> observations, List<String> objects,
      @Nullable Integer stateCapacity, @Nullable Integer labelCapacity) {
    checkArgument(stateCapacity == null || stateCapacity > 0, "Non-positive state capacity");
    checkArgument(labelCapacity == null || labelCapacity > 0, "Non-positive label capacity");
    Map<String, Action> byName = new HashMap<>();
    for (Action action : actions) {
      Action previous = byName.putIfAbsent(action.name(), action);
      if (previous != null && !previous.equals(action)) {
        throw new InvariantViolationException("Action %s has two different outcomes".formatted(action.name()));
      }
      checkArgument(previous == null, "Duplicate action %s", action.name());
    }
    this.name = name;
    this.predicates = predicates;
    this.actions = List.copyOf(actions);
    this.initialState = initialState;
    this.goal = ImmutableSet.copyOf(goal);
    this.observations = ImmutableMap.copyOf(observations);
    this.objects = objects.isEmpty() ? deriveObjects(actions) : List.copyOf(objects);
    this.stateCapacity = stateCapacity;
    this.labelCapacity = labelCapacity;
  }

  private static List<String> deriveObjects(List<Action> actions) {
    Set<String> objects = new LinkedHashSet<>();
    actions.forEach(action -> action.object().ifPresent(objects::add));
    return List.copyOf(objects);
  }

  public String name() {
    return name;
  }

  public PredicateTable predicates() {
    return predicates;
  }

  public List<Action> actions() {
    return actions;
  }

  public List<Action> actions(Player player) {
    return actions.stream().filter(action -> action.player() == player).toList();
  }

  public State initialState() {
    return initialState;
  }

  public Set<Integer> goal() {
    return goal;
  }

  public boolean isGoal(State state) {
    return state.containsAll(goal);
  }

  public Map<Integer, String> observations() {
    return observations;
  }

  public Set<String> propositions() {
    return ImmutableSortedSet.copyOf(observations.values());
  }

  /** Atomic propositions observed in the given state. */
  public Set<String> label(State state) {
    ImmutableSortedSet.Builder<String> label = ImmutableSortedSet.naturalOrder();
    observations.forEach((predicate, proposition) -> {
      if (state.contains(predicate)) {
        label.add(proposition);
      }
    });
    return label.build();
  }

  public List<String> objects() {
    return objects;
  }

  /** Upper bound on the number of reachable states; defaults to the trivial powerset bound. */
  public int stateCapacity() {
    return stateCapacity == null ? powerBound(predicates.size()) : stateCapacity;
  }

  public int labelCapacity() {
    return labelCapacity == null ? powerBound(propositions().size()) : labelCapacity;
  }

  private static int powerBound(int bits) {
    return bits >= 30 ? 1 << 30 : 1 << bits;
  }

  @Override
  public String toString() {
    return "%s[%d predicates, %d actions]".formatted(name, predicates.size(), actions.size());
  }
}
