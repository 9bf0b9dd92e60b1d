package com.ltlplan.graph;

import static com.google.common.base.Preconditions.checkElementIndex;

import com.ltlplan.model.Action;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.State;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.symbolic.StateEncoder;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/** Symbolic transition system with one relation {@code T_a(X, X')} and one weight per action. */
public final class TransitionSystem implements LabelledSystem {
  private final BddManager manager;
  private final PlanningProblem problem;
  private final StateEncoder<State> states;
  private final StateEncoder<Set<String>> labels;
  private final List<Action> actions;
  private final int[] relations;
  private final int[] weights;
  private final int observation;
  private final int goalRegion;
  private final State initialState;
  private final BuildStatistics statistics;

  TransitionSystem(BddManager manager, PlanningProblem problem, StateEncoder<State> states,
      StateEncoder<Set<String>> labels, List<Action> actions, int[] relations, int[] weights, int observation,
      int goalRegion, State initialState, BuildStatistics statistics) {
    this.manager = manager;
    this.problem = problem;
    this.states = states;
    this.labels = labels;
    this.actions = List.copyOf(actions);
    this.relations = relations.clone();
    this.weights = weights.clone();
    this.observation = observation;
    this.goalRegion = goalRegion;
    this.initialState = initialState;
    this.statistics = statistics;
  }

  @Override
  public BddManager manager() {
    return manager;
  }

  @Override
  public PlanningProblem problem() {
    return problem;
  }

  @Override
  public StateEncoder<State> states() {
    return states;
  }

  @Override
  public StateEncoder<Set<String>> labels() {
    return labels;
  }

  public List<Action> actions() {
    return actions;
  }

  public Action action(int index) {
    return actions.get(index);
  }

  public int relation(int action) {
    checkElementIndex(action, relations.length);
    return relations[action];
  }

  public int weight(int action) {
    return weights[action];
  }

  public int minimumWeight() {
    return Arrays.stream(weights).min().orElse(0);
  }

  @Override
  public int observation() {
    return observation;
  }

  @Override
  public int goalRegion() {
    return goalRegion;
  }

  @Override
  public State initialState() {
    return initialState;
  }

  @Override
  public BuildStatistics statistics() {
    return statistics;
  }

  @Override
  public String toString() {
    return "TransitionSystem[%d states, %d actions, %d edges]"
        .formatted(states.size(), actions.size(), statistics.edges());
  }
}
