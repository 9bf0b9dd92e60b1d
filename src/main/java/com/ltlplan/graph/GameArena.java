package com.ltlplan.graph;

import com.ltlplan.model.Action;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.State;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.symbolic.StateEncoder;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Two-player arena: the system picks an action, then the environment either stays idle or applies one of its
 * actions. The single relation {@code G(X, Sys, Env, X')} records the combined move. Environment code {@code 0} is the
 * idle move, code {@code j + 1} the {@code j}-th environment action. In a bounded arena the environment may act at
 * most {@code bound} times; the remaining count is kept in {@link #interventions()} and decremented by every
 * non-idle move.
 */
public final class GameArena implements LabelledSystem {
  public static final int IDLE = 0;

  private final BddManager manager;
  private final PlanningProblem problem;
  private final StateEncoder<State> states;
  private final StateEncoder<Set<String>> labels;
  private final StateEncoder<Integer> systemMoves;
  private final StateEncoder<Integer> environmentMoves;
  @Nullable
  private final StateEncoder<Integer> interventions;
  private final List<Action> systemActions;
  private final List<Action> environmentActions;
  private final int relation;
  private final int observation;
  private final int goalRegion;
  private final BuildStatistics statistics;

  GameArena(BddManager manager, PlanningProblem problem, StateEncoder<State> states,
      StateEncoder<Set<String>> labels, StateEncoder<Integer> systemMoves, StateEncoder<Integer> environmentMoves,
      @Nullable StateEncoder<Integer> interventions, List<Action> systemActions, List<Action> environmentActions, int relation, int observation, int goalRegion,
      BuildStatistics statistics) {
    this.manager = manager;
    this.problem = problem;
    this.states = states;
    this.labels = labels;
    this.systemMoves = systemMoves;
    this.environmentMoves = environmentMoves;
    this.interventions = interventions;
    this.systemActions = List.copyOf(systemActions);
    this.environmentActions = List.copyOf(environmentActions);
    this.relation = relation;
    this.observation = observation;
    this.goalRegion = goalRegion;
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

  @Override
  public Optional<StateEncoder<Integer>> interventions() {
    return Optional.ofNullable(interventions);
  }

  /** The number of environment moves allowed in a play; empty if unbounded. */
  public OptionalInt interventionBound() {
    return interventions == null ? OptionalInt.empty() : OptionalInt.of(interventions.size() - 1);
  }

  public List<Action> systemActions() {
    return systemActions;
  }

  public List<Action> environmentActions() {
    return environmentActions;
  }

  public int relation() {
    return relation;
  }

  public int systemCube(int action) {
    return systemMoves.cube(action);
  }

  public int environmentCube(int move) {
    return environmentMoves.cube(move);
  }

  public int environmentMoveCount() {
    return environmentActions.size() + 1;
  }

  public Optional<Action> environmentAction(int move) {
    return move == IDLE ? Optional.empty() : Optional.of(environmentActions.get(move - 1));
  }

  public BitSet systemSupport() {
    return systemMoves.current().support();
  }

  public BitSet environmentSupport() {
    return environmentMoves.current().support();
  }

  public int decodeSystemMove(BitSet assignment) {
    return systemMoves.decode(assignment);
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
    return problem.initialState();
  }

  @Override
  public BuildStatistics statistics() {
    return statistics;
  }

  @Override
  public String toString() {
    return "GameArena[%d states, %d system actions, %d environment actions, %d edges]".formatted(
        states.size(), systemActions.size(), environmentActions.size(), statistics.edges());
  }
}
