package com.ltlplan.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Stopwatch;
import com.ltlplan.model.Action;
import com.ltlplan.model.ConfigurationException;
import com.ltlplan.model.Player;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.State;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.symbolic.StateEncoder;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * Unrolls the reachable two-player arena from the initial state, in the same layered manner as the planner. With an
 * intervention bound the environment may act at most that many times per play.
 */
public final class GameArenaBuilder {
  private static final Logger log = Logger.getLogger(GameArenaBuilder.class.getName());

  private final BddManager manager;
  private final PlanningProblem problem;
  private final ActionFilter filter;
  private final OptionalInt interventionBound;

  public GameArenaBuilder(BddManager manager, PlanningProblem problem) {
    this(manager, problem, new OccupancyFilter(problem), OptionalInt.empty());
  }

  public GameArenaBuilder(BddManager manager, PlanningProblem problem, ActionFilter filter) {
    this(manager, problem, filter, OptionalInt.empty());
  }

  public GameArenaBuilder(BddManager manager, PlanningProblem problem, ActionFilter filter,
      OptionalInt interventionBound) {
    checkArgument(interventionBound.orElse(0) >= 0, "Negative intervention bound");
    this.manager = manager;
    this.problem = problem;
    this.filter = filter;
    this.interventionBound = interventionBound;
  }

  /** Same arena, but the environment may intervene at most {@code bound} times. */
  public GameArenaBuilder bounded(int bound) {
    return new GameArenaBuilder(manager, problem, filter, OptionalInt.of(bound));
  }

  public GameArena build() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<Action> systemActions = problem.actions(Player.SYSTEM);
    List<Action> environmentActions = problem.actions(Player.ENVIRONMENT);
    if (systemActions.isEmpty()) {
      throw new ConfigurationException("Game %s has no system actions".formatted(problem.name()));
    }
    boolean environmentActive = interventionBound.orElse(1) > 0;

    StateEncoder<State> states = StateEncoder.paired(manager, "x", problem.stateCapacity());
    StateEncoder<Set<String>> labels = StateEncoder.single(manager, "l", problem.labelCapacity());
    StateEncoder<Integer> systemMoves = StateEncoder.single(manager, "sys",
        IntStream.range(0, systemActions.size()).boxed().toList());
    StateEncoder<Integer> environmentMoves = StateEncoder.single(manager, "env",
        IntStream.rangeClosed(0, environmentActions.size()).boxed().toList());

    int[] idleMoves = {manager.falseNode()};
    int[] responseMoves = {manager.falseNode()};
    long[] edges = {0};

    LayeredExploration exploration = new LayeredExploration(manager, problem, states, labels);
    exploration.run(problem.initialState(), state -> {
      List<State> successors = new ArrayList<>();
      for (int i = 0; i < systemActions.size(); i++) {
        Action action = systemActions.get(i);
        if (!action.isApplicable(state) || !filter.admits(action, state)) {
          continue;
        }
        State intermediate = state.apply(action);
        int lastMove = environmentActive ? environmentActions.size() : GameArena.IDLE;
        for (int move = GameArena.IDLE; move <= lastMove; move++) {
          State successor;
          if (move == GameArena.IDLE) {
            successor = intermediate;
          } else {
            Action response = environmentActions.get(move - 1);
            if (!response.isApplicable(intermediate) || !filter.admits(response, intermediate)) {
              continue;
            }
            successor = intermediate.apply(response);
          }
          int[] target = move == GameArena.IDLE ? idleMoves : responseMoves;
          int edge = manager.and(states.cube(state), states.nextCube(successor));
          int withSystem = manager.and(edge, systemMoves.cube(i));
          int withEnvironment = manager.and(withSystem, environmentMoves.cube(move));
          int newMoves = manager.or(target[0], withEnvironment);
          for (int node : new int[] {edge, withSystem, withEnvironment, target[0]}) {
            manager.release(node);
          }
          target[0] = newMoves;
          edges[0]++;
          successors.add(successor);
        }
      }
      return successors;
    });

    StateEncoder<Integer> interventions = null;
    int relation;
    if (interventionBound.isPresent()) {
      interventions = StateEncoder.paired(manager, "k",
          IntStream.rangeClosed(0, interventionBound.getAsInt()).boxed().toList());
      relation = countInterventions(interventions, idleMoves[0], responseMoves[0]);
    } else {
      relation = manager.or(idleMoves[0], responseMoves[0]);
    }
    manager.release(idleMoves[0]);
    manager.release(responseMoves[0]);

    int goalRegion = LayeredExploration.goalRegion(manager, problem, states);
    BuildStatistics statistics = new BuildStatistics(manager.variableCount(), edges[0], states.size(),
        exploration.layerTimes());
    log.fine(() -> "Game arena of %s: %d states, %d edges, %d variables, intervention bound %s in %s".formatted(
        problem.name(), states.size(), edges[0], manager.variableCount(), interventionBound, stopwatch));
    return new GameArena(manager, problem, states, labels, systemMoves, environmentMoves, interventions,
        systemActions, environmentActions, relation, exploration.observation(), goalRegion, statistics);
  }

  /** Idle moves keep the counter, environment moves need a positive counter and decrement it. */
  private int countInterventions(StateEncoder<Integer> counter, int idleMoves, int responseMoves) {
    int keep = manager.falseNode();
    int decrement = manager.falseNode();
    for (int remaining = 0; remaining < counter.size(); remaining++) {
      int same = manager.and(counter.cube(remaining), counter.nextCube(remaining));
      int newKeep = manager.or(keep, same);
      manager.release(same);
      manager.release(keep);
      keep = newKeep;
      if (remaining > 0) {
        int less = manager.and(counter.cube(remaining), counter.nextCube(remaining - 1));
        int newDecrement = manager.or(decrement, less);
        manager.release(less);
        manager.release(decrement);
        decrement = newDecrement;
      }
    }
    int idle = manager.and(idleMoves, keep);
    int responses = manager.and(responseMoves, decrement);
    int relation = manager.or(idle, responses);
    for (int node : new int[] {keep, decrement, idle, responses}) {
      manager.release(node);
    }
    return relation;
  }
}
