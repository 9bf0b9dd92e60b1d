package com.ltlplan.graph;

import com.google.common.base.Stopwatch;
import com.ltlplan.model.Action;
import com.ltlplan.model.CostAdjuster;
import com.ltlplan.model.Player;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.State;
import com.ltlplan.model.WeightTable;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.symbolic.StateEncoder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Builds the transition relations by unrolling the reachable states from the initial state. Only states reached
 * through applicable and admitted actions are ever encoded. Every state is expanded once, so each
 * {@code (state, action)} pair contributes exactly one edge.
 */
public final class IncrementalRelationBuilder {
  private static final Logger log = Logger.getLogger(IncrementalRelationBuilder.class.getName());

  private final BddManager manager;
  private final PlanningProblem problem;
  @Nullable
  private final WeightTable weightTable;
  private final CostAdjuster adjuster;
  private final ActionFilter filter;

  public IncrementalRelationBuilder(BddManager manager, PlanningProblem problem) {
    this(manager, problem, null, CostAdjuster.IDENTITY);
  }

  public IncrementalRelationBuilder(BddManager manager, PlanningProblem problem, @Nullable WeightTable weightTable,
      CostAdjuster adjuster) {
    this(manager, problem, weightTable, adjuster, new OccupancyFilter(problem));
  }

  public IncrementalRelationBuilder(BddManager manager, PlanningProblem problem, @Nullable WeightTable weightTable,
      CostAdjuster adjuster, ActionFilter filter) {
    this.manager = manager;
    this.problem = problem;
    this.weightTable = weightTable;
    this.adjuster = adjuster;
    this.filter = filter;
  }

  public TransitionSystem build() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<Action> actions = problem.actions(Player.SYSTEM);
    int[] weights = Weights.of(actions, weightTable, adjuster);

    StateEncoder<State> states = StateEncoder.paired(manager, "x", problem.stateCapacity());
    StateEncoder<Set<String>> labels = StateEncoder.single(manager, "l", problem.labelCapacity());
    int[] relations = new int[actions.size()];
    Arrays.fill(relations, manager.falseNode());
    long[] edges = {0};

    LayeredExploration exploration = new LayeredExploration(manager, problem, states, labels);
    exploration.run(problem.initialState(), state -> {
      List<State> successors = new ArrayList<>();
      for (int i = 0; i < actions.size(); i++) {
        Action action = actions.get(i);
        if (!action.isApplicable(state) || !filter.admits(action, state)) {
          continue;
        }
        State successor = state.apply(action);
        int edge = manager.and(states.cube(state), states.nextCube(successor));
        int relation = manager.or(relations[i], edge);
        manager.release(relations[i]);
        manager.release(edge);
        relations[i] = relation;
        edges[0]++;
        successors.add(successor);
      }
      return successors;
    });

    int goalRegion = LayeredExploration.goalRegion(manager, problem, states);
    BuildStatistics statistics = new BuildStatistics(manager.variableCount(), edges[0], states.size(),
        exploration.layerTimes());
    log.fine(() -> "Incremental construction of %s: %d states, %d edges, %d variables in %s".formatted(
        problem.name(), states.size(), edges[0], manager.variableCount(), stopwatch));
    return new TransitionSystem(manager, problem, states, labels, actions, relations, weights,
        exploration.observation(), goalRegion, problem.initialState(), statistics);
  }
}
