package com.ltlplan.graph;

import com.google.common.base.Stopwatch;
import com.ltlplan.model.Action;
import com.ltlplan.model.ConfigurationException;
import com.ltlplan.model.CostAdjuster;
import com.ltlplan.model.Player;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.State;
import com.ltlplan.model.WeightTable;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.symbolic.StateEncoder;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Builds the transition relations directly from preconditions and effects, for domains where every state is a single
 * fact (grid worlds). For each action {@code T_a = pre(X) & add(X') & !del(X')}, restricted to encoded states.
 */
public final class DirectRelationBuilder {
  private static final Logger log = Logger.getLogger(DirectRelationBuilder.class.getName());

  private final BddManager manager;
  private final PlanningProblem problem;
  @Nullable
  private final WeightTable weightTable;
  private final CostAdjuster adjuster;

  public DirectRelationBuilder(BddManager manager, PlanningProblem problem) {
    this(manager, problem, null, CostAdjuster.IDENTITY);
  }

  public DirectRelationBuilder(BddManager manager, PlanningProblem problem, @Nullable WeightTable weightTable,
      CostAdjuster adjuster) {
    this.manager = manager;
    this.problem = problem;
    this.weightTable = weightTable;
    this.adjuster = adjuster;
  }

  public TransitionSystem build() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    if (problem.initialState().size() != 1) {
      throw new ConfigurationException("Direct construction needs a single initial fact, got %d"
          .formatted(problem.initialState().size()));
    }
    List<Action> actions = problem.actions(Player.SYSTEM);
    int[] weights = Weights.of(actions, weightTable, adjuster);

    List<State> facts = new ArrayList<>();
    for (int predicate = 0; predicate < problem.predicates().size(); predicate++) {
      facts.add(State.of(predicate));
    }
    StateEncoder<State> states = StateEncoder.paired(manager, "x", facts);
    Set<Set<String>> knownLabels = new LinkedHashSet<>();
    facts.forEach(fact -> knownLabels.add(problem.label(fact)));
    StateEncoder<Set<String>> labels = StateEncoder.single(manager, "l", knownLabels);

    int observation = manager.falseNode();
    for (State fact : facts) {
      int label = manager.and(states.cube(fact), labels.cube(problem.label(fact)));
      int newObservation = manager.or(observation, label);
      manager.release(observation);
      manager.release(label);
      observation = newObservation;
    }

    int domainPair = manager.and(states.domain(), states.toNext(states.domain()));
    BitSet pairSupport = states.current().support();
    pairSupport.or(states.next().support());
    int[] relations = new int[actions.size()];
    long edges = 0;
    for (int i = 0; i < actions.size(); i++) {
      Action action = actions.get(i);
      int pre = conjunction(action, action.preconditions(), states, false);
      int add = conjunction(action, action.addEffects(), states, true);
      int delete = manager.falseNode();
      for (int predicate : action.deleteEffects()) {
        int newDelete = manager.or(delete, states.nextCube(State.of(predicate)));
        manager.release(delete);
        delete = newDelete;
      }
      int effects = manager.andNot(add, delete);
      int relation = manager.and(pre, effects);
      relations[i] = manager.and(relation, domainPair);
      for (int node : new int[] {pre, add, delete, effects, relation}) {
        manager.release(node);
      }
      edges += manager.countAssignments(relations[i], pairSupport).longValueExact();
    }
    manager.release(domainPair);

    int goalRegion = LayeredExploration.goalRegion(manager, problem, states);
    BuildStatistics statistics = new BuildStatistics(manager.variableCount(), edges, states.size(),
        List.of(stopwatch.elapsed()));
    long edgeCount = edges;
    log.fine(() -> "Direct construction of %s: %d states, %d edges, %d variables in %s".formatted(
        problem.name(), states.size(), edgeCount, manager.variableCount(), stopwatch));
    return new TransitionSystem(manager, problem, states, labels, actions, relations, weights, observation,
        goalRegion, problem.initialState(), statistics);
  }

  private int conjunction(Action action, Set<Integer> predicates, StateEncoder<State> states, boolean next) {
    int result = manager.trueNode();
    for (int predicate : predicates) {
      State fact = State.of(predicate);
      int cube = next ? states.nextCube(fact) : states.cube(fact);
      int newResult = manager.and(result, cube);
      manager.release(result);
      result = newResult;
    }
    if (manager.isFalse(result)) {
      throw new ConfigurationException(("Action %s needs several facts at once; direct construction encodes one "
          + "fact per state, use the incremental construction").formatted(action));
    }
    return result;
  }
}
