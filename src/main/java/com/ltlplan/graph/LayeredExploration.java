package com.ltlplan.graph;

import com.google.common.base.Stopwatch;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.State;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.symbolic.StateEncoder;
import com.ltlplan.util.Cancellation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Breadth-first unrolling of the reachable states, layer by layer. Open and closed sets are kept symbolically; states
 * of the current frontier are enumerated and handed to the expansion function. Every state reached is encoded and its
 * label recorded in the observation relation.
 */
final class LayeredExploration {
  private static final Logger log = Logger.getLogger(LayeredExploration.class.getName());

  private final BddManager manager;
  private final PlanningProblem problem;
  private final StateEncoder<State> states;
  private final StateEncoder<Set<String>> labels;
  private final List<Duration> layerTimes = new ArrayList<>();
  private final Set<State> observed = new HashSet<>();
  private int observation;

  LayeredExploration(BddManager manager, PlanningProblem problem, StateEncoder<State> states,
      StateEncoder<Set<String>> labels) {
    this.manager = manager;
    this.problem = problem;
    this.states = states;
    this.labels = labels;
    this.observation = manager.falseNode();
  }

  void run(State initial, Function<State, Collection<State>> expand) {
    observe(initial);
    int open = manager.retain(states.cube(initial));
    int closed = manager.falseNode();
    int layer = 0;
    while (true) {
      Cancellation.check("layer %d of the state-space construction".formatted(layer));
      Stopwatch stopwatch = Stopwatch.createStarted();
      int frontier = manager.andNot(open, closed);
      manager.release(open);
      if (manager.isFalse(frontier)) {
        break;
      }
      int newClosed = manager.or(closed, frontier);
      manager.release(closed);
      closed = newClosed;

      int next = manager.falseNode();
      for (State state : states.decodeAll(frontier)) {
        for (State successor : expand.apply(state)) {
          observe(successor);
          int newNext = manager.or(next, states.cube(successor));
          manager.release(next);
          next = newNext;
        }
      }
      manager.release(frontier);
      open = next;
      layerTimes.add(stopwatch.elapsed());
      int currentLayer = layer;
      log.log(Level.FINE, () -> "Layer %d explored in %s, %d states known"
          .formatted(currentLayer, stopwatch, states.size()));
      layer++;
    }
    manager.release(closed);
  }

  private void observe(State state) {
    if (!observed.add(state)) {
      return;
    }
    int label = manager.and(states.cube(state), labels.cube(problem.label(state)));
    int newObservation = manager.or(observation, label);
    manager.release(observation);
    manager.release(label);
    observation = newObservation;
  }

  int observation() {
    return observation;
  }

  List<Duration> layerTimes() {
    return layerTimes;
  }

  /** Disjunction of all encoded states containing the goal facts. */
  static int goalRegion(BddManager manager, PlanningProblem problem, StateEncoder<State> states) {
    int region = manager.falseNode();
    for (State state : states.objects()) {
      if (problem.isGoal(state)) {
        int newRegion = manager.or(region, states.cube(state));
        manager.release(region);
        region = newRegion;
      }
    }
    return region;
  }
}
