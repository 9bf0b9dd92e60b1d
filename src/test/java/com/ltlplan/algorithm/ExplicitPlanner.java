package com.ltlplan.algorithm;

import com.ltlplan.graph.OccupancyFilter;
import com.ltlplan.model.Action;
import com.ltlplan.model.Automaton;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.State;
import com.ltlplan.model.WeightTable;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.PriorityQueue;

/** Explicit Dijkstra over the product with a single automaton, used as reference. */
final class ExplicitPlanner {
  private ExplicitPlanner() {}

  private record Node(State state, int automatonState) {}

  private record Entry(Node node, int cost) {}

  static OptionalInt optimalCost(PlanningProblem problem, Automaton automaton, WeightTable weights) {
    OccupancyFilter filter = new OccupancyFilter(problem);
    Map<Node, Integer> distances = new HashMap<>();
    PriorityQueue<Entry> queue = new PriorityQueue<>(Comparator.comparingInt(Entry::cost));
    State initial = problem.initialState();
    for (int q : automaton.successors(automaton.initialState(), problem.label(initial))) {
      Node node = new Node(initial, q);
      distances.put(node, 0);
      queue.add(new Entry(node, 0));
    }
    while (!queue.isEmpty()) {
      Entry entry = queue.poll();
      if (entry.cost() > distances.get(entry.node())) {
        continue;
      }
      Node node = entry.node();
      if (automaton.isAccepting(node.automatonState()) && problem.isGoal(node.state())) {
        return OptionalInt.of(entry.cost());
      }
      for (Action action : problem.actions()) {
        if (!action.isApplicable(node.state()) || !filter.admits(action, node.state())) {
          continue;
        }
        State successor = node.state().apply(action);
        IntSet automatonSuccessors = automaton.successors(node.automatonState(), problem.label(successor));
        for (int q : automatonSuccessors) {
          Node next = new Node(successor, q);
          int cost = entry.cost() + weights.weight(action);
          if (cost < distances.getOrDefault(next, Integer.MAX_VALUE)) {
            distances.put(next, cost);
            queue.add(new Entry(next, cost));
          }
        }
      }
    }
    return OptionalInt.empty();
  }
}
