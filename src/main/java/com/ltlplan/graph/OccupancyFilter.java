package com.ltlplan.graph;

import com.ltlplan.model.Action;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.PredicateTable;
import com.ltlplan.model.State;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.HashMap;
import java.util.Map;

/**
 * Forbids putting an object onto a location occupied by another object. Applies to actions whose kind requires a free
 * destination; occupancy is read from the {@code (on <object> <location>)} predicates.
 */
public final class OccupancyFilter implements ActionFilter {
  private final PlanningProblem problem;
  private final Map<String, IntList> blockers = new HashMap<>();

  public OccupancyFilter(PlanningProblem problem) {
    this.problem = problem;
  }

  @Override
  public boolean admits(Action action, State state) {
    IntList blocking = blockers.computeIfAbsent(action.name(), name -> blockers(action));
    for (int i = 0; i < blocking.size(); i++) {
      if (state.contains(blocking.getInt(i))) {
        return false;
      }
    }
    return true;
  }

  private IntList blockers(Action action) {
    IntList result = new IntArrayList();
    if (action.destination().isEmpty()) {
      return result;
    }
    String destination = action.destination().get();
    String moved = action.object().orElse(null);
    PredicateTable table = problem.predicates();
    for (String object : problem.objects()) {
      if (object.equals(moved)) {
        continue;
      }
      String occupied = "(on %s %s)".formatted(object, destination);
      if (table.contains(occupied)) {
        result.add(table.id(occupied));
      }
    }
    return result;
  }
}
