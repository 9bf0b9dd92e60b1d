package com.ltlplan.algorithm;

import com.ltlplan.graph.ProductState;
import com.ltlplan.model.Action;
import com.ltlplan.model.InvariantViolationException;
import com.ltlplan.model.State;
import java.util.ArrayList;
import java.util.List;

/** A plan through the product, starting in an initial product state. */
public record Plan(ProductState initialState, List<Step> steps, int cost) {
  public Plan {
    steps = List.copyOf(steps);
  }

  public List<Action> actions() {
    return steps.stream().map(Step::action).toList();
  }

  public int length() {
    return steps.size();
  }

  public ProductState finalState() {
    return steps.isEmpty() ? initialState : steps.get(steps.size() - 1).target();
  }

  /** Re-executes the actions on the explicit states and returns the visited states, initial state included. */
  public List<State> replay() {
    List<State> visited = new ArrayList<>(steps.size() + 1);
    State current = initialState.state();
    visited.add(current);
    for (Step step : steps) {
      if (!step.action().isApplicable(current)) {
        throw new InvariantViolationException("Action %s not applicable in %s".formatted(step.action(), current));
      }
      current = current.apply(step.action());
      if (!current.equals(step.target().state())) {
        throw new InvariantViolationException("Action %s leads to %s instead of %s"
            .formatted(step.action(), current, step.target().state()));
      }
      visited.add(current);
    }
    return visited;
  }

  public record Step(Action action, ProductState target) {
    @Override
    public String toString() {
      return action + " -> " + target;
    }
  }
}
