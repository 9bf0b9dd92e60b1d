package com.ltlplan.graph;

import com.ltlplan.model.Action;
import com.ltlplan.model.State;

/** Additional validity constraint on applying an action in a state, on top of its preconditions. */
@FunctionalInterface
public interface ActionFilter {
  ActionFilter ALL = (action, state) -> true;

  boolean admits(Action action, State state);
}
