package com.ltlplan.graph;

import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.State;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.symbolic.StateEncoder;
import java.util.Optional;
import java.util.Set;

/** A symbolically encoded state space whose states carry labels over atomic propositions. */
public interface LabelledSystem {
  BddManager manager();

  PlanningProblem problem();

  StateEncoder<State> states();

  StateEncoder<Set<String>> labels();

  /**
   * Counter of remaining environment interventions, encoding the values {@code 0..bound} in order. When present it is
   * part of the system state and starts at {@code bound}.
   */
  default Optional<StateEncoder<Integer>> interventions() {
    return Optional.empty();
  }

  /** Observation relation {@code Obs(X, L)}: exactly one label per encoded state. */
  int observation();

  /** Encoded states containing all goal facts of the problem. */
  int goalRegion();

  State initialState();

  BuildStatistics statistics();
}
