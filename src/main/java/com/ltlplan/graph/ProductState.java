package com.ltlplan.graph;

import com.ltlplan.model.PredicateTable;
import com.ltlplan.model.State;
import java.util.List;
import java.util.OptionalInt;

/** A product state; {@code interventions} is the remaining environment budget in bounded games. */
public record ProductState(State state, List<Integer> automatonStates, OptionalInt interventions) {
  public ProductState {
    automatonStates = List.copyOf(automatonStates);
  }

  public ProductState(State state, List<Integer> automatonStates) {
    this(state, automatonStates, OptionalInt.empty());
  }

  public String format(PredicateTable table) {
    String formatted = state.format(table) + " x " + automatonStates;
    return interventions.isPresent() ? formatted + " k=" + interventions.getAsInt() : formatted;
  }
}
