package com.ltlplan.parser;

import com.ltlplan.model.Automaton;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.WeightTable;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nullable;

/** A parsed input file: the problem, its task automata and, if given, the weights and expected results. */
public record ProblemInstance(PlanningProblem problem, List<Automaton> automata, @Nullable WeightTable weights,
                              @Nullable Integer expectedCost, @Nullable Boolean expectedWinning) {
  public ProblemInstance {
    automata = List.copyOf(automata);
  }

  public Optional<WeightTable> weightTable() {
    return Optional.ofNullable(weights);
  }

  public OptionalInt expectedPlanCost() {
    return expectedCost == null ? OptionalInt.empty() : OptionalInt.of(expectedCost);
  }

  public Optional<Boolean> expectedWinningStrategy() {
    return Optional.ofNullable(expectedWinning);
  }
}
