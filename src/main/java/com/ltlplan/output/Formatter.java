package com.ltlplan.output;

import com.ltlplan.algorithm.GameRun;
import com.ltlplan.algorithm.GameSolution;
import com.ltlplan.algorithm.Plan;
import com.ltlplan.algorithm.SearchStatistics;
import com.ltlplan.graph.BuildStatistics;
import com.ltlplan.graph.ProductState;
import com.ltlplan.model.PredicateTable;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

public final class Formatter {
  private Formatter() {}

  public static String format(ProductState state, PredicateTable table) {
    return state.format(table);
  }

  public static void writePlan(Plan plan, PredicateTable table, PrintStream stream) {
    stream.printf("plan: %d actions, cost %d%n", plan.length(), plan.cost());
    stream.printf("  %s%n", format(plan.initialState(), table));
    for (Plan.Step step : plan.steps()) {
      stream.printf("  %s -> %s%n", step.action().name(), format(step.target(), table));
    }
  }

  public static void writeGame(GameSolution solution, PrintStream stream) {
    stream.printf("game: %s after %d iterations, %d ranks%n", solution.outcome(), solution.iterations(),
        solution.strategy().rankCount());
  }

  public static void writeRun(GameRun run, PredicateTable table, PrintStream stream) {
    stream.printf("  %s%n", format(run.initialState(), table));
    for (GameRun.Move move : run.moves()) {
      stream.printf("  %s / %s -> %s%n", move.system().name(),
          move.environment().map(action -> action.name()).orElse("idle"), format(move.target(), table));
    }
  }

  public static String format(BuildStatistics statistics) {
    return "%d variables, %d states, %d edges, %d layers in %s".formatted(statistics.variables(),
        statistics.states(), statistics.edges(), statistics.layerTimes().size(), format(statistics.totalTime()));
  }

  public static String format(SearchStatistics statistics) {
    return "%d expansions of %s states in %s".formatted(statistics.expansions(), statistics.expandedStates(),
        format(statistics.totalTime()));
  }

  public static String formatTimes(List<Duration> times) {
    return times.stream().map(Formatter::format).collect(Collectors.joining(", ", "[", "]"));
  }

  private static String format(Duration duration) {
    return "%d.%03ds".formatted(duration.toSeconds(), duration.toMillisPart());
  }
}
