package com.ltlplan.algorithm;

import java.time.Duration;
import java.util.List;

/**
 * Result of solving a reachability game. {@code iterations} counts the controllable-predecessor computations up to
 * and including the one that confirmed the fixed point.
 */
public record GameSolution(Outcome outcome, int winningRegion, Strategy strategy, int iterations,
                           List<Duration> iterationTimes) {
  public enum Outcome {
    WINNING, NO_WINNING_STRATEGY
  }

  public GameSolution {
    iterationTimes = List.copyOf(iterationTimes);
  }

  public boolean isWinning() {
    return outcome == Outcome.WINNING;
  }
}
