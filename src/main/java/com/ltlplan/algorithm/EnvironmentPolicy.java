package com.ltlplan.algorithm;

import java.util.Comparator;
import java.util.List;

/** Chooses the environment's answer while playing out a strategy. */
@FunctionalInterface
public interface EnvironmentPolicy {
  /** Always lets the environment stay idle. */
  EnvironmentPolicy IDLE = (strategy, options) -> options.get(0);

  /** Picks the answer that keeps the play as far from the target as the strategy allows. */
  EnvironmentPolicy ADVERSARIAL = (strategy, options) -> options.stream()
      .max(Comparator.comparingInt(option -> strategy.rankOf(option.target()).orElse(Integer.MAX_VALUE)))
      .orElseThrow();

  /** Options are ordered by environment move, the idle answer first. */
  GameRun.Move choose(Strategy strategy, List<GameRun.Move> options);
}
