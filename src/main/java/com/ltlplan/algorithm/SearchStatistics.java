package com.ltlplan.algorithm;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

/** Per expansion, in order: its duration and the number of product states it expanded. */
public record SearchStatistics(int expansions, List<Duration> expansionTimes, List<BigInteger> frontierSizes) {
  public SearchStatistics {
    expansionTimes = List.copyOf(expansionTimes);
    frontierSizes = List.copyOf(frontierSizes);
  }

  public BigInteger expandedStates() {
    return frontierSizes.stream().reduce(BigInteger.ZERO, BigInteger::add);
  }

  public Duration totalTime() {
    return expansionTimes.stream().reduce(Duration.ZERO, Duration::plus);
  }
}
