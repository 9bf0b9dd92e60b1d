package com.ltlplan.graph;

import java.time.Duration;
import java.util.List;

public record BuildStatistics(int variables, long edges, int states, List<Duration> layerTimes) {
  public BuildStatistics {
    layerTimes = List.copyOf(layerTimes);
  }

  public Duration totalTime() {
    return layerTimes.stream().reduce(Duration.ZERO, Duration::plus);
  }
}
