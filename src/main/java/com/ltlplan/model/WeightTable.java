package com.ltlplan.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** Non-negative integer weights, keyed by action schema. */
public final class WeightTable {
  private final ImmutableMap<String, Integer> weights;

  public WeightTable(Map<String, Integer> weights) {
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    weights.forEach((schema, weight) -> {
      checkArgument(weight >= 0, "Negative weight %s for schema %s", weight, schema);
      builder.put(schema.toLowerCase(Locale.ROOT), weight);
    });
    this.weights = builder.buildOrThrow();
  }

  public static WeightTable uniform(Iterable<Action> actions, int weight) {
    Map<String, Integer> map = new HashMap<>();
    actions.forEach(action -> map.put(action.schema(), weight));
    return new WeightTable(map);
  }

  public int weight(Action action) {
    Integer weight = weights.get(action.schema().toLowerCase(Locale.ROOT));
    if (weight == null) {
      throw new ConfigurationException("No weight for action schema %s (action %s)"
          .formatted(action.schema(), action.name()));
    }
    return weight;
  }

  public int weight(Action action, CostAdjuster adjuster) {
    int adjusted = adjuster.adjust(action, weight(action));
    if (adjusted < 0) {
      throw new ConfigurationException("Adjusted weight %d of action %s is negative".formatted(adjusted, action));
    }
    return adjusted;
  }

  public Map<String, Integer> asMap() {
    return weights;
  }

  @Override
  public String toString() {
    return weights.toString();
  }
}
