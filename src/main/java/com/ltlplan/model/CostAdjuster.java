package com.ltlplan.model;

/** Rewrites the weight of an action before it enters the symbolic encoding. */
@FunctionalInterface
public interface CostAdjuster {
  CostAdjuster IDENTITY = (action, weight) -> weight;

  int adjust(Action action, int weight);
}
