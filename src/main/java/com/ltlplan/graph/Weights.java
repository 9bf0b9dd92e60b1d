package com.ltlplan.graph;

import com.ltlplan.model.Action;
import com.ltlplan.model.CostAdjuster;
import com.ltlplan.model.WeightTable;
import java.util.List;
import javax.annotation.Nullable;

final class Weights {
  private Weights() {}

  /** Weights of all actions, failing on the first action without an entry. Unweighted systems use unit weights. */
  static int[] of(List<Action> actions, @Nullable WeightTable table, CostAdjuster adjuster) {
    int[] weights = new int[actions.size()];
    for (int i = 0; i < weights.length; i++) {
      weights[i] = table == null ? 1 : table.weight(actions.get(i), adjuster);
    }
    return weights;
  }
}
