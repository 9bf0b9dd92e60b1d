package com.ltlplan.algorithm;

import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.ProductState;
import com.ltlplan.graph.TransitionSystem;
import com.ltlplan.model.InvariantViolationException;
import com.ltlplan.symbolic.BddManager;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Shared machinery of the forward searches. Every expanded frontier is recorded as a round together with its cost;
 * plans are recovered by walking the rounds backwards with pre-images. Rounds live for one call of {@link #search()}
 * only; its statistics are kept until the next call.
 */
public abstract class SymbolicSearch {
  protected final ProductGraph product;
  protected final TransitionSystem system;
  protected final BddManager manager;
  private final List<Round> rounds = new ArrayList<>();
  private final List<Duration> roundTimes = new ArrayList<>();
  private final List<BigInteger> frontierSizes = new ArrayList<>();

  protected SymbolicSearch(ProductGraph product, TransitionSystem system) {
    if (product.system() != system) {
      throw new IllegalArgumentException("Product is not built over the given system");
    }
    this.product = product;
    this.system = system;
    this.manager = system.manager();
  }

  /** Searches for a plan reaching the product target; empty if the target is unreachable. */
  public final Optional<Plan> search() {
    roundTimes.clear();
    frontierSizes.clear();
    try {
      return expand();
    } finally {
      releaseRounds();
    }
  }

  /** Runs the engine's expansion loop, recording every expanded frontier before expanding it. */
  protected abstract Optional<Plan> expand();

  /** Cost of taking the given action in the search's metric. */
  protected abstract int cost(int action);

  public SearchStatistics statistics() {
    return new SearchStatistics(roundTimes.size(), roundTimes, frontierSizes);
  }

  protected int image(int set, int action) {
    return product.image(set, system.relation(action));
  }

  protected void record(int cost, int frontier, Duration time) {
    rounds.add(new Round(cost, manager.retain(frontier)));
    roundTimes.add(time);
    frontierSizes.add(product.size(frontier));
  }

  /**
   * Walks back from some state of {@code goal}, which must lie in the last recorded round. In each round the
   * predecessor is found by the lowest-indexed action whose pre-image meets an earlier round of matching cost.
   */
  protected Plan reconstruct(int goal) {
    int round = rounds.size() - 1;
    ProductState state = product.pick(goal);
    Deque<Plan.Step> steps = new ArrayDeque<>();
    int totalWeight = 0;
    while (round > 0) {
      int cost = rounds.get(round).cost();
      int cube = product.cube(state);
      boolean found = false;
      for (int action = 0; action < system.actions().size() && !found; action++) {
        int predecessors = product.preImage(cube, system.relation(action));
        for (int earlier = 0; earlier < round; earlier++) {
          Round candidate = rounds.get(earlier);
          if (candidate.cost() + cost(action) != cost) {
            continue;
          }
          int common = manager.and(predecessors, candidate.set());
          if (!manager.isFalse(common)) {
            steps.addFirst(new Plan.Step(system.action(action), state));
            totalWeight += system.weight(action);
            state = product.pick(common);
            round = earlier;
            found = true;
            manager.release(common);
            break;
          }
          manager.release(common);
        }
        manager.release(predecessors);
      }
      manager.release(cube);
      if (!found) {
        throw new InvariantViolationException("No predecessor of %s in earlier rounds".formatted(state));
      }
    }
    assert product.contains(product.initial(), state);
    return new Plan(state, List.copyOf(steps), totalWeight);
  }

  private void releaseRounds() {
    rounds.forEach(round -> manager.release(round.set()));
    rounds.clear();
  }

  protected record Round(int cost, int set) {}
}
