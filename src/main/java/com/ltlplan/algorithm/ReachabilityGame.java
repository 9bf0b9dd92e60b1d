package com.ltlplan.algorithm;

import com.google.common.base.Stopwatch;
import com.ltlplan.graph.GameArena;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.model.InvariantViolationException;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.util.Cancellation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Solves the reachability game on the product of a {@link GameArena} with the task automata. The winning region is
 * the least fixed point of {@code W = Target | CPre(W)}, where the system picks an action and then has to reach
 * {@code W} whatever the environment answers. The layers added in each iteration are the ranks from which the
 * memoryless strategy is extracted.
 */
public final class ReachabilityGame {
  private static final Logger log = Logger.getLogger(ReachabilityGame.class.getName());

  private final ProductGraph product;
  private final GameArena arena;
  private final BddManager manager;
  private final BitSet environmentAndNext;
  private final int enabled;

  public ReachabilityGame(ProductGraph product, GameArena arena) {
    if (product.system() != arena) {
      throw new IllegalArgumentException("Product is not built over the given arena");
    }
    this.product = product;
    this.arena = arena;
    this.manager = arena.manager();
    this.environmentAndNext = product.nextSupport();
    environmentAndNext.or(arena.environmentSupport());
    this.enabled = outcomes(manager.trueNode());
  }

  /**
   * Pairs {@code (state, system action)} having some environment answer that ends in {@code next}, which is a set over
   * the primed product variables.
   */
  private int outcomes(int next) {
    int moves = manager.and(arena.relation(), next);
    for (int k = 0; k < product.automata().size(); k++) {
      int stepped = manager.and(moves, product.step(k));
      manager.release(moves);
      moves = manager.exists(stepped, product.automata().get(k).states().next().support());
      manager.release(stepped);
    }
    int result = manager.exists(moves, environmentAndNext);
    manager.release(moves);
    return result;
  }

  /** Pairs {@code (state, system action)} such that every environment answer ends in {@code winning}. */
  private int safeMoves(int winning) {
    int losing = manager.andNot(product.domain(), winning);
    int primedLosing = product.primed(losing);
    manager.release(losing);
    int escapes = outcomes(primedLosing);
    manager.release(primedLosing);
    int safe = manager.andNot(enabled, escapes);
    manager.release(escapes);
    return safe;
  }

  private int controllablePredecessors(int winning) {
    int safe = safeMoves(winning);
    int states = manager.exists(safe, arena.systemSupport());
    manager.release(safe);
    int restricted = manager.and(states, product.domain());
    manager.release(states);
    return restricted;
  }

  public GameSolution solve() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<Integer> ranks = new ArrayList<>();
    List<Duration> iterationTimes = new ArrayList<>();
    int winning = manager.retain(product.target());
    ranks.add(manager.retain(winning));
    int iterations = 0;
    while (true) {
      Cancellation.check("game iteration " + iterations);
      Stopwatch iteration = Stopwatch.createStarted();
      iterations++;
      int predecessors = controllablePredecessors(winning);
      int next = manager.or(winning, predecessors);
      manager.release(predecessors);
      iterationTimes.add(iteration.elapsed());
      if (next == winning) {
        manager.release(next);
        break;
      }
      ranks.add(manager.andNot(next, winning));
      manager.release(winning);
      winning = next;
    }
    int fixedPoint = iterations;
    log.log(Level.FINE, () -> "Winning region fixed point after %d iterations, %d ranks, %s".formatted(
        fixedPoint, ranks.size(), stopwatch));

    int strategy = extractStrategy(ranks);
    boolean initialWinning = !manager.isFalse(product.initial())
        && product.contains(winning, product.initialState().orElseThrow());
    GameSolution.Outcome outcome = initialWinning
        ? GameSolution.Outcome.WINNING
        : GameSolution.Outcome.NO_WINNING_STRATEGY;
    Strategy winningStrategy = new Strategy(product, arena, strategy, ranks);
    return new GameSolution(outcome, winning, winningStrategy, iterations, iterationTimes);
  }

  /**
   * For every rank {@code r > 0}, assigns each state the lowest-indexed system action that forces the play into ranks
   * below {@code r}.
   */
  private int extractStrategy(List<Integer> ranks) {
    int strategy = manager.falseNode();
    int lower = manager.retain(ranks.get(0));
    for (int rank = 1; rank < ranks.size(); rank++) {
      int layer = ranks.get(rank);
      int safe = safeMoves(lower);
      int covered = manager.falseNode();
      for (int action = 0; action < arena.systemActions().size(); action++) {
        int withAction = manager.and(safe, arena.systemCube(action));
        int states = manager.exists(withAction, arena.systemSupport());
        manager.release(withAction);
        int inLayer = manager.and(states, layer);
        manager.release(states);
        int chosen = manager.andNot(inLayer, covered);
        manager.release(inLayer);
        if (!manager.isFalse(chosen)) {
          int move = manager.and(chosen, arena.systemCube(action));
          int newStrategy = manager.or(strategy, move);
          int newCovered = manager.or(covered, chosen);
          for (int node : new int[] {move, strategy, covered}) {
            manager.release(node);
          }
          strategy = newStrategy;
          covered = newCovered;
        }
        manager.release(chosen);
      }
      if (covered != layer) {
        throw new InvariantViolationException("Rank %d contains states without a winning move".formatted(rank));
      }
      manager.release(safe);
      manager.release(covered);
      int newLower = manager.or(lower, layer);
      manager.release(lower);
      lower = newLower;
    }
    manager.release(lower);
    return strategy;
  }
}
