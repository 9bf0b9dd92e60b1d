package com.ltlplan.algorithm;

import com.ltlplan.graph.GameArena;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.ProductState;
import com.ltlplan.model.Action;
import com.ltlplan.model.InvariantViolationException;
import com.ltlplan.symbolic.BddManager;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Plays a winning strategy from the initial state until the target is reached. The rank of the current state drops
 * with every move, so the play is never longer than the number of ranks.
 */
public final class StrategyRollout {
  private final ProductGraph product;
  private final GameArena arena;
  private final BddManager manager;
  private final BitSet moveSupport;

  public StrategyRollout(ProductGraph product, GameArena arena) {
    this.product = product;
    this.arena = arena;
    this.manager = arena.manager();
    this.moveSupport = arena.systemSupport();
    moveSupport.or(arena.environmentSupport());
  }

  public GameRun play(GameSolution solution, EnvironmentPolicy policy) {
    Strategy strategy = solution.strategy();
    ProductState initial = product.initialState()
        .orElseThrow(() -> new IllegalStateException("Product has no initial state"));
    if (!solution.isWinning()) {
      throw new IllegalStateException("Initial state %s is not winning".formatted(initial));
    }
    List<GameRun.Move> moves = new ArrayList<>();
    ProductState current = initial;
    while (!product.isAccepting(current)) {
      OptionalInt rank = strategy.rankOf(current);
      ProductState state = current;
      Action action = strategy.move(current)
          .orElseThrow(() -> new InvariantViolationException("No move prescribed in %s".formatted(state)));
      GameRun.Move chosen = policy.choose(strategy, options(current, action, strategy.systemIndex(action)));
      OptionalInt nextRank = strategy.rankOf(chosen.target());
      if (rank.isEmpty() || nextRank.isEmpty() || nextRank.getAsInt() >= rank.getAsInt()) {
        throw new InvariantViolationException("Move %s does not decrease the rank".formatted(chosen));
      }
      moves.add(chosen);
      current = chosen.target();
    }
    return new GameRun(initial, moves);
  }

  private List<GameRun.Move> options(ProductState state, Action action, int systemIndex) {
    List<GameRun.Move> options = new ArrayList<>();
    int cube = product.cube(state);
    int withSystem = manager.and(arena.relation(), arena.systemCube(systemIndex));
    for (int move = 0; move < arena.environmentMoveCount(); move++) {
      int relation = manager.and(withSystem, arena.environmentCube(move));
      int successors = product.image(cube, relation, moveSupport);
      manager.release(relation);
      if (!manager.isFalse(successors)) {
        Optional<Action> response = arena.environmentAction(move);
        for (ProductState successor : product.states(successors)) {
          options.add(new GameRun.Move(action, response, successor));
        }
      }
      manager.release(successors);
    }
    manager.release(withSystem);
    manager.release(cube);
    if (options.isEmpty()) {
      throw new InvariantViolationException("Action %s has no outcome in %s".formatted(action, state));
    }
    return options;
  }
}
