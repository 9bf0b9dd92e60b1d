package com.ltlplan.algorithm;

import com.ltlplan.graph.GameArena;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.ProductState;
import com.ltlplan.model.Action;
import com.ltlplan.symbolic.BddManager;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/** Memoryless system strategy over product states, with the rank of every winning state. */
public final class Strategy {
  private final ProductGraph product;
  private final GameArena arena;
  private final BddManager manager;
  private final int moves;
  private final List<Integer> ranks;

  Strategy(ProductGraph product, GameArena arena, int moves, List<Integer> ranks) {
    this.product = product;
    this.arena = arena;
    this.manager = arena.manager();
    this.moves = moves;
    this.ranks = List.copyOf(ranks);
  }

  /** Relation {@code S(X, Q, Sys)} of the chosen moves. */
  public int moves() {
    return moves;
  }

  public int rankCount() {
    return ranks.size();
  }

  /** States first won in the given iteration; rank {@code 0} is the target. */
  public int rank(int rank) {
    return ranks.get(rank);
  }

  public OptionalInt rankOf(ProductState state) {
    for (int rank = 0; rank < ranks.size(); rank++) {
      if (product.contains(ranks.get(rank), state)) {
        return OptionalInt.of(rank);
      }
    }
    return OptionalInt.empty();
  }

  /** The prescribed system action; empty for target states and states outside the winning region. */
  public Optional<Action> move(ProductState state) {
    int cube = product.cube(state);
    int chosen = manager.and(cube, moves);
    manager.release(cube);
    if (manager.isFalse(chosen)) {
      return Optional.empty();
    }
    BitSet support = arena.systemSupport();
    BitSet assignment = manager.anyAssignment(chosen, support);
    manager.release(chosen);
    return Optional.of(arena.systemActions().get(arena.decodeSystemMove(assignment)));
  }

  public int systemIndex(Action action) {
    return arena.systemActions().indexOf(action);
  }
}
