package com.ltlplan.algorithm;

import com.ltlplan.graph.ProductState;
import com.ltlplan.model.Action;
import java.util.List;
import java.util.Optional;

/** A finite play of the game: the system's action, the environment's answer and the resulting product state. */
public record GameRun(ProductState initialState, List<Move> moves) {
  public GameRun {
    moves = List.copyOf(moves);
  }

  public ProductState finalState() {
    return moves.isEmpty() ? initialState : moves.get(moves.size() - 1).target();
  }

  public record Move(Action system, Optional<Action> environment, ProductState target) {
    @Override
    public String toString() {
      return system + environment.map(action -> " / " + action).orElse(" / idle") + " -> " + target;
    }
  }
}
