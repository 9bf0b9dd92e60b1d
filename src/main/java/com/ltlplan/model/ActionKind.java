package com.ltlplan.model;

import java.util.Locale;

/**
 * Classification of a grounded action by its schema name. Parsed once when the action is created, so later stages
 * never look at the action string again.
 */
public enum ActionKind {
  TRANSIT, GRASP, TRANSFER, RELEASE, HUMAN_MOVE, MOVE, GENERIC;

  public static ActionKind ofSchema(String schema) {
    String normalized = schema.toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "transit" -> TRANSIT;
      case "grasp" -> GRASP;
      case "transfer" -> TRANSFER;
      case "release" -> RELEASE;
      case "human-move", "human_move", "human" -> HUMAN_MOVE;
      default -> normalized.startsWith("move") ? MOVE : GENERIC;
    };
  }

  public Player defaultPlayer() {
    return this == HUMAN_MOVE ? Player.ENVIRONMENT : Player.SYSTEM;
  }

  /** Whether the destination location must not be occupied by another object. */
  public boolean requiresFreeDestination() {
    return switch (this) {
      case TRANSFER, RELEASE, HUMAN_MOVE -> true;
      case TRANSIT, GRASP, MOVE, GENERIC -> false;
    };
  }

  /** Whether the first argument names the manipulated object. */
  public boolean movesObject() {
    return switch (this) {
      case GRASP, TRANSFER, RELEASE, HUMAN_MOVE -> true;
      case TRANSIT, MOVE, GENERIC -> false;
    };
  }
}
