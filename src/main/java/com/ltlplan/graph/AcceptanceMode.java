package com.ltlplan.graph;

/** How several task automata combine into one acceptance condition. */
public enum AcceptanceMode {
  /** All automata advance together and must accept at the same time. */
  CONJUNCTIVE,
  /** Automata are worked off in order; an automaton only moves once all earlier ones accept, and then freezes. */
  SEQUENTIAL
}
