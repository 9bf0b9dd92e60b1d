package com.ltlplan.model;

import static com.google.common.base.Preconditions.checkArgument;

import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import java.util.List;
import java.util.Set;

/**
 * Finite automaton for one LTLf task, with states {@code 0 .. size-1}. The automaton reads the label of every state
 * the system enters, including the initial one.
 */
public final class Automaton {
  private final String name;
  private final int size;
  private final int initialState;
  private final IntSet accepting;
  private final List<Edge> edges;

  public Automaton(String name, int size, int initialState, IntSet accepting, List<Edge> edges) {
    checkArgument(size > 0, "Automaton %s has no states", name);
    checkArgument(0 <= initialState && initialState < size, "Initial state %s out of range", initialState);
    accepting.forEach(q -> checkArgument(0 <= q && q < size, "Accepting state %s out of range", q));
    edges.forEach(edge -> checkArgument(0 <= edge.source() && edge.source() < size
        && 0 <= edge.target() && edge.target() < size, "Edge %s out of range", edge));
    this.name = name;
    this.size = size;
    this.initialState = initialState;
    this.accepting = IntSets.unmodifiable(new IntLinkedOpenHashSet(accepting));
    this.edges = List.copyOf(edges);
  }

  public String name() {
    return name;
  }

  public int size() {
    return size;
  }

  public int initialState() {
    return initialState;
  }

  public IntSet accepting() {
    return accepting;
  }

  public boolean isAccepting(int state) {
    return accepting.contains(state);
  }

  public List<Edge> edges() {
    return edges;
  }

  public IntSet successors(int state, Set<String> label) {
    IntSet successors = new IntLinkedOpenHashSet();
    for (Edge edge : edges) {
      if (edge.source() == state && edge.guard().test(label)) {
        successors.add(edge.target());
      }
    }
    return successors;
  }

  @Override
  public String toString() {
    return "%s[%d states, init %d, acc %s]".formatted(name, size, initialState, accepting);
  }

  public record Edge(int source, Guard guard, int target) {
    @Override
    public String toString() {
      return source + " -[" + guard + "]-> " + target;
    }
  }
}
