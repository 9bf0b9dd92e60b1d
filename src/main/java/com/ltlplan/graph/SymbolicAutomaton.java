package com.ltlplan.graph;

import com.ltlplan.model.Automaton;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.symbolic.StateEncoder;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * Encoding of one task automaton over the labels observed in a system. Guards are evaluated against every known label,
 * so the relation {@code A(L, Q, Q')} only mentions labels that occur. If some state has no successor for a known
 * label, the automaton is completed with a rejecting sink.
 */
public final class SymbolicAutomaton {
  private static final Logger log = Logger.getLogger(SymbolicAutomaton.class.getName());

  private final BddManager manager;
  private final Automaton automaton;
  private final StateEncoder<Integer> states;
  private final int relation;
  private final int accepting;
  private final int[] distances;
  private final boolean completed;

  public SymbolicAutomaton(BddManager manager, Automaton automaton, StateEncoder<Set<String>> labels, int index) {
    this.manager = manager;
    this.automaton = automaton;
    List<Set<String>> knownLabels = labels.objects();

    int size = automaton.size();
    boolean incomplete = false;
    for (int q = 0; q < size; q++) {
      for (Set<String> label : knownLabels) {
        if (automaton.successors(q, label).isEmpty()) {
          incomplete = true;
        }
      }
    }
    this.completed = incomplete;
    int sink = incomplete ? size : -1;
    this.states = StateEncoder.paired(manager, "q" + index,
        IntStream.range(0, incomplete ? size + 1 : size).boxed().toList());

    int relation = manager.falseNode();
    for (Automaton.Edge edge : automaton.edges()) {
      int guard = manager.falseNode();
      for (Set<String> label : knownLabels) {
        if (edge.guard().test(label)) {
          guard = replace(guard, manager.or(guard, labels.cube(label)));
        }
      }
      int move = manager.and(states.cube(edge.source()), states.nextCube(edge.target()));
      int guarded = manager.and(move, guard);
      relation = replace(relation, manager.or(relation, guarded));
      manager.release(move);
      manager.release(guarded);
      manager.release(guard);
    }
    if (incomplete) {
      for (int q = 0; q < size; q++) {
        for (Set<String> label : knownLabels) {
          if (automaton.successors(q, label).isEmpty()) {
            int move = manager.and(states.cube(q), states.nextCube(sink));
            int guarded = manager.and(move, labels.cube(label));
            relation = replace(relation, manager.or(relation, guarded));
            manager.release(move);
            manager.release(guarded);
          }
        }
      }
      int loop = manager.and(states.cube(sink), states.nextCube(sink));
      int guarded = manager.and(loop, labels.domain());
      relation = replace(relation, manager.or(relation, guarded));
      manager.release(loop);
      manager.release(guarded);
      log.fine(() -> "Completed automaton %s with rejecting sink %d".formatted(automaton.name(), sink));
    }
    this.relation = relation;

    int accepting = manager.falseNode();
    for (int q : automaton.accepting()) {
      accepting = replace(accepting, manager.or(accepting, states.cube(q)));
    }
    this.accepting = accepting;
    this.distances = distances(automaton, knownLabels, states.size());
  }

  private int replace(int old, int fresh) {
    manager.release(old);
    return fresh;
  }

  /** Shortest number of steps to an accepting state, using only edges some known label enables. */
  private static int[] distances(Automaton automaton, List<Set<String>> labels, int size) {
    List<IntList> predecessors = new ArrayList<>();
    for (int q = 0; q < size; q++) {
      predecessors.add(new IntArrayList());
    }
    for (Automaton.Edge edge : automaton.edges()) {
      if (labels.stream().anyMatch(edge.guard()::test)) {
        predecessors.get(edge.target()).add(edge.source());
      }
    }
    int[] distances = new int[size];
    Arrays.fill(distances, Integer.MAX_VALUE);
    IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
    for (int q : automaton.accepting()) {
      distances[q] = 0;
      queue.enqueue(q);
    }
    while (!queue.isEmpty()) {
      int q = queue.dequeueInt();
      IntList sources = predecessors.get(q);
      for (int i = 0; i < sources.size(); i++) {
        int source = sources.getInt(i);
        if (distances[source] == Integer.MAX_VALUE) {
          distances[source] = distances[q] + 1;
          queue.enqueue(source);
        }
      }
    }
    return distances;
  }

  public Automaton automaton() {
    return automaton;
  }

  public StateEncoder<Integer> states() {
    return states;
  }

  /** Transition relation {@code A(L, Q, Q')}. */
  public int relation() {
    return relation;
  }

  /** Accepting states over the current pool. */
  public int accepting() {
    return accepting;
  }

  /** Distance to acceptance per state code; {@link Integer#MAX_VALUE} where acceptance is unreachable. */
  public int distance(int state) {
    return distances[state];
  }

  public int size() {
    return states.size();
  }

  public boolean isCompleted() {
    return completed;
  }

  /** Identity relation {@code Q' = Q}. */
  public int identity() {
    int identity = manager.trueNode();
    for (int j = 0; j < states.current().width(); j++) {
      int bit = manager.equivalent(states.current().variable(j), states.next().variable(j));
      identity = replace(identity, manager.and(identity, bit));
      manager.release(bit);
    }
    return identity;
  }

  @Override
  public String toString() {
    return "SymbolicAutomaton[%s%s]".formatted(automaton, completed ? " + sink" : "");
  }
}
