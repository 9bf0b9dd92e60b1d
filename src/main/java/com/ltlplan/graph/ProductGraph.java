package com.ltlplan.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.ltlplan.model.Automaton;
import com.ltlplan.model.State;
import com.ltlplan.symbolic.BddManager;
import com.ltlplan.symbolic.StateEncoder;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Synchronous product of a labelled system with one or more task automata. Product states live over {@code X} and
 * all {@code Q_k}; automata read the label of the state being entered. The per-automaton step relations
 * {@code P_k(X', Q_k, Q'_k)} are conjoined lazily with a system relation during image computation, the monolithic
 * product relation is never built. A counter of remaining environment interventions, if the system has one, is
 * treated as part of {@code X}.
 */
public final class ProductGraph {
  private static final Logger log = Logger.getLogger(ProductGraph.class.getName());

  private final BddManager manager;
  private final LabelledSystem system;
  private final List<SymbolicAutomaton> automata;
  private final AcceptanceMode mode;
  private final int[] steps;
  private final int[] reads;
  private final int[] currentVariables;
  private final int[] nextVariables;
  private final BitSet currentSupport;
  private final BitSet nextSupport;
  private final BitSet systemSupport;
  @Nullable
  private final StateEncoder<Integer> interventions;
  private final int domain;
  private final int accepting;
  private final int target;
  private final int initial;
  @Nullable
  private final ProductState initialState;

  public ProductGraph(LabelledSystem system, List<Automaton> automata, AcceptanceMode mode) {
    checkArgument(!automata.isEmpty(), "At least one automaton required");
    this.manager = system.manager();
    this.system = system;
    this.mode = mode;
    List<SymbolicAutomaton> encoded = new ArrayList<>();
    for (int k = 0; k < automata.size(); k++) {
      encoded.add(new SymbolicAutomaton(manager, automata.get(k), system.labels(), k));
    }
    this.automata = List.copyOf(encoded);

    StateEncoder<State> states = system.states();
    this.interventions = system.interventions().orElse(null);
    IntList current = new IntArrayList(states.current().variables());
    IntList next = new IntArrayList(states.next().variables());
    int domain = manager.retain(states.domain());
    BitSet systemSupport = states.current().support();
    if (interventions != null) {
      current.addAll(IntArrayList.wrap(interventions.current().variables()));
      next.addAll(IntArrayList.wrap(interventions.next().variables()));
      domain = replace(domain, manager.and(domain, interventions.domain()));
      systemSupport.or(interventions.current().support());
    }
    int accepting = manager.trueNode();
    for (SymbolicAutomaton automaton : encoded) {
      current.addAll(IntArrayList.wrap(automaton.states().current().variables()));
      next.addAll(IntArrayList.wrap(automaton.states().next().variables()));
      domain = replace(domain, manager.and(domain, automaton.states().domain()));
      accepting = replace(accepting, manager.and(accepting, automaton.accepting()));
    }
    this.currentVariables = current.toIntArray();
    this.nextVariables = next.toIntArray();
    this.currentSupport = support(currentVariables);
    this.nextSupport = support(nextVariables);
    this.systemSupport = systemSupport;
    this.domain = domain;
    this.accepting = accepting;
    int goal = manager.and(system.goalRegion(), accepting);
    this.target = manager.and(goal, domain);
    manager.release(goal);

    BitSet labelSupport = system.labels().current().support();
    int observation = system.observation();
    int nextObservation = states.toNext(observation);
    this.steps = new int[encoded.size()];
    this.reads = new int[encoded.size()];
    for (int k = 0; k < encoded.size(); k++) {
      steps[k] = step(k, nextObservation, labelSupport);
      reads[k] = step(k, observation, labelSupport);
    }
    manager.release(nextObservation);

    int start = manager.retain(states.cube(system.initialState()));
    if (interventions != null) {
      start = replace(start, manager.and(start, interventions.cube(interventions.size() - 1)));
    }
    for (SymbolicAutomaton automaton : encoded) {
      start = replace(start, manager.and(start, automaton.states().cube(automaton.automaton().initialState())));
    }
    this.initial = read(start);
    manager.release(start);
    this.initialState = manager.isFalse(initial) ? null : pick(initial);
    log.fine(() -> "Product of %s with %d automata (%s), %d variables".formatted(
        system.problem().name(), encoded.size(), mode, manager.variableCount()));
  }

  private static BitSet support(int[] variables) {
    BitSet support = new BitSet();
    for (int variable : variables) {
      support.set(variable);
    }
    return support;
  }

  private int replace(int old, int fresh) {
    manager.release(old);
    return fresh;
  }

  /**
   * Step relation of automaton {@code k}, reading labels through the given observation. In sequential mode the
   * automaton keeps its state while it accepts or while an earlier automaton does not yet accept.
   */
  private int step(int k, int observation, BitSet labelSupport) {
    SymbolicAutomaton automaton = automata.get(k);
    int labelled = manager.and(observation, automaton.relation());
    int step = manager.exists(labelled, labelSupport);
    manager.release(labelled);
    if (mode == AcceptanceMode.CONJUNCTIVE) {
      return step;
    }
    int earlierAccepting = manager.trueNode();
    for (int j = 0; j < k; j++) {
      earlierAccepting = replace(earlierAccepting, manager.and(earlierAccepting, automata.get(j).accepting()));
    }
    int frozen = automaton.identity();
    int scheduled = manager.ifThenElse(earlierAccepting, step, frozen);
    int result = manager.ifThenElse(automaton.accepting(), frozen, scheduled);
    for (int node : new int[] {earlierAccepting, frozen, scheduled, step}) {
      manager.release(node);
    }
    return result;
  }

  /** Lets the automata read the label of the system state, for a set over {@code X} and all {@code Q_k}. */
  private int read(int set) {
    int result = manager.retain(set);
    for (int k = automata.size() - 1; k >= 0; k--) {
      int conjoined = manager.and(result, reads[k]);
      manager.release(result);
      result = manager.exists(conjoined, automata.get(k).states().current().support());
      manager.release(conjoined);
    }
    return renameAutomata(result);
  }

  private int renameAutomata(int node) {
    IntList from = new IntArrayList();
    IntList to = new IntArrayList();
    for (SymbolicAutomaton automaton : automata) {
      from.addAll(IntArrayList.wrap(automaton.states().next().variables()));
      to.addAll(IntArrayList.wrap(automaton.states().current().variables()));
    }
    int renamed = manager.rename(node, from.toIntArray(), to.toIntArray());
    manager.release(node);
    return renamed;
  }

  /**
   * Successors of {@code set} under a system relation over {@code X}, {@code X'} and the given extra variables, which
   * are quantified away together with {@code X}.
   */
  public int image(int set, int relation, BitSet extraVariables) {
    int conjoined = manager.and(set, relation);
    BitSet quantified = (BitSet) systemSupport.clone();
    quantified.or(extraVariables);
    int result = manager.exists(conjoined, quantified);
    manager.release(conjoined);
    for (int k = automata.size() - 1; k >= 0; k--) {
      int stepped = manager.and(result, steps[k]);
      manager.release(result);
      result = manager.exists(stepped, automata.get(k).states().current().support());
      manager.release(stepped);
    }
    int renamed = manager.rename(result, nextVariables, currentVariables);
    manager.release(result);
    return renamed;
  }

  public int image(int set, int relation) {
    return image(set, relation, new BitSet());
  }

  /** Predecessors of {@code set} under a system relation; the extra variables are quantified away. */
  public int preImage(int set, int relation, BitSet extraVariables) {
    int primed = manager.rename(set, currentVariables, nextVariables);
    int result = manager.and(primed, relation);
    manager.release(primed);
    for (int k = 0; k < automata.size(); k++) {
      int stepped = manager.and(result, steps[k]);
      manager.release(result);
      result = stepped;
    }
    BitSet quantified = (BitSet) nextSupport.clone();
    quantified.or(extraVariables);
    int predecessors = manager.exists(result, quantified);
    manager.release(result);
    int restricted = manager.and(predecessors, domain);
    manager.release(predecessors);
    return restricted;
  }

  public int preImage(int set, int relation) {
    return preImage(set, relation, new BitSet());
  }

  /** The given set over {@code X'} and all {@code Q'_k}. */
  public int primed(int set) {
    return manager.rename(set, currentVariables, nextVariables);
  }

  public int cube(ProductState state) {
    int cube = manager.retain(system.states().cube(state.state()));
    if (interventions != null) {
      int remaining = state.interventions()
          .orElseThrow(() -> new IllegalArgumentException("State %s lacks an intervention count".formatted(state)));
      cube = replace(cube, manager.and(cube, interventions.cube(remaining)));
    }
    for (int k = 0; k < automata.size(); k++) {
      cube = replace(cube, manager.and(cube, automata.get(k).states().cube(state.automatonStates().get(k))));
    }
    return cube;
  }

  public ProductState decode(BitSet assignment) {
    State state = system.states().decode(assignment);
    List<Integer> automatonStates = new ArrayList<>(automata.size());
    for (SymbolicAutomaton automaton : automata) {
      automatonStates.add(automaton.states().decode(assignment));
    }
    OptionalInt remaining = interventions == null
        ? OptionalInt.empty()
        : OptionalInt.of(interventions.decode(assignment));
    return new ProductState(state, automatonStates, remaining);
  }

  /** The first product state of the set in path order. */
  public ProductState pick(int set) {
    return decode(manager.anyAssignment(set, currentSupport));
  }

  public Set<ProductState> states(int set) {
    Set<ProductState> states = new LinkedHashSet<>();
    manager.forEachAssignment(set, currentSupport, assignment -> states.add(decode(assignment)));
    return states;
  }

  /** Number of product states in {@code set}, which must lie within {@link #domain()}. */
  public BigInteger size(int set) {
    return manager.countAssignments(set, currentSupport);
  }

  public boolean contains(int set, ProductState state) {
    int cube = cube(state);
    int common = manager.and(cube, set);
    boolean contained = !manager.isFalse(common);
    manager.release(cube);
    manager.release(common);
    return contained;
  }

  public boolean isAccepting(ProductState state) {
    return contains(target, state);
  }

  public BddManager manager() {
    return manager;
  }

  public LabelledSystem system() {
    return system;
  }

  public List<SymbolicAutomaton> automata() {
    return automata;
  }

  public AcceptanceMode mode() {
    return mode;
  }

  /** Step relation {@code P_k} of the k-th automaton over {@code X'}, {@code Q_k} and {@code Q'_k}. */
  public int step(int k) {
    return steps[k];
  }

  public BitSet currentSupport() {
    return (BitSet) currentSupport.clone();
  }

  public BitSet nextSupport() {
    return (BitSet) nextSupport.clone();
  }

  /** All encoded product states. */
  public int domain() {
    return domain;
  }

  /** States over {@code Q} where every automaton accepts. */
  public int accepting() {
    return accepting;
  }

  /** Goal states of the system whose automata all accept. */
  public int target() {
    return target;
  }

  public int initial() {
    return initial;
  }

  /** The initial product state, empty if some automaton rejects the initial label outright. */
  public Optional<ProductState> initialState() {
    return Optional.ofNullable(initialState);
  }

  @Override
  public String toString() {
    return "ProductGraph[%s x %s]".formatted(system, automata);
  }
}
