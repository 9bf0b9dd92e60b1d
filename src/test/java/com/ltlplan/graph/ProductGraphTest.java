package com.ltlplan.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

import com.ltlplan.Problems;
import com.ltlplan.model.Automaton;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.State;
import com.ltlplan.symbolic.BddManager;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ProductGraphTest {
  private static int actionIndex(TransitionSystem system, String name) {
    for (int i = 0; i < system.actions().size(); i++) {
      if (system.action(i).name().equals(name)) {
        return i;
      }
    }
    throw new AssertionError(name);
  }

  @Test
  public void testInitialStateReadsInitialLabel() {
    PlanningProblem problem = Problems.builder("start-on-b")
        .initial("(at r c2)")
        .observe("(at r c2)", "b")
        .move("c2", "c0")
        .build();
    TransitionSystem system = new IncrementalRelationBuilder(new BddManager(), problem).build();
    ProductGraph product = new ProductGraph(system, List.of(Problems.eventually("b")), AcceptanceMode.CONJUNCTIVE);
    ProductState initial = product.initialState().orElseThrow();
    assertThat(initial.automatonStates(), contains(1));
    assertThat(product.isAccepting(initial), is(true));
  }

  @Test
  public void testImageAdvancesAutomaton() {
    PlanningProblem problem = Problems.triangle();
    BddManager manager = new BddManager();
    TransitionSystem system = new IncrementalRelationBuilder(manager, problem).build();
    ProductGraph product = new ProductGraph(system, List.of(Problems.eventually("a")), AcceptanceMode.CONJUNCTIVE);
    int toC1 = actionIndex(system, "(move r c0 c1)");
    int image = product.image(product.initial(), system.relation(toC1));
    State c1 = State.of(problem.predicates().id("(at r c1)"));
    assertThat(product.states(image), is(Set.of(new ProductState(c1, List.of(1)))));

    State c0 = State.of(problem.predicates().id("(at r c0)"));
    int back = product.preImage(image, system.relation(toC1));
    assertThat(product.states(back), is(Set.of(new ProductState(c0, List.of(0)), new ProductState(c0, List.of(1)))));
  }

  @Test
  public void testSequentialFreezesLaterAutomata() {
    PlanningProblem problem = Problems.triangle();
    BddManager manager = new BddManager();
    TransitionSystem system = new IncrementalRelationBuilder(manager, problem).build();
    ProductGraph product = new ProductGraph(system,
        List.of(Problems.eventually("a"), Problems.eventually("b")), AcceptanceMode.SEQUENTIAL);
    int toC2 = actionIndex(system, "(move r c0 c2)");
    int image = product.image(product.initial(), system.relation(toC2));
    State c2 = State.of(problem.predicates().id("(at r c2)"));
    assertThat(product.states(image), is(Set.of(new ProductState(c2, List.of(0, 0)))));

    ProductGraph conjunctive = new ProductGraph(system,
        List.of(Problems.eventually("a"), Problems.eventually("b")), AcceptanceMode.CONJUNCTIVE);
    int conjunctiveImage = conjunctive.image(conjunctive.initial(), system.relation(toC2));
    assertThat(conjunctive.states(conjunctiveImage), is(Set.of(new ProductState(c2, List.of(0, 1)))));
  }

  @Test
  public void testIncompleteAutomatonGetsSink() {
    PlanningProblem problem = Problems.triangle();
    TransitionSystem system = new IncrementalRelationBuilder(new BddManager(), problem).build();
    Automaton onlyA = new Automaton("X a", 2, 0, IntSet.of(1), List.of(
        new Automaton.Edge(0, Problems.guard("a"), 1),
        new Automaton.Edge(1, Problems.guard("a"), 1)));
    ProductGraph product = new ProductGraph(system, List.of(onlyA), AcceptanceMode.CONJUNCTIVE);
    SymbolicAutomaton automaton = product.automata().get(0);
    assertThat(automaton.isCompleted(), is(true));
    assertThat(automaton.size(), is(3));
    ProductState initial = product.initialState().orElseThrow();
    assertThat(initial.automatonStates(), contains(2));
    assertThat(automaton.distance(2), is(Integer.MAX_VALUE));
  }
}
