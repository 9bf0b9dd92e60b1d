package com.ltlplan.algorithm;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;

import com.ltlplan.Problems;
import com.ltlplan.graph.AcceptanceMode;
import com.ltlplan.graph.IncrementalRelationBuilder;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.TransitionSystem;
import com.ltlplan.model.Action;
import com.ltlplan.model.Automaton;
import com.ltlplan.model.CostAdjuster;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.WeightTable;
import com.ltlplan.symbolic.BddManager;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

public class DijkstraSearchTest {
  static final WeightTable GRID_WEIGHTS = new WeightTable(
      Map.of("moveright", 1, "moveleft", 2, "moveup", 3, "movedown", 1));

  static Optional<Plan> search(PlanningProblem problem, Automaton automaton, WeightTable weights) {
    TransitionSystem system = new IncrementalRelationBuilder(new BddManager(), problem, weights,
        CostAdjuster.IDENTITY).build();
    ProductGraph product = new ProductGraph(system, List.of(automaton), AcceptanceMode.CONJUNCTIVE);
    return new DijkstraSearch(product, system).search();
  }

  @Test
  public void testSingleTransfer() {
    Plan plan = search(Problems.oneObject(), Problems.eventually("b0_lb"),
        new WeightTable(Map.of("transfer", 1))).orElseThrow();
    assertThat(plan.cost(), is(1));
    assertThat(plan.length(), is(1));
  }

  @Test
  public void testPrefersCheaperLongerPlan() {
    Plan plan = search(Grids.shortcut(false), Problems.eventually("d"),
        new WeightTable(Map.of("jump", 5, "walk", 1))).orElseThrow();
    assertThat(plan.cost(), is(3));
    assertThat(plan.actions().stream().map(Action::name).toList(),
        contains("(walk r c0 c1)", "(walk r c1 c2)", "(walk r c2 c3)"));
    plan.replay();
  }

  @Test
  public void testZeroWeightActions() {
    Plan plan = search(Grids.shortcut(true), Problems.eventually("d"),
        new WeightTable(Map.of("jump", 5, "walk", 1, "slide", 0))).orElseThrow();
    assertThat(plan.cost(), is(2));
    assertThat(plan.actions().get(0).name(), is("(slide r c0 c1)"));
  }

  @Test
  public void testMatchesExplicitSearch() {
    PlanningProblem grid = Grids.grid(3, List.of("c11", "c22", "c02"));
    List<Automaton> tasks = List.of(
        Problems.eventually("p22"),
        Problems.avoidAndReach("p11", "p22"),
        Problems.avoidAndReach("p11", "p02"),
        Problems.avoidAndReach("p02", "p11"));
    for (Automaton task : tasks) {
      OptionalInt expected = ExplicitPlanner.optimalCost(grid, task, GRID_WEIGHTS);
      Optional<Plan> plan = search(grid, task, GRID_WEIGHTS);
      assertThat(plan.isPresent(), is(expected.isPresent()));
      assertThat(plan.map(Plan::cost).orElse(-1), is(expected.orElse(-1)));
      plan.ifPresent(Plan::replay);
    }
  }

  @Test
  public void testUnreachable() {
    Optional<Plan> plan = search(Grids.grid(2, List.of("c11")), Problems.avoidAndReach("p11", "p11"),
        GRID_WEIGHTS);
    assertThat(plan.isEmpty(), is(true));
  }

  @Test
  public void testRepeatedSearchOnOneInstance() {
    TransitionSystem system = new IncrementalRelationBuilder(new BddManager(), Grids.grid(3, List.of("c22")),
        GRID_WEIGHTS, CostAdjuster.IDENTITY).build();
    DijkstraSearch search = new DijkstraSearch(
        new ProductGraph(system, List.of(Problems.eventually("p22")), AcceptanceMode.CONJUNCTIVE), system);
    Plan first = search.search().orElseThrow();
    SearchStatistics statistics = search.statistics();
    Plan second = search.search().orElseThrow();
    assertThat(second, is(first));
    assertThat(second.cost(), is(4));
    assertThat(search.statistics().frontierSizes(), is(statistics.frontierSizes()));
  }

  @Test
  public void testExhaustedSearchExpandsEveryReachableStateOnce() {
    TransitionSystem system = new IncrementalRelationBuilder(new BddManager(), Grids.grid(2, List.of("c11")),
        GRID_WEIGHTS, CostAdjuster.IDENTITY).build();
    ProductGraph product = new ProductGraph(system, List.of(Problems.avoidAndReach("p11", "p11")),
        AcceptanceMode.CONJUNCTIVE);
    DijkstraSearch search = new DijkstraSearch(product, system);
    assertThat(search.search().isEmpty(), is(true));
    SearchStatistics statistics = search.statistics();
    assertThat(statistics.frontierSizes(), everyItem(greaterThan(BigInteger.ZERO)));
    assertThat(statistics.expandedStates(), is(BreadthFirstSearchTest.reachableStates(product, system)));
  }
}
