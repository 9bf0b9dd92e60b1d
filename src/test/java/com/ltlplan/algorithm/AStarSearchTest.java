package com.ltlplan.algorithm;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.ltlplan.Problems;
import com.ltlplan.graph.AcceptanceMode;
import com.ltlplan.graph.IncrementalRelationBuilder;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.TransitionSystem;
import com.ltlplan.model.Automaton;
import com.ltlplan.model.CostAdjuster;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.WeightTable;
import com.ltlplan.symbolic.BddManager;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

public class AStarSearchTest {
  private static Optional<Plan> search(PlanningProblem problem, List<Automaton> automata, WeightTable weights,
      AcceptanceMode mode) {
    TransitionSystem system = new IncrementalRelationBuilder(new BddManager(), problem, weights,
        CostAdjuster.IDENTITY).build();
    ProductGraph product = new ProductGraph(system, automata, mode);
    return new AStarSearch(product, system).search();
  }

  @Test
  public void testSingleTransfer() {
    Plan plan = search(Problems.oneObject(), List.of(Problems.eventually("b0_lb")),
        new WeightTable(Map.of("transfer", 1)), AcceptanceMode.CONJUNCTIVE).orElseThrow();
    assertThat(plan.cost(), is(1));
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
      OptionalInt expected = ExplicitPlanner.optimalCost(grid, task, DijkstraSearchTest.GRID_WEIGHTS);
      Optional<Plan> plan = search(grid, List.of(task), DijkstraSearchTest.GRID_WEIGHTS,
          AcceptanceMode.CONJUNCTIVE);
      assertThat(plan.map(Plan::cost).orElse(-1), is(expected.orElse(-1)));
      plan.ifPresent(Plan::replay);
    }
  }

  @Test
  public void testAgreesWithDijkstraOnSequentialTasks() {
    PlanningProblem grid = Grids.grid(3, List.of("c11", "c22", "c02"));
    List<Automaton> tasks = List.of(Problems.eventually("p02"), Problems.eventually("p22"));
    WeightTable weights = DijkstraSearchTest.GRID_WEIGHTS;

    TransitionSystem system = new IncrementalRelationBuilder(new BddManager(), grid, weights,
        CostAdjuster.IDENTITY).build();
    ProductGraph product = new ProductGraph(system, tasks, AcceptanceMode.SEQUENTIAL);
    Plan dijkstra = new DijkstraSearch(product, system).search().orElseThrow();
    Plan astar = search(grid, tasks, weights, AcceptanceMode.SEQUENTIAL).orElseThrow();
    assertThat(astar.cost(), is(dijkstra.cost()));
  }

  @Test
  public void testPrunesHopelessAutomatonStates() {
    Optional<Plan> plan = search(Problems.triangle(),
        List.of(Problems.avoidAndReach("b", "a"), Problems.eventually("b")),
        WeightTable.uniform(Problems.triangle().actions(), 1), AcceptanceMode.CONJUNCTIVE);
    assertThat(plan.isEmpty(), is(true));
  }

  @Test
  public void testShortcutWithZeroWeights() {
    Plan plan = search(Grids.shortcut(true), List.of(Problems.eventually("d")),
        new WeightTable(Map.of("jump", 5, "walk", 1, "slide", 0)), AcceptanceMode.CONJUNCTIVE).orElseThrow();
    assertThat(plan.cost(), is(2));
  }
}
