package com.ltlplan.parser;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.gson.JsonParser;
import com.ltlplan.algorithm.DijkstraSearch;
import com.ltlplan.algorithm.GameSolution;
import com.ltlplan.algorithm.Plan;
import com.ltlplan.algorithm.ReachabilityGame;
import com.ltlplan.graph.AcceptanceMode;
import com.ltlplan.graph.GameArena;
import com.ltlplan.graph.GameArenaBuilder;
import com.ltlplan.graph.IncrementalRelationBuilder;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.TransitionSystem;
import com.ltlplan.model.Action;
import com.ltlplan.model.ActionKind;
import com.ltlplan.model.CostAdjuster;
import com.ltlplan.model.Guard;
import com.ltlplan.model.Player;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.symbolic.BddManager;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ProblemParserTest {
  private static ProblemInstance load(String resource) throws IOException {
    try (Reader reader = new InputStreamReader(Objects.requireNonNull(
        ProblemParserTest.class.getResourceAsStream("/" + resource)), StandardCharsets.UTF_8)) {
      return ProblemParser.parse(reader);
    }
  }

  @Test
  public void testParseOneObject() throws IOException {
    ProblemInstance instance = load("one-object.json");
    PlanningProblem problem = instance.problem();
    assertThat(problem.name(), is("one-object"));
    assertThat(problem.actions().stream().map(Action::kind).toList(),
        contains(ActionKind.GRASP, ActionKind.TRANSFER, ActionKind.RELEASE));
    assertThat(problem.objects(), contains("b0"));
    assertThat(problem.stateCapacity(), is(8));
    assertThat(problem.labelCapacity(), is(2));
    assertThat(problem.predicates().id("(on b0 la)"), is(0));
    assertThat(problem.propositions(), is(Set.of("b0_lb")));
    assertThat(instance.automata().size(), is(1));
    assertThat(instance.weightTable().orElseThrow().weight(problem.actions().get(2)), is(4));
    assertThat(instance.expectedPlanCost().getAsInt(), is(9));
  }

  @Test
  public void testPlanFromFile() throws IOException {
    ProblemInstance instance = load("one-object.json");
    TransitionSystem system = new IncrementalRelationBuilder(new BddManager(), instance.problem(),
        instance.weights(), CostAdjuster.IDENTITY).build();
    ProductGraph product = new ProductGraph(system, instance.automata(), AcceptanceMode.CONJUNCTIVE);
    Plan plan = new DijkstraSearch(product, system).search().orElseThrow();
    assertThat(plan.cost(), is(instance.expectedPlanCost().getAsInt()));
    assertThat(plan.length(), is(3));
  }

  @Test
  public void testGameFromFile() throws IOException {
    ProblemInstance instance = load("blockable-game.json");
    assertThat(instance.problem().actions().get(4).player(), is(Player.ENVIRONMENT));
    assertThat(instance.automata().get(0).name(), is("task0"));
    GameArena arena = new GameArenaBuilder(new BddManager(), instance.problem()).build();
    ProductGraph product = new ProductGraph(arena, instance.automata(), AcceptanceMode.CONJUNCTIVE);
    GameSolution solution = new ReachabilityGame(product, arena).solve();
    assertThat(solution.isWinning(), is(instance.expectedWinningStrategy().orElseThrow()));
  }

  @Test
  public void testGuards() {
    Guard guard = ProblemParser.parseGuard(JsonParser.parseString("[[\"a\", \"!b\"], [\"c\"]]"));
    assertThat(guard.test(Set.of("a")), is(true));
    assertThat(guard.test(Set.of("a", "b")), is(false));
    assertThat(ProblemParser.parseGuard(JsonParser.parseString("false")), is(Guard.FALSE));
    assertThat(ProblemParser.parseGuard(null), is(Guard.TRUE));
  }

  @Test
  public void testMissingFields() {
    assertThrows(NullPointerException.class, () -> ProblemParser.parse(
        JsonParser.parseString("{\"initial\": [], \"actions\": [], \"automata\": []}").getAsJsonObject()));
    assertThrows(NullPointerException.class, () -> ProblemParser.parse(
        JsonParser.parseString("{\"name\": \"x\", \"actions\": [], \"automata\": []}").getAsJsonObject()));
  }
}
