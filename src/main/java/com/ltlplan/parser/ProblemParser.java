package com.ltlplan.parser;

import static java.util.Objects.requireNonNull;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.ltlplan.model.Action;
import com.ltlplan.model.Automaton;
import com.ltlplan.model.Guard;
import com.ltlplan.model.Player;
import com.ltlplan.model.PlanningProblem;
import com.ltlplan.model.PredicateTable;
import com.ltlplan.model.State;
import com.ltlplan.model.WeightTable;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Reads grounded planning problems in JSON. Predicates are registered in order of appearance: declared facts first,
 * then initial state, goal, observations and actions.
 */
public final class ProblemParser {
  private ProblemParser() {}

  public static ProblemInstance parse(Reader reader) throws IOException {
    JsonElement element = JsonParser.parseReader(reader);
    if (!element.isJsonObject()) {
      throw new IOException("Problem file does not contain a JSON object");
    }
    return parse(element.getAsJsonObject());
  }

  public static ProblemInstance parse(JsonObject json) {
    String name = requireNonNull(json.getAsJsonPrimitive("name"), "Missing name").getAsString();
    List<String> initial = ParseUtil.strings(requireNonNull(json.getAsJsonArray("initial"), "Missing initial state"));
    List<String> goal = ParseUtil.strings(json.getAsJsonArray("goal"));
    List<JsonObject> actionData = ParseUtil.stream(requireNonNull(json.getAsJsonArray("actions"), "Missing actions"))
        .map(JsonElement::getAsJsonObject)
        .toList();
    Map<String, String> observationData = new LinkedHashMap<>();
    JsonObject observationsJson = json.getAsJsonObject("observations");
    if (observationsJson != null) {
      observationsJson.entrySet().forEach(entry -> observationData.put(entry.getKey().strip(),
          entry.getValue().getAsString().strip()));
    }

    Set<String> predicates = new LinkedHashSet<>(ParseUtil.strings(json.getAsJsonArray("facts")));
    predicates.addAll(initial);
    predicates.addAll(goal);
    predicates.addAll(observationData.keySet());
    for (JsonObject action : actionData) {
      for (String key : List.of("pre", "add", "del")) {
        predicates.addAll(ParseUtil.strings(action.getAsJsonArray(key)));
      }
    }
    PredicateTable table = PredicateTable.of(predicates);

    List<Action> actions = actionData.stream().map(data -> parseAction(data, table)).toList();
    Map<Integer, String> observations = new LinkedHashMap<>();
    observationData.forEach((predicate, proposition) -> observations.put(table.id(predicate), proposition));

    JsonObject capacity = json.getAsJsonObject("capacity");
    PlanningProblem problem = new PlanningProblem(name, table, actions,
        State.of(initial.stream().map(table::id).toList()),
        Set.copyOf(goal.stream().map(table::id).toList()),
        observations,
        ParseUtil.strings(json.getAsJsonArray("objects")),
        capacity == null ? null : optionalInt(capacity.getAsJsonPrimitive("states")),
        capacity == null ? null : optionalInt(capacity.getAsJsonPrimitive("labels")));

    List<Automaton> automata = new ArrayList<>();
    var automataJson = requireNonNull(json.getAsJsonArray("automata"), "Missing automata");
    for (int i = 0; i < automataJson.size(); i++) {
      automata.add(parseAutomaton(automataJson.get(i).getAsJsonObject(), "task" + i));
    }

    WeightTable weights = null;
    JsonObject weightsJson = json.getAsJsonObject("weights");
    if (weightsJson != null) {
      Map<String, Integer> map = new LinkedHashMap<>();
      weightsJson.entrySet().forEach(entry -> map.put(entry.getKey(), entry.getValue().getAsInt()));
      weights = new WeightTable(map);
    }

    JsonObject expected = json.getAsJsonObject("expected");
    Integer expectedCost = expected == null ? null : optionalInt(expected.getAsJsonPrimitive("cost"));
    Boolean expectedWinning = expected == null || !expected.has("winning")
        ? null
        : expected.getAsJsonPrimitive("winning").getAsBoolean();
    return new ProblemInstance(problem, automata, weights, expectedCost, expectedWinning);
  }

  @Nullable
  private static Integer optionalInt(@Nullable JsonPrimitive primitive) {
    return primitive == null ? null : primitive.getAsInt();
  }

  private static Action parseAction(JsonObject data, PredicateTable table) {
    String name = requireNonNull(data.getAsJsonPrimitive("name"), "Missing action name").getAsString().strip();
    List<Integer> pre = ParseUtil.strings(data.getAsJsonArray("pre")).stream().map(table::id).toList();
    List<Integer> add = ParseUtil.strings(data.getAsJsonArray("add")).stream().map(table::id).toList();
    List<Integer> del = ParseUtil.strings(data.getAsJsonArray("del")).stream().map(table::id).toList();
    JsonPrimitive player = data.getAsJsonPrimitive("player");
    if (player == null) {
      return Action.of(name, pre, add, del);
    }
    return Action.of(name, parsePlayer(player.getAsString(), name), pre, add, del);
  }

  private static Player parsePlayer(String player, String action) {
    return switch (player.toLowerCase(Locale.ROOT)) {
      case "system", "sys", "robot" -> Player.SYSTEM;
      case "environment", "env", "human" -> Player.ENVIRONMENT;
      default -> throw new IllegalArgumentException("Unknown player %s of action %s".formatted(player, action));
    };
  }

  private static Automaton parseAutomaton(JsonObject data, String defaultName) {
    String name = data.has("name") ? data.getAsJsonPrimitive("name").getAsString() : defaultName;
    int size = requireNonNull(data.getAsJsonPrimitive("states"),
        () -> "Missing state count of automaton %s".formatted(name)).getAsInt();
    int initial = data.has("initial") ? data.getAsJsonPrimitive("initial").getAsInt() : 0;
    IntSet accepting = new IntOpenHashSet();
    ParseUtil.stream(requireNonNull(data.getAsJsonArray("accepting"),
        () -> "Missing accepting states of automaton %s".formatted(name)))
        .mapToInt(JsonElement::getAsInt)
        .forEach(accepting::add);
    List<Automaton.Edge> edges = ParseUtil.stream(requireNonNull(data.getAsJsonArray("edges"),
        () -> "Missing edges of automaton %s".formatted(name)))
        .map(JsonElement::getAsJsonObject)
        .map(edge -> new Automaton.Edge(
            requireNonNull(edge.getAsJsonPrimitive("from"), "Missing edge source").getAsInt(),
            parseGuard(edge.get("guard")),
            requireNonNull(edge.getAsJsonPrimitive("to"), "Missing edge target").getAsInt()))
        .toList();
    return new Automaton(name, size, initial, accepting, edges);
  }

  /**
   * Guards are either {@code true}, {@code false}, or a list of clauses, each a list of literals {@code p} or
   * {@code !p}.
   */
  static Guard parseGuard(@Nullable JsonElement guard) {
    if (guard == null) {
      return Guard.TRUE;
    }
    if (guard.isJsonPrimitive()) {
      return guard.getAsBoolean() ? Guard.TRUE : Guard.FALSE;
    }
    return new Guard(ParseUtil.stream(guard.getAsJsonArray())
        .map(clause -> Guard.Clause.of(ParseUtil.strings(clause.getAsJsonArray())))
        .toList());
  }
}
