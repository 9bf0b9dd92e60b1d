package com.ltlplan;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.common.base.Stopwatch;
import com.ltlplan.algorithm.AStarSearch;
import com.ltlplan.algorithm.BreadthFirstSearch;
import com.ltlplan.algorithm.DijkstraSearch;
import com.ltlplan.algorithm.EnvironmentPolicy;
import com.ltlplan.algorithm.GameRun;
import com.ltlplan.algorithm.GameSolution;
import com.ltlplan.algorithm.Plan;
import com.ltlplan.algorithm.ReachabilityGame;
import com.ltlplan.algorithm.StrategyRollout;
import com.ltlplan.algorithm.SymbolicSearch;
import com.ltlplan.graph.AcceptanceMode;
import com.ltlplan.graph.DirectRelationBuilder;
import com.ltlplan.graph.GameArena;
import com.ltlplan.graph.GameArenaBuilder;
import com.ltlplan.graph.IncrementalRelationBuilder;
import com.ltlplan.graph.ProductGraph;
import com.ltlplan.graph.TransitionSystem;
import com.ltlplan.model.CostAdjuster;
import com.ltlplan.model.WeightTable;
import com.ltlplan.output.Formatter;
import com.ltlplan.parser.ProblemInstance;
import com.ltlplan.parser.ProblemParser;
import com.ltlplan.symbolic.BddManager;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(
    name = "ltlplan",
    mixinStandardHelpOptions = true,
    version = "Symbolic LTLf Planner 0.1",
    description = "Computes plans and strategies for LTLf tasks over grounded planning problems")
public final class Main implements Callable<Integer> {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    public enum Algorithm {
        BFS, DIJKSTRA, ASTAR, GAME
    }

    public enum Construction {
        DIRECT, INCREMENTAL
    }

    public enum Environment {
        IDLE, ADVERSARIAL
    }

    private static PrintStream open(String output) throws IOException {
        return "-".equals(output)
            ? System.out
            : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))));
    }

    @Option(
        names = {"-p", "--problem"},
        required = true,
        description = "Problem file in JSON format")
    private Path problem;

    @Option(
        names = {"-a", "--algorithm"},
        description = "Search algorithm. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private Algorithm algorithm = Algorithm.BFS;

    @Option(
        names = {"-c", "--construction"},
        description = "Transition relation construction. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private Construction construction = Construction.INCREMENTAL;

    @Option(
        names = {"--acceptance"},
        description = "Combination of several automata. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private AcceptanceMode acceptance = AcceptanceMode.CONJUNCTIVE;

    @Option(
        names = {"--environment"},
        description = "Environment behaviour when playing out a strategy. Valid: ${COMPLETION-CANDIDATES}, "
            + "default: ${DEFAULT-VALUE}")
    private Environment environment = Environment.IDLE;

    @Option(
        names = {"--interventions"},
        description = "Let the environment act at most this many times in a game, unbounded if absent")
    @Nullable
    private Integer interventions = null;

    @Option(
        names = {"--uniform-weights"},
        description = "Ignore the weights of the problem file and give every action weight 1")
    private boolean uniformWeights = false;

    @Option(
        names = {"-O", "--output"},
        description = "Write the plan or strategy run")
    private String writeOutput = "-";

    @Option(
        names = {"--statistics"},
        description = "Log construction and search statistics")
    private boolean statistics = false;

    private Main() {}

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args));
    }

    private ProblemInstance parse() throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(problem)) {
            return ProblemParser.parse(reader);
        }
    }

    private WeightTable weights(ProblemInstance instance) {
        if (uniformWeights || instance.weightTable().isEmpty()) {
            return WeightTable.uniform(instance.problem().actions(), 1);
        }
        return instance.weightTable().get();
    }

    @Override
    public Integer call() throws Exception {
        Stopwatch overall = Stopwatch.createStarted();
        ProblemInstance instance = parse();
        BddManager manager = new BddManager();
        int status = algorithm == Algorithm.GAME ? solveGame(instance, manager) : plan(instance, manager);
        log.log(Level.INFO, () -> "Solving took %s overall".formatted(overall));
        return status;
    }

    private int plan(ProblemInstance instance, BddManager manager) throws IOException {
        WeightTable weights = weights(instance);
        Stopwatch timer = Stopwatch.createStarted();
        TransitionSystem system = switch (construction) {
            case DIRECT -> new DirectRelationBuilder(manager, instance.problem(), weights, CostAdjuster.IDENTITY)
                .build();
            case INCREMENTAL -> new IncrementalRelationBuilder(manager, instance.problem(), weights,
                CostAdjuster.IDENTITY).build();
        };
        log.log(Level.INFO, () -> "Built %s in %s".formatted(system, timer));
        if (statistics) {
            log.log(Level.INFO, () -> "Construction: %s, layers %s".formatted(
                Formatter.format(system.statistics()), Formatter.formatTimes(system.statistics().layerTimes())));
        }

        ProductGraph product = new ProductGraph(system, instance.automata(), acceptance);
        SymbolicSearch search = switch (algorithm) {
            case BFS -> new BreadthFirstSearch(product, system);
            case DIJKSTRA -> new DijkstraSearch(product, system);
            case ASTAR -> new AStarSearch(product, system);
            case GAME -> throw new AssertionError("unreachable");
        };
        Stopwatch searchTimer = Stopwatch.createStarted();
        Optional<Plan> plan = search.search();
        log.log(Level.INFO, () -> "Search took %s".formatted(searchTimer));
        if (statistics) {
            log.log(Level.INFO, () -> "Search: " + Formatter.format(search.statistics()));
        }

        try (var stream = open(writeOutput)) {
            if (plan.isPresent()) {
                Formatter.writePlan(plan.get(), instance.problem().predicates(), stream);
            } else {
                stream.println("no plan: target unreachable");
            }
            stream.flush();
        }
        if (instance.expectedPlanCost().isPresent()) {
            int expected = instance.expectedPlanCost().getAsInt();
            if (plan.isEmpty() || plan.get().cost() != expected) {
                System.err.printf("Validation failed: expected cost %d, got %s%n", expected,
                    plan.map(p -> String.valueOf(p.cost())).orElse("no plan"));
                return 1;
            }
        }
        return 0;
    }

    private int solveGame(ProblemInstance instance, BddManager manager) throws IOException {
        Stopwatch timer = Stopwatch.createStarted();
        GameArenaBuilder builder = new GameArenaBuilder(manager, instance.problem());
        GameArena arena = (interventions == null ? builder : builder.bounded(interventions)).build();
        log.log(Level.INFO, () -> "Built %s in %s".formatted(arena, timer));
        if (statistics) {
            log.log(Level.INFO, () -> "Construction: " + Formatter.format(arena.statistics()));
        }
        ProductGraph product = new ProductGraph(arena, instance.automata(), acceptance);
        GameSolution solution = new ReachabilityGame(product, arena).solve();
        if (statistics) {
            log.log(Level.INFO, () -> "Iterations: " + Formatter.formatTimes(solution.iterationTimes()));
        }

        try (var stream = open(writeOutput)) {
            Formatter.writeGame(solution, stream);
            if (solution.isWinning()) {
                EnvironmentPolicy policy = switch (environment) {
                    case IDLE -> EnvironmentPolicy.IDLE;
                    case ADVERSARIAL -> EnvironmentPolicy.ADVERSARIAL;
                };
                GameRun run = new StrategyRollout(product, arena).play(solution, policy);
                Formatter.writeRun(run, instance.problem().predicates(), stream);
            }
            stream.flush();
        }
        if (instance.expectedWinningStrategy().isPresent()
            && instance.expectedWinningStrategy().get() != solution.isWinning()) {
            System.err.printf("Validation failed: expected %s, got %s%n",
                instance.expectedWinningStrategy().get() ? "a winning strategy" : "no winning strategy",
                solution.outcome());
            return 1;
        }
        return 0;
    }
}
