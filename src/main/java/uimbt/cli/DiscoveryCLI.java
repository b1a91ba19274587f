package uimbt.cli;

import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import uimbt.browser.BrowserFactory;
import uimbt.browser.WebDriverSession;
import uimbt.discovery.Credentials;
import uimbt.discovery.DiscoveryConfig;
import uimbt.discovery.DiscoverySession;
import uimbt.discovery.ExplorationDriver;
import uimbt.discovery.ExplorationStrategy;
import uimbt.export.GraphExporter;
import uimbt.export.GraphMerger;
import uimbt.model.FsmGraph;
import uimbt.model.GraphIO;
import uimbt.model.GraphStatistics;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code uimbt discover} explore a web application and write its state graph</li>
 *   <li>{@code uimbt merge}    merge a recording graph into an existing graph</li>
 *   <li>{@code uimbt stats}    print the statistics of a graph file</li>
 *   <li>{@code uimbt version}  print build version</li>
 * </ul>
 */
@Command(
        name        = "uimbt",
        description = "Discovers the state machine of a web UI for model-based testing",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                DiscoveryCLI.DiscoverCommand.class,
                DiscoveryCLI.MergeCommand.class,
                DiscoveryCLI.StatsCommand.class,
                DiscoveryCLI.VersionCommand.class
        }
)
public class DiscoveryCLI implements Callable<Integer> {

    static final String PASSWORD_ENV = "UIMBT_PASSWORD";

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new DiscoveryCLI()).execute(args);
        System.exit(exit);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Runs a discovery against a live browser and writes the graph, optionally
     * merging it into a prior graph.
     */
    @Command(
            name        = "discover",
            description = "Explore a web application and write its FSM graph",
            mixinStandardHelpOptions = true
    )
    static class DiscoverCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(DiscoverCommand.class);

        @Parameters(index = "0", description = "Base URL of the application")
        String baseUrl;

        @Option(names = {"-u", "--username"}, description = "Login username (enables the login sequence)")
        String username;

        @Option(names = {"-p", "--password"},
                description = "Login password (default: $" + PASSWORD_ENV + ")")
        String password;

        @Option(names = {"-b", "--browser"}, description = "chrome, edge or firefox")
        String browser;

        @Option(names = {"--headless"}, negatable = true, description = "Run the browser headless")
        Boolean headless;

        @Option(names = {"-s", "--strategy"}, description = "DFS or BFS")
        ExplorationStrategy strategy;

        @Option(names = {"--max-states"}, description = "Maximum number of states")
        Integer maxStates;

        @Option(names = {"--max-depth"}, description = "Maximum exploration depth")
        Integer maxDepth;

        @Option(names = {"-t", "--threshold"}, description = "Similarity threshold in [0, 1]")
        Double threshold;

        @Option(names = {"-o", "--output"}, description = "Output graph file (default: from config)")
        Path output;

        @Option(names = {"--merge-into"}, description = "Existing graph to merge the result into")
        Path mergeInto;

        @Override
        public Integer call() throws Exception {
            DiscoveryConfig config = new DiscoveryConfig();
            applyOverrides(config);

            Credentials credentials = credentials();
            if (username != null && credentials == null) {
                System.err.println("Username given but no password (use --password or $" + PASSWORD_ENV + ")");
                return 1;
            }
            if (mergeInto != null && !Files.exists(mergeInto)) {
                System.err.println("Graph to merge into not found: " + mergeInto.toAbsolutePath());
                return 1;
            }

            Path target = output != null ? output : Path.of(config.getOutputFile());
            System.out.printf("Discovering %s (%s, max %d states, depth %d)%n", baseUrl,
                    config.getStrategy(), config.getMaxStates(), config.getMaxDepth());

            WebDriver driver = BrowserFactory.create(config.getBrowser(), config.isHeadless());
            DiscoverySession session;
            try (WebDriverSession browserSession = new WebDriverSession(driver, config.getPageLoadTimeout())) {
                session = new ExplorationDriver(browserSession, config, baseUrl).run(credentials);
            }

            FsmGraph graph = new GraphExporter().export(session);
            if (mergeInto != null) {
                graph = mergeDiscovered(graph, mergeInto);
            }
            GraphIO.write(graph, target);
            log.info("Graph written to {}", target.toAbsolutePath());

            printStatistics(graph);
            System.out.println("Graph: " + target.toAbsolutePath());
            return graph.isEmpty() ? 2 : 0;
        }

        /** Merges a run into an existing graph; an empty run is written as-is. */
        static FsmGraph mergeDiscovered(FsmGraph discovered, Path existingGraph) throws IOException {
            if (discovered.isEmpty()) {
                log.warn("Discovery found no states, not merging into {}", existingGraph);
                System.err.println("Nothing discovered; skipping merge into " + existingGraph.toAbsolutePath());
                return discovered;
            }
            return new GraphMerger().merge(GraphIO.read(existingGraph), discovered).graph();
        }

        private void applyOverrides(DiscoveryConfig config) {
            if (browser   != null) config.setBrowser(browser);
            if (headless  != null) config.setHeadless(headless);
            if (strategy  != null) config.setStrategy(strategy);
            if (maxStates != null) config.setMaxStates(maxStates);
            if (maxDepth  != null) config.setMaxDepth(maxDepth);
            if (threshold != null) config.setSimilarityThreshold(threshold);
        }

        private Credentials credentials() {
            if (username == null) return null;
            String pw = password != null ? password : System.getenv(PASSWORD_ENV);
            return pw == null ? null : new Credentials(username, pw);
        }
    }

    /**
     * Merges a recording graph into an existing graph.
     */
    @Command(
            name        = "merge",
            description = "Merge a recording graph into an existing FSM graph",
            mixinStandardHelpOptions = true
    )
    static class MergeCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Existing graph JSON")
        Path existingFile;

        @Parameters(index = "1", description = "Recording graph JSON to merge in")
        Path recordingFile;

        @Option(names = {"-o", "--output"}, description = "Output file (default: overwrite the existing graph)")
        Path output;

        @Override
        public Integer call() throws Exception {
            for (Path p : new Path[]{existingFile, recordingFile}) {
                if (!Files.exists(p)) {
                    System.err.println("Graph file not found: " + p.toAbsolutePath());
                    return 1;
                }
            }
            FsmGraph existing  = GraphIO.read(existingFile);
            FsmGraph recording = GraphIO.read(recordingFile);
            if (existing.isEmpty() || recording.isEmpty()) {
                System.err.println("Both graphs must contain at least one state");
                return 1;
            }

            GraphMerger.MergeResult result = new GraphMerger().merge(existing, recording);
            Path target = output != null ? output : existingFile;
            GraphIO.write(result.graph(), target);

            System.out.printf("Merged %s into %s%n", recordingFile.getFileName(), target.toAbsolutePath());
            System.out.printf("  New states         : %d (skipped %d duplicates)%n",
                    result.newStates(), result.duplicateStates());
            System.out.printf("  New transitions    : %d (skipped %d duplicates)%n",
                    result.newTransitions(), result.duplicateTransitions());
            return 0;
        }
    }

    /**
     * Prints the statistics block of a graph file.
     */
    @Command(
            name        = "stats",
            description = "Print statistics of an FSM graph",
            mixinStandardHelpOptions = true
    )
    static class StatsCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Graph JSON file")
        Path graphFile;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(graphFile)) {
                System.err.println("Graph file not found: " + graphFile.toAbsolutePath());
                return 1;
            }
            FsmGraph graph = GraphIO.read(graphFile);
            System.out.printf("Base URL  : %s%n", graph.getBaseUrl());
            System.out.printf("Method    : %s%n", graph.getDiscoveryMethod());
            printStatistics(graph);
            return 0;
        }
    }

    @Command(name = "version", description = "Print version information")
    static class VersionCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            System.out.println("uimbt 1.0.0-SNAPSHOT");
            System.out.println("Java " + System.getProperty("java.version"));
            return 0;
        }
    }

    // ── Shared ──────────────────────────────────────────────────────────────

    static void printStatistics(FsmGraph graph) {
        GraphStatistics stats = graph.getStatistics();
        if (stats == null) {
            System.out.printf("States    : %d%n", graph.getNodes().size());
            System.out.printf("Edges     : %d%n", graph.getEdges().size());
            return;
        }
        System.out.printf("States    : %d (%d explored)%n", stats.getStateCount(), stats.getExploredStateCount());
        System.out.printf("Edges     : %d%n", stats.getTransitionCount());
        for (Map.Entry<String, Integer> e : stats.getStateTypes().entrySet()) {
            System.out.printf("  %-8s: %d%n", e.getKey(), e.getValue());
        }
        if (stats.isMaxStatesReached()) System.out.println("Max states limit reached");
        if (stats.isMaxDepthReached())  System.out.println("Max depth limit reached");
        if (Boolean.TRUE.equals(stats.getMerged())) {
            System.out.printf("Merged at : %s (+%d states, +%d transitions)%n", stats.getMergedAt(),
                    stats.getNewStatesAdded(), stats.getNewTransitionsAdded());
        }
    }
}
