package io.taintscan;

import io.taintscan.analysis.AnalysisTimeoutException;
import io.taintscan.analysis.TaintAnalyzer;
import io.taintscan.config.ClassificationPolicy;
import io.taintscan.graph.GraphLoader;
import io.taintscan.graph.StructuralGraphException;
import io.taintscan.graph.TaintGraph;
import io.taintscan.model.ClassificationReport;
import io.taintscan.report.ConsoleReporter;
import io.taintscan.report.JsonReporter;
import io.taintscan.report.Reporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI entry point: classifies every sink of a call graph.
 */
@Command(
        name = "classify",
        mixinStandardHelpOptions = true,
        version = "taint-scan 1.0.0",
        description = "Classifies each sink of a tagged call graph as must-fix, good-to-fix, false positive or dead code.",
        exitCodeListHeading = "%nExit codes:%n",
        exitCodeList = {
                "0:Classification completed",
                "1:Internal error, bad policy file or timeout",
                "2:Missing, malformed or structurally invalid graph, or bad usage"
        },
        footer = {
                "",
                "Examples:",
                "  classify --graph app-graph.json",
                "  classify --graph app-graph.json --out report.json",
                "  classify --graph app-graph.json --format console --config taint-policy.yaml"
        }
)
public class TaintScanCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_BAD_GRAPH = 2;

    @Spec
    private CommandSpec spec;

    @Option(
            names = {"-g", "--graph"},
            required = true,
            description = "Call graph to classify (JSON)"
    )
    private Path graphFile;

    @Option(
            names = {"-o", "--out"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-f", "--format"},
            description = "Output format: json (default), console",
            defaultValue = "json"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-c", "--config"},
            description = "Path to a policy YAML file, merged over the bundled defaults"
    )
    private Path configFile;

    @Option(
            names = {"-t", "--threads"},
            description = "Maximum worker threads (defaults to available processors)"
    )
    private Integer threads;

    @Option(
            names = {"--timeout-seconds"},
            description = "Abort the run if it takes longer than this"
    )
    private Long timeoutSeconds;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"-d", "--detailed"},
            description = "List every path in console output instead of the first few per sink"
    )
    private boolean detailed;

    public enum OutputFormat {
        json,
        console
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        ClassificationPolicy policy;
        try {
            policy = loadPolicy();
        } catch (IOException e) {
            err.println("Error: Invalid policy file " + configFile + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        TaintGraph graph;
        try {
            if (!Files.exists(graphFile)) {
                err.println("Error: Graph file does not exist: " + graphFile);
                return EXIT_BAD_GRAPH;
            }
            log("Loading graph from: " + graphFile);
            graph = new GraphLoader().load(graphFile);
            log("Loaded " + graph.nodeCount() + " nodes, " + graph.edgeCount() + " edges, "
                    + graph.registeredEntryPoints().size() + " registered entry points");
        } catch (IOException e) {
            err.println("Error: Cannot read graph " + graphFile + ": " + e.getMessage());
            printStackTrace(e);
            return EXIT_BAD_GRAPH;
        } catch (StructuralGraphException e) {
            err.println("Error: Invalid graph: " + e.getMessage());
            printStackTrace(e);
            return EXIT_BAD_GRAPH;
        }

        try {
            int workers = threads != null ? threads : Runtime.getRuntime().availableProcessors();
            Duration timeout = timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null;
            log("Classifying with " + policy + " on up to " + workers + " thread(s)");

            ClassificationReport report = new TaintAnalyzer(policy, workers, timeout).analyze(graph);
            log("Classified " + report.summary().totalSinks() + " sink(s) over "
                    + report.summary().totalPaths() + " path(s)");

            writeReport(report, createReporter());
            return EXIT_OK;
        } catch (StructuralGraphException e) {
            err.println("Error: Invalid graph: " + e.getMessage());
            printStackTrace(e);
            return EXIT_BAD_GRAPH;
        } catch (AnalysisTimeoutException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error writing report: " + e.getMessage());
            printStackTrace(e);
            return EXIT_FAILURE;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            printStackTrace(e);
            return EXIT_FAILURE;
        }
    }

    private ClassificationPolicy loadPolicy() throws IOException {
        if (configFile != null) {
            log("Loading policy from: " + configFile);
            return ClassificationPolicy.loadFromFile(configFile);
        }
        return ClassificationPolicy.loadDefault();
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case json -> new JsonReporter(true);
            case console -> new ConsoleReporter(!noColor, detailed);
        };
    }

    private void writeReport(ClassificationReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            log("Report written to: " + outputFile);
        } else {
            PrintWriter out = spec.commandLine().getOut();
            reporter.write(report, out);
            out.flush();
        }
    }

    private void log(String message) {
        if (verbose) {
            spec.commandLine().getErr().println(message);
        }
    }

    private void printStackTrace(Exception e) {
        if (verbose) {
            e.printStackTrace(spec.commandLine().getErr());
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TaintScanCli()).execute(args);
        System.exit(exitCode);
    }
}
