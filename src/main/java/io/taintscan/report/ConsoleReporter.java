package io.taintscan.report;

import io.taintscan.model.AnalysisWarning;
import io.taintscan.model.ClassificationReport;
import io.taintscan.model.EntryPointVerdict;
import io.taintscan.model.OverallVerdict;
import io.taintscan.model.PathClassification;
import io.taintscan.model.PathVerdict;
import io.taintscan.model.SinkAnalysis;
import io.taintscan.model.SinkVerdict;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/**
 * Formats classification results for console output with ANSI colors.
 * <p>
 * Layout:
 * - Header with graph stats
 * - Summary of sink verdicts
 * - Sinks, each with its paths as a tree and the evidence under each path
 * - Entry point roll-up and warnings
 * <p>
 * Without --detailed only the first few paths of each sink are listed.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    // Unicode tree-drawing characters
    private static final String TREE_BRANCH = "\u251C\u2500\u2500 ";  // ├──
    private static final String TREE_LAST = "\u2514\u2500\u2500 ";    // └──
    private static final String TREE_PIPE = "\u2502   ";              // │

    private static final int PATH_LIMIT = 5;

    private final boolean useColors;
    private final boolean detailed;

    public ConsoleReporter() {
        this(true, false);
    }

    public ConsoleReporter(boolean useColors) {
        this(useColors, false);
    }

    public ConsoleReporter(boolean useColors, boolean detailed) {
        this.useColors = useColors;
        this.detailed = detailed;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(ClassificationReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printSummary(out, report);

        if (!report.sinks().isEmpty()) {
            printSinks(out, report.sinks());
        }
        if (!report.entryPoints().isEmpty()) {
            printEntryPoints(out, report.entryPoints());
        }
        if (!report.warnings().isEmpty()) {
            printWarnings(out, report.warnings());
        }

        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out, ClassificationReport report) {
        out.println();
        out.println(line('=', 70));
        out.println(center("TAINT-SCAN REPORT", 70));
        out.println(line('=', 70));
        out.println();

        if (report.graphName() != null) {
            out.println("Graph: " + report.graphName());
        }
        out.println("Nodes: " + report.nodeCount() + " | Edges: " + report.edgeCount());
        out.println();
    }

    private void printSummary(PrintWriter out, ClassificationReport report) {
        ClassificationReport.Summary summary = report.summary();

        out.println(bold("SUMMARY"));
        out.println(line('-', 70));
        out.println("Sinks: " + summary.totalSinks() + " | Paths: " + summary.totalPaths());

        StringBuilder verdicts = new StringBuilder("Verdicts: ");
        OverallVerdict[] all = OverallVerdict.values();
        for (int i = 0; i < all.length; i++) {
            int count = summary.countOf(all[i]);
            String text = count + " " + all[i].name().toLowerCase(Locale.ROOT).replace('_', ' ');
            verdicts.append(count > 0 ? color(colorOf(all[i]), text) : text);
            if (i < all.length - 1) {
                verdicts.append(" | ");
            }
        }
        out.println(verdicts);

        if (!report.excludedSinks().isEmpty()) {
            out.println("Excluded (orphaned): " + String.join(", ", report.excludedSinks()));
        }
        out.println();
    }

    private void printSinks(PrintWriter out, List<SinkAnalysis> sinks) {
        out.println(bold("SINKS") + color(CYAN, " (" + sinks.size() + " sinks)"));
        out.println(line('=', 70));

        for (SinkAnalysis sink : sinks) {
            SinkVerdict verdict = sink.verdict();
            out.println(getVerdictIndicator(verdict.overall()) + " " + bold(sink.sinkId())
                    + color(CYAN, " [" + sink.category() + "]"));
            out.println("    Verdict: " + verdict.label());
            if (verdict.error() != null) {
                out.println("    " + color(RED, "Error: " + verdict.error()));
            } else {
                out.println("    Rationale: " + verdict.rationale() + " (confidence " + verdict.confidence() + ")");
            }
            printPaths(out, sink.paths());
            out.println();
        }
    }

    private void printPaths(PrintWriter out, List<PathClassification> paths) {
        int limit = detailed ? paths.size() : Math.min(PATH_LIMIT, paths.size());
        boolean more = paths.size() > limit;

        for (int i = 0; i < limit; i++) {
            PathClassification path = paths.get(i);
            boolean isLast = i == limit - 1 && !more;
            out.println("    " + (isLast ? TREE_LAST : TREE_BRANCH)
                    + getPathIndicator(path.verdict()) + " " + path.path().pathString());

            String pipe = isLast ? "    " : TREE_PIPE;
            for (String evidence : path.evidence()) {
                out.println("    " + pipe + "  - " + evidence);
            }
        }
        if (more) {
            out.println("    " + TREE_LAST + "... and " + (paths.size() - limit) + " more paths");
        }
    }

    private void printEntryPoints(PrintWriter out, List<EntryPointVerdict> entryPoints) {
        out.println(bold("ENTRY POINTS"));
        out.println(line('-', 70));
        for (EntryPointVerdict entry : entryPoints) {
            String registration = entry.registered() ? "" : color(CYAN, " (unregistered)");
            out.printf("  %s %s%s -> %s%n",
                    getVerdictIndicator(entry.overall()),
                    entry.entryId(),
                    registration,
                    String.join(", ", entry.sinkIds()));
        }
        out.println();
    }

    private void printWarnings(PrintWriter out, List<AnalysisWarning> warnings) {
        out.println(bold("WARNINGS") + color(CYAN, " (" + warnings.size() + ")"));
        out.println(line('-', 70));
        for (AnalysisWarning warning : warnings) {
            out.println("  " + color(YELLOW, warning.formatted()));
        }
        out.println();
    }

    private void printFooter(PrintWriter out, ClassificationReport report) {
        out.println(line('=', 70));

        int mustFix = report.summary().countOf(OverallVerdict.MUST_FIX);
        int goodToFix = report.summary().countOf(OverallVerdict.GOOD_TO_FIX);
        int failed = report.summary().countOf(OverallVerdict.ERROR);

        if (mustFix > 0) {
            out.println(color(RED, bold("ACTION REQUIRED: " + mustFix
                    + " sink(s) reachable with untrusted input must be fixed.")));
        } else if (goodToFix > 0) {
            out.println(color(YELLOW, "ATTENTION: " + goodToFix
                    + " sink(s) are only partially mitigated and should be hardened."));
        } else {
            out.println(color(GREEN, "No exploitable sinks found."));
        }
        if (failed > 0) {
            out.println(color(RED, failed + " sink(s) could not be analyzed."));
        }

        out.println();
    }

    private String getVerdictIndicator(OverallVerdict verdict) {
        return switch (verdict) {
            case MUST_FIX -> color(RED, "[MUST]");
            case GOOD_TO_FIX -> color(YELLOW, "[GOOD]");
            case FALSE_POSITIVE -> color(GREEN, "[FP]");
            case DEAD_CODE -> color(CYAN, "[DEAD]");
            case ERROR -> color(RED, "[ERR]");
        };
    }

    private String getPathIndicator(PathVerdict verdict) {
        return switch (verdict) {
            case VULNERABLE -> color(RED, "VULNERABLE");
            case PARTIALLY_MITIGATED -> color(YELLOW, "PARTIALLY_MITIGATED");
            case AUTH_PROTECTED, SANITIZED -> color(GREEN, verdict.name());
            case DEAD -> color(CYAN, "DEAD");
        };
    }

    private String colorOf(OverallVerdict verdict) {
        return switch (verdict) {
            case MUST_FIX, ERROR -> RED;
            case GOOD_TO_FIX -> YELLOW;
            case FALSE_POSITIVE -> GREEN;
            case DEAD_CODE -> CYAN;
        };
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
