package report;

import model.IssueCategory;
import model.ReviewIssue;
import model.ReviewMetrics;
import model.ReviewResult;
import model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Консольный отчет с необязательной цветной подсветкой.
 */
public final class ConsoleReporter implements Reporter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_GRAY = "\u001B[90m";
    private static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    public ConsoleReporter() {
        this(true);
    }

    @Override
    public void generate(ReviewResult result, PrintWriter writer) throws IOException {
        Objects.requireNonNull(result, "Result cannot be null");

        printHeader(writer, "Code Review Agent");
        writer.println("Session: " + result.getSessionId());
        writer.println("Analyzer: " + result.getAnalyzer());
        writer.println();

        printMetrics(writer, result.getMetrics());

        if (result.getIssues().isEmpty()) {
            printSuccess(writer, "No issues found!");
        } else {
            printSection(writer, "Issues");
            for (Severity severity : Severity.values()) {
                List<ReviewIssue> group = result.getIssues(severity);
                for (ReviewIssue issue : group) {
                    printIssue(writer, issue);
                }
            }
        }

        if (!result.getRecommendations().isEmpty()) {
            printSection(writer, "Recommendations");
            for (String recommendation : result.getRecommendations()) {
                writer.println("  • " + recommendation);
            }
            writer.println();
        }

        printSummary(writer, result);
        writer.flush();
    }

    private void printMetrics(PrintWriter writer, ReviewMetrics metrics) {
        printSection(writer, "Metrics");
        writer.println("Files processed: " + metrics.getFilesProcessed());
        writer.println("Lines of code: " + metrics.getLinesOfCode());
        writer.println("Total issues: " + colorize(String.valueOf(metrics.getTotalIssues()), ANSI_BOLD));
        for (IssueCategory category : IssueCategory.values()) {
            int count = metrics.count(category);
            if (count > 0) {
                writer.println("  " + category.getDisplayName() + ": " + count);
            }
        }
        writer.println();
    }

    private void printIssue(PrintWriter writer, ReviewIssue issue) {
        String color = getSeverityColor(issue.getSeverity());
        writer.println(colorize("[" + issue.getSeverity().getValue().toUpperCase(Locale.ROOT) + "] ", color)
            + issue.getFilePath() + ":" + issue.getLine() + " " + issue.getDescription());
        writer.println("  Category: " + issue.getCategory().getDisplayName()
            + (issue.getTaxonomyCode() != null ? " (" + issue.getTaxonomyCode() + ")" : ""));
        if (!issue.getSuggestion().isEmpty()) {
            writer.println("  " + colorize("Suggestion: ", ANSI_GREEN) + issue.getSuggestion());
        }
        if (issue.getRuleId() != null) {
            writer.println("  " + colorize("Rule: " + issue.getRuleId(), ANSI_GRAY));
        }
        writer.println();
    }

    private void printSummary(PrintWriter writer, ReviewResult result) {
        printSection(writer, "Summary");
        ReviewMetrics metrics = result.getMetrics();
        writer.println("High: " + colorize(String.valueOf(metrics.count(Severity.HIGH)), ANSI_RED)
            + "  Medium: " + colorize(String.valueOf(metrics.count(Severity.MEDIUM)), ANSI_YELLOW)
            + "  Low: " + colorize(String.valueOf(metrics.count(Severity.LOW)), ANSI_BLUE));
        writer.println("Quality score: " + colorize(metrics.getQualityScore() + "/100", ANSI_BOLD));
        writer.println();
    }

    private void printHeader(PrintWriter writer, String title) {
        writer.println(colorize(colorize("=".repeat(60), ANSI_BOLD), ANSI_BLUE));
        writer.println(colorize(colorize(title, ANSI_BOLD), ANSI_BLUE));
        writer.println(colorize(colorize("=".repeat(60), ANSI_BOLD), ANSI_BLUE));
        writer.println();
    }

    private void printSection(PrintWriter writer, String title) {
        writer.println(colorize(colorize(title, ANSI_BOLD), ANSI_BLUE));
        writer.println(colorize("-".repeat(60), ANSI_BLUE));
    }

    private void printSuccess(PrintWriter writer, String message) {
        writer.println(colorize("✓ ", ANSI_GREEN) + message);
        writer.println();
    }

    private String getSeverityColor(Severity severity) {
        return switch (severity) {
            case HIGH -> ANSI_RED;
            case MEDIUM -> ANSI_YELLOW;
            case LOW -> ANSI_BLUE;
        };
    }

    private String colorize(String text, String colorCode) {
        if (!useColors) {
            return text;
        }
        return colorCode + text + ANSI_RESET;
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.CONSOLE;
    }
}
