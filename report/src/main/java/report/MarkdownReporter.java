package report;

import model.IssueCategory;
import model.ReviewIssue;
import model.ReviewMetrics;
import model.ReviewResult;
import model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Отчет в формате Markdown для описаний pull request и wiki.
 *
 * <p>Метрики выводятся таблицей, замечания - списками по уровням критичности.
 * Символы {@code |} в тексте замечаний экранируются, переводы строк заменяются пробелами.
 */
public final class MarkdownReporter implements Reporter {

    private final Clock clock;
    private final DateTimeFormatter timestampFormatter;

    public MarkdownReporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.timestampFormatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(clock.getZone());
    }

    @Override
    public void generate(ReviewResult result, PrintWriter writer) throws IOException {
        Objects.requireNonNull(result, "Result cannot be null");
        Objects.requireNonNull(writer, "Writer cannot be null");

        writer.println("# Code Review Report");
        writer.println();
        writer.println("- Session: `" + result.getSessionId() + "`");
        writer.println("- Analyzer: " + result.getAnalyzer());
        writer.println("- Generated on: " + timestampFormatter.format(clock.instant()));
        writer.println();

        printMetrics(writer, result.getMetrics());
        printIssues(writer, result);

        writer.println("## Recommendations");
        writer.println();
        for (String recommendation : result.getRecommendations()) {
            writer.println("- " + inline(recommendation));
        }
        writer.flush();
    }

    private void printMetrics(PrintWriter writer, ReviewMetrics metrics) {
        writer.println("## Metrics");
        writer.println();
        writer.println("| Metric | Value |");
        writer.println("|---|---|");
        writer.println("| Total issues | " + metrics.getTotalIssues() + " |");
        writer.println("| Files processed | " + metrics.getFilesProcessed() + " |");
        writer.println("| Lines of code | " + metrics.getLinesOfCode() + " |");
        for (IssueCategory category : IssueCategory.values()) {
            writer.println("| " + category.getDisplayName() + " issues | " + metrics.count(category) + " |");
        }
        writer.println("| Quality score | " + metrics.getQualityScore() + "/100 |");
        writer.println();
    }

    private void printIssues(PrintWriter writer, ReviewResult result) {
        writer.println("## Issues");
        writer.println();
        if (result.getIssues().isEmpty()) {
            writer.println("No issues found.");
            writer.println();
            return;
        }
        for (Severity severity : Severity.values()) {
            List<ReviewIssue> group = result.getIssues(severity);
            if (group.isEmpty()) {
                continue;
            }
            writer.println("### " + severity.getDisplayName() + " (" + group.size() + ")");
            writer.println();
            for (ReviewIssue issue : group) {
                StringBuilder line = new StringBuilder("- **")
                    .append(issue.getCategory().getDisplayName())
                    .append("** `")
                    .append(issue.getFilePath())
                    .append(':')
                    .append(issue.getLine())
                    .append("` ")
                    .append(inline(issue.getDescription()));
                if (issue.getTaxonomyCode() != null) {
                    line.append(" (").append(issue.getTaxonomyCode()).append(')');
                }
                writer.println(line);
                if (!issue.getSuggestion().isEmpty()) {
                    writer.println("  - Suggestion: " + inline(issue.getSuggestion()));
                }
            }
            writer.println();
        }
    }

    private static String inline(String text) {
        return text.replace("\r", " ").replace("\n", " ").replace("|", "\\|");
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.MARKDOWN;
    }
}
