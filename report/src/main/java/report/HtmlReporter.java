package report;

import model.IssueCategory;
import model.ReviewIssue;
import model.ReviewMetrics;
import model.ReviewResult;
import model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

import static util.StringUtils.escapeHtml;

/**
 * Генератор HTML-отчета - основной человекочитаемый отчет о ревью.
 *
 * <p>Отчет содержит:
 * <ul>
 *   <li>Время формирования отчета (по переданным часам)</li>
 *   <li>Все метрики: общее число замечаний, файлы, строки кода, разбивку по категориям
 *       и уровням, оценку качества</li>
 *   <li>Замечания, сгруппированные по уровню (High, Medium, Low); у каждого блока CSS-класс
 *       {@code severity-high}, {@code severity-medium} или {@code severity-low}</li>
 *   <li>Рекомендации</li>
 * </ul>
 *
 * <p>Генерация не имеет побочных эффектов: при одинаковых результате и часах отчет совпадает
 * побайтно. Весь текст из результата экранируется.
 *
 * @author Code Review Agent Team
 * @since 1.0
 */
public final class HtmlReporter implements Reporter {
    private static final Logger logger = Logger.getLogger(HtmlReporter.class.getName());

    private static final String STYLES = """
            body { font-family: 'Segoe UI', Tahoma, Geneva, Verdana, sans-serif; margin: 0; padding: 20px; background: #f5f7fa; }
            .header { background: linear-gradient(135deg, #667eea 0%, #764ba2 100%); color: white; padding: 30px; text-align: center; border-radius: 10px; margin-bottom: 30px; }
            .metrics { display: grid; grid-template-columns: repeat(auto-fit, minmax(180px, 1fr)); gap: 20px; margin: 20px 0; }
            .metric { background: white; padding: 20px; border-radius: 10px; text-align: center; box-shadow: 0 2px 10px rgba(0,0,0,0.1); }
            .metric-value { font-size: 2rem; font-weight: bold; color: #667eea; margin-bottom: 5px; }
            .issues, .recommendations { margin: 30px 0; background: white; border-radius: 10px; overflow: hidden; box-shadow: 0 2px 10px rgba(0,0,0,0.1); }
            .issues h2, .recommendations h2 { background: #f8f9fa; margin: 0; padding: 20px; border-bottom: 1px solid #dee2e6; }
            .issues h3 { margin: 0; padding: 15px 20px; }
            .issue { padding: 20px; border-bottom: 1px solid #f0f0f0; }
            .issue:last-child { border-bottom: none; }
            .severity-high { border-left: 5px solid #ff4757; }
            .severity-medium { border-left: 5px solid #ffa502; }
            .severity-low { border-left: 5px solid #2ed573; }
            .recommendations ul { padding: 20px 40px; margin: 0; }
            .footer { text-align: center; margin-top: 30px; color: #666; }
            """;

    private final Clock clock;
    private final DateTimeFormatter timestampFormatter;

    public HtmlReporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.timestampFormatter = DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' hh:mm a", Locale.ENGLISH)
            .withZone(clock.getZone());
    }

    public HtmlReporter() {
        this(Clock.systemUTC());
    }

    @Override
    public void generate(ReviewResult result, PrintWriter writer) throws IOException {
        Objects.requireNonNull(writer, "Writer cannot be null");
        writer.print(render(result));
        writer.flush();
    }

    /**
     * Формирует HTML-документ целиком.
     *
     * @param result завершенный результат ревью
     * @return HTML-документ
     */
    public String render(ReviewResult result) {
        Objects.requireNonNull(result, "Result cannot be null");

        StringWriter buffer = new StringWriter();
        PrintWriter out = new PrintWriter(buffer);

        out.println("<!DOCTYPE html>");
        out.println("<html lang=\"en\">");
        out.println("<head>");
        out.println("<meta charset=\"UTF-8\">");
        out.println("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">");
        out.println("<title>Code Review Report</title>");
        out.println("<style>");
        out.print(STYLES);
        out.println("</style>");
        out.println("</head>");
        out.println("<body>");

        out.println("<div class=\"header\">");
        out.println("<h1>Code Review Report</h1>");
        out.println("<p>Generated on " + escapeHtml(timestampFormatter.format(clock.instant())) + "</p>");
        out.println("<p>Session " + escapeHtml(result.getSessionId()) + "</p>");
        out.println("</div>");

        writeMetrics(out, result.getMetrics());
        writeIssues(out, result);
        writeRecommendations(out, result.getRecommendations());

        out.println("<div class=\"footer\">");
        out.println("<p>Report generated by " + escapeHtml(result.getAnalyzer()) + "</p>");
        out.println("</div>");
        out.println("</body>");
        out.println("</html>");
        out.flush();

        logger.fine("Rendered HTML report for session " + result.getSessionId());
        return buffer.toString();
    }

    private void writeMetrics(PrintWriter out, ReviewMetrics metrics) {
        out.println("<div class=\"metrics\">");
        writeMetric(out, "total-issues", metrics.getTotalIssues(), "Total Issues Found");
        writeMetric(out, "files-processed", metrics.getFilesProcessed(), "Files Processed");
        writeMetric(out, "lines-of-code", metrics.getLinesOfCode(), "Lines of Code");
        for (IssueCategory category : IssueCategory.values()) {
            writeMetric(out, category.getKey() + "-issues", metrics.count(category),
                category.getDisplayName() + " Issues");
        }
        for (Severity severity : Severity.values()) {
            writeMetric(out, severity.getValue() + "-severity", metrics.count(severity),
                severity.getDisplayName() + " Severity");
        }
        writeMetric(out, "quality-score", metrics.getQualityScore(), "Quality Score");
        out.println("</div>");
    }

    private void writeMetric(PrintWriter out, String id, int value, String label) {
        out.println("<div class=\"metric\" id=\"metric-" + id + "\">");
        out.println("<div class=\"metric-value\">" + value + "</div>");
        out.println("<div>" + escapeHtml(label) + "</div>");
        out.println("</div>");
    }

    private void writeIssues(PrintWriter out, ReviewResult result) {
        out.println("<div class=\"issues\">");
        out.println("<h2>Issues Found</h2>");
        if (result.getIssues().isEmpty()) {
            out.println("<p class=\"issue\">No issues found.</p>");
        }
        for (Severity severity : Severity.values()) {
            List<ReviewIssue> group = result.getIssues(severity);
            if (group.isEmpty()) {
                continue;
            }
            out.println("<h3>" + severity.getDisplayName() + " Severity (" + group.size() + ")</h3>");
            for (ReviewIssue issue : group) {
                writeIssue(out, issue);
            }
        }
        out.println("</div>");
    }

    private void writeIssue(PrintWriter out, ReviewIssue issue) {
        out.println("<div class=\"issue severity-" + issue.getSeverity().getValue() + "\">");
        out.println("<h4>" + escapeHtml(issue.getCategory().getDisplayName()) + ": "
            + escapeHtml(issue.getDescription()) + "</h4>");
        out.println("<p><strong>File:</strong> " + escapeHtml(issue.getFilePath())
            + " (Line " + issue.getLine() + ")</p>");
        out.println("<p><strong>Severity:</strong> "
            + issue.getSeverity().getValue().toUpperCase(Locale.ROOT) + "</p>");
        if (!issue.getSuggestion().isEmpty()) {
            out.println("<p><strong>Suggestion:</strong> " + escapeHtml(issue.getSuggestion()) + "</p>");
        }
        if (issue.getTaxonomyCode() != null) {
            out.println("<p><strong>CWE ID:</strong> " + escapeHtml(issue.getTaxonomyCode()) + "</p>");
        }
        out.println("</div>");
    }

    private void writeRecommendations(PrintWriter out, List<String> recommendations) {
        out.println("<div class=\"recommendations\">");
        out.println("<h2>Recommendations</h2>");
        out.println("<ul>");
        for (String recommendation : recommendations) {
            out.println("<li>" + escapeHtml(recommendation) + "</li>");
        }
        out.println("</ul>");
        out.println("</div>");
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.HTML;
    }
}
