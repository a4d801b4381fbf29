package report;

import model.IssueCategory;
import model.ReviewIssue;
import model.ReviewResult;
import model.Severity;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownReporterTest {

    private final MarkdownReporter reporter = new MarkdownReporter(ReportFixtures.CLOCK);

    private String render(ReviewResult result) throws Exception {
        StringWriter buffer = new StringWriter();
        reporter.generate(result, new PrintWriter(buffer));
        return buffer.toString();
    }

    @Test
    void generate_shouldRenderMetricsTableAndGroups() throws Exception {
        String markdown = render(ReportFixtures.twoIssueResult());

        assertTrue(markdown.startsWith("# Code Review Report"));
        assertTrue(markdown.contains("- Generated on: 2025-01-02 15:04:05"));
        assertTrue(markdown.contains("| Quality score | 94/100 |"));
        assertTrue(markdown.contains("| Security issues | 1 |"));
        assertTrue(markdown.indexOf("### High (1)") < markdown.indexOf("### Low (1)"));
        assertTrue(markdown.contains("- **Security** `app/db.py:5` SQL built from <user> input (CWE-89)"));
        assertTrue(markdown.contains("- Consider using static analysis tools in CI/CD pipeline"));
    }

    @Test
    void generate_shouldEscapePipesAndNewlines() throws Exception {
        ReviewResult result = ReviewResult.builder()
            .sessionId("s")
            .generatedAt(ReportFixtures.GENERATED_AT)
            .analyzer("a")
            .addIssue(ReviewIssue.builder()
                .category(IssueCategory.STYLE)
                .severity(Severity.MEDIUM)
                .filePath("x.js")
                .line(3)
                .description("a | b\nc")
                .build())
            .build();

        String markdown = render(result);

        assertTrue(markdown.contains("a \\| b c"));
    }

    @Test
    void generate_withoutIssues_shouldSayNoIssuesFound() throws Exception {
        assertTrue(render(ReportFixtures.emptyResult()).contains("No issues found."));
    }
}
