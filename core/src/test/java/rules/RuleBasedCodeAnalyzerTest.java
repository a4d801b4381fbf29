package rules;

import model.IssueCategory;
import model.ReviewBatch;
import model.ReviewConfig;
import model.ReviewIssue;
import model.ReviewResult;
import model.Severity;
import model.SourceFile;
import org.junit.jupiter.api.Test;
import review.AnalysisContext;
import review.AnalysisException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedCodeAnalyzerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private static final String VULNERABLE_PY = """
        import hashlib


        def find_user(cursor, user_id):
            query = "SELECT * FROM users WHERE id = " + user_id
            cursor.execute(query)
            return eval(cursor.fetchone())


        def digest(data):
            \"\"\"Legacy digest.\"\"\"
            return hashlib.md5(data).hexdigest()
        """;

    private final RuleBasedCodeAnalyzer analyzer = new RuleBasedCodeAnalyzer();

    @Test
    void phases_shouldFollowReviewPipeline() {
        List<String> phases = analyzer.getPhases(ReviewBatch.of(new SourceFile("a.py", "")), ReviewConfig.empty());

        assertEquals(8, phases.size());
        assertEquals("Extracting and organizing files", phases.get(0));
        assertEquals("Compiling final report", phases.get(7));
    }

    @Test
    void analyze_shouldFindSecurityIssuesInPython() throws AnalysisException {
        ReviewResult result = analyze(ReviewBatch.of(new SourceFile("app/db.py", VULNERABLE_PY)), ReviewConfig.empty());

        assertEquals("s-1", result.getSessionId());
        assertEquals(RuleBasedCodeAnalyzer.NAME, result.getAnalyzer());
        assertEquals(CLOCK.instant(), result.getGeneratedAt());
        assertEquals(1, result.getMetrics().getFilesProcessed());
        assertTrue(result.getMetrics().getLinesOfCode() > 5);
        assertTrue(hasIssue(result, "sql-concatenation", 5));
        assertTrue(hasIssue(result, "dangerous-eval", 7));
        assertTrue(hasIssue(result, "weak-hash", 12));
        assertTrue(hasIssue(result, "missing-docstring", 4));
        assertTrue(result.hasHighSeverityIssues());
        assertTrue(result.getRecommendations().contains(
            "Consider implementing automated testing for security-sensitive functions"));
    }

    @Test
    void analyze_shouldOrderIssuesByFileAndLine() throws AnalysisException {
        ReviewResult result = analyze(ReviewBatch.of(
            new SourceFile("b.js", "var a = 1;\n"),
            new SourceFile("a/db.py", VULNERABLE_PY)), ReviewConfig.empty());

        List<ReviewIssue> issues = result.getIssues();
        for (int i = 1; i < issues.size(); i++) {
            assertTrue(ReviewIssue.REPORT_ORDER.compare(issues.get(i - 1), issues.get(i)) <= 0);
        }
        assertEquals("a/db.py", issues.get(0).getFilePath());
    }

    @Test
    void analyze_shouldHonorExclusionsAndUnsupportedFiles() throws AnalysisException {
        ReviewConfig config = ReviewConfig.of(Map.of("filters", Map.of("excludeFiles", List.of("legacy/*"))));
        ReviewResult result = analyze(ReviewBatch.of(
            new SourceFile("legacy/old.py", VULNERABLE_PY),
            new SourceFile("node_modules/lib/index.js", "var x = eval(y);\n"),
            new SourceFile("notes.txt", "password = 'hunter22'\n"),
            new SourceFile("ok.py", "x = 1\n")), config);

        assertEquals(1, result.getMetrics().getFilesProcessed());
        assertTrue(result.getIssues().isEmpty(), result.getIssues().toString());
        assertEquals(100, result.getMetrics().getQualityScore());
    }

    @Test
    void analyze_shouldApplyMinSeverityAndDisabledCategories() throws AnalysisException {
        ReviewConfig config = ReviewConfig.of(Map.of(
            "analysis", Map.of("security", false),
            "filters", Map.of("minSeverity", "medium")));

        ReviewResult result = analyze(ReviewBatch.of(new SourceFile("app/db.py", VULNERABLE_PY)), config);

        assertTrue(result.getIssues().stream().noneMatch(i -> i.getCategory() == IssueCategory.SECURITY));
        assertTrue(result.getIssues().stream().allMatch(i -> i.getSeverity().isAtLeast(Severity.MEDIUM)));
        assertEquals(config, result.getConfigUsed());
    }

    @Test
    void analyze_minSeverityHigh_shouldRecommendOnlyForReportedIssues() throws AnalysisException {
        ReviewBatch batch = ReviewBatch.of(
            new SourceFile("app/db.py", VULNERABLE_PY),
            new SourceFile("web/main.js", "var a = 1;\n"));

        ReviewResult unfiltered = analyze(batch, ReviewConfig.empty());
        assertTrue(unfiltered.getRecommendations().contains("Enable an automatic formatter to keep code style consistent"));
        assertTrue(unfiltered.getRecommendations().contains("Document public functions and classes"));

        ReviewResult result = analyze(batch,
            ReviewConfig.of(Map.of("filters", Map.of("minSeverity", "high"))));

        assertTrue(result.getIssues().stream().allMatch(i -> i.getCategory() == IssueCategory.SECURITY));
        assertEquals(List.of(
            "Consider implementing automated testing for security-sensitive functions",
            "Add input validation for all user-facing interfaces",
            "Consider using static analysis tools in CI/CD pipeline"), result.getRecommendations());
    }

    @Test
    void buildRecommendations_noIssues_shouldKeepOnlyGeneralAdvice() {
        assertEquals(List.of("Consider using static analysis tools in CI/CD pipeline"),
            RuleBasedCodeAnalyzer.buildRecommendations(List.of()));
    }

    @Test
    void buildResult_withoutPhases_shouldFail() {
        AnalysisContext context = new AnalysisContext("s-1",
            ReviewBatch.of(new SourceFile("a.py", "")), ReviewConfig.empty(), CLOCK, () -> false);

        assertThrows(AnalysisException.class, () -> analyzer.buildResult(context));
        assertThrows(AnalysisException.class, () -> analyzer.runPhase(99, context));
    }

    private ReviewResult analyze(ReviewBatch batch, ReviewConfig config) throws AnalysisException {
        AnalysisContext context = new AnalysisContext("s-1", batch, config, CLOCK, () -> false);
        for (int i = 0; i < analyzer.getPhases(batch, config).size(); i++) {
            analyzer.runPhase(i, context);
        }
        return analyzer.buildResult(context);
    }

    private static boolean hasIssue(ReviewResult result, String ruleId, int line) {
        return result.getIssues().stream()
            .anyMatch(issue -> ruleId.equals(issue.getRuleId()) && issue.getLine() == line);
    }
}
