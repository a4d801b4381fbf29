package model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReviewMetricsTest {

    @Test
    void of_shouldCountEveryCategoryAndSeverity() {
        List<ReviewIssue> issues = List.of(
            issue(IssueCategory.SECURITY, Severity.HIGH),
            issue(IssueCategory.SECURITY, Severity.MEDIUM),
            issue(IssueCategory.STYLE, Severity.LOW));

        ReviewMetrics metrics = ReviewMetrics.of(issues, 4, 120);

        assertEquals(3, metrics.getTotalIssues());
        assertEquals(4, metrics.getFilesProcessed());
        assertEquals(120, metrics.getLinesOfCode());
        assertEquals(2, metrics.count(IssueCategory.SECURITY));
        assertEquals(1, metrics.count(IssueCategory.STYLE));
        assertEquals(0, metrics.count(IssueCategory.PERFORMANCE));
        assertEquals(IssueCategory.values().length, metrics.getIssuesByCategory().size());
        assertEquals(Severity.values().length, metrics.getIssuesBySeverity().size());
        assertEquals(100 - 5 - 2 - 1, metrics.getQualityScore());
    }

    @Test
    void qualityScore_shouldNotGoBelowZero() {
        List<ReviewIssue> issues = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            issues.add(issue(IssueCategory.SECURITY, Severity.HIGH));
        }

        assertEquals(0, ReviewMetrics.of(issues, 1, 1).getQualityScore());
    }

    @Test
    void emptyIssues_shouldScore100() {
        ReviewMetrics metrics = ReviewMetrics.of(List.of(), 0, 0);

        assertEquals(100, metrics.getQualityScore());
        assertEquals(0, metrics.count(Severity.HIGH));
    }

    @Test
    void issue_confidenceOutsideRange_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> ReviewIssue.builder()
            .category(IssueCategory.STYLE).severity(Severity.LOW)
            .filePath("a.py").description("x").confidence(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> ReviewIssue.builder()
            .category(IssueCategory.STYLE).severity(Severity.LOW)
            .filePath("a.py").description("x").line(0).build());
    }

    @Test
    void reportOrder_shouldSortByFileLineThenSeverity() {
        ReviewIssue low = ReviewIssue.builder().category(IssueCategory.STYLE).severity(Severity.LOW)
            .filePath("a.py").line(3).description("low").build();
        ReviewIssue high = ReviewIssue.builder().category(IssueCategory.SECURITY).severity(Severity.HIGH)
            .filePath("a.py").line(3).description("high").build();
        ReviewIssue other = ReviewIssue.builder().category(IssueCategory.STYLE).severity(Severity.HIGH)
            .filePath("b.py").line(1).description("other").build();

        List<ReviewIssue> sorted = new ArrayList<>(List.of(other, low, high));
        sorted.sort(ReviewIssue.REPORT_ORDER);

        assertEquals(List.of(high, low, other), sorted);
    }

    private static ReviewIssue issue(IssueCategory category, Severity severity) {
        return ReviewIssue.builder()
            .category(category)
            .severity(severity)
            .filePath("file.py")
            .line(1)
            .description(category + " " + severity)
            .build();
    }
}
