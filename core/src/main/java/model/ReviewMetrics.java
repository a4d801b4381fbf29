package model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Сводные счетчики результата ревью.
 *
 * <p>Форма фиксирована: в разбивке по категориям и уровням всегда присутствуют все значения,
 * отсутствующие равны нулю. Оценка качества: {@code max(0, 100 - 5*high - 2*medium - 1*low)}.
 */
public final class ReviewMetrics {
    private final int totalIssues;
    private final int filesProcessed;
    private final int linesOfCode;
    private final Map<IssueCategory, Integer> issuesByCategory;
    private final Map<Severity, Integer> issuesBySeverity;
    private final int qualityScore;

    private ReviewMetrics(int totalIssues, int filesProcessed, int linesOfCode,
                          Map<IssueCategory, Integer> issuesByCategory,
                          Map<Severity, Integer> issuesBySeverity,
                          int qualityScore) {
        this.totalIssues = totalIssues;
        this.filesProcessed = filesProcessed;
        this.linesOfCode = linesOfCode;
        this.issuesByCategory = Collections.unmodifiableMap(issuesByCategory);
        this.issuesBySeverity = Collections.unmodifiableMap(issuesBySeverity);
        this.qualityScore = qualityScore;
    }

    /**
     * Подсчитывает все метрики по списку замечаний.
     *
     * @param issues найденные замечания
     * @param filesProcessed число проанализированных файлов
     * @param linesOfCode число непустых строк кода
     */
    public static ReviewMetrics of(Collection<ReviewIssue> issues, int filesProcessed, int linesOfCode) {
        Objects.requireNonNull(issues, "Issues cannot be null");
        if (filesProcessed < 0 || linesOfCode < 0) {
            throw new IllegalArgumentException("Counters cannot be negative");
        }

        Map<IssueCategory, Integer> byCategory = new EnumMap<>(IssueCategory.class);
        for (IssueCategory category : IssueCategory.values()) {
            byCategory.put(category, 0);
        }
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }

        for (ReviewIssue issue : issues) {
            byCategory.merge(issue.getCategory(), 1, Integer::sum);
            bySeverity.merge(issue.getSeverity(), 1, Integer::sum);
        }

        int penalty = 5 * bySeverity.get(Severity.HIGH)
            + 2 * bySeverity.get(Severity.MEDIUM)
            + bySeverity.get(Severity.LOW);
        int score = Math.max(0, 100 - penalty);

        return new ReviewMetrics(issues.size(), filesProcessed, linesOfCode, byCategory, bySeverity, score);
    }

    public int getTotalIssues() {
        return totalIssues;
    }

    public int getFilesProcessed() {
        return filesProcessed;
    }

    public int getLinesOfCode() {
        return linesOfCode;
    }

    public Map<IssueCategory, Integer> getIssuesByCategory() {
        return issuesByCategory;
    }

    public Map<Severity, Integer> getIssuesBySeverity() {
        return issuesBySeverity;
    }

    public int getQualityScore() {
        return qualityScore;
    }

    public int count(IssueCategory category) {
        return issuesByCategory.get(category);
    }

    public int count(Severity severity) {
        return issuesBySeverity.get(severity);
    }

    @Override
    public String toString() {
        return "ReviewMetrics{" +
                "totalIssues=" + totalIssues +
                ", filesProcessed=" + filesProcessed +
                ", linesOfCode=" + linesOfCode +
                ", qualityScore=" + qualityScore +
                '}';
    }
}
