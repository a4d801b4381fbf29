package model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Итоговый результат ревью одной сессии.
 *
 * <p>Создается анализатором один раз, записывается в хранилище результатов и больше не изменяется.
 */
public final class ReviewResult {
    private final String sessionId;
    private final Instant generatedAt;
    private final String analyzer;
    private final ReviewMetrics metrics;
    private final List<ReviewIssue> issues;
    private final List<String> recommendations;
    private final ReviewConfig configUsed;

    private ReviewResult(Builder builder) {
        this.sessionId = Objects.requireNonNull(builder.sessionId, "Session ID cannot be null");
        this.generatedAt = Objects.requireNonNull(builder.generatedAt, "Generation time cannot be null");
        this.analyzer = Objects.requireNonNull(builder.analyzer, "Analyzer name cannot be null");
        this.issues = List.copyOf(builder.issues);
        this.metrics = builder.metrics != null
            ? builder.metrics
            : ReviewMetrics.of(this.issues, 0, 0);
        this.recommendations = List.copyOf(builder.recommendations);
        this.configUsed = builder.configUsed != null ? builder.configUsed : ReviewConfig.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public String getAnalyzer() {
        return analyzer;
    }

    public ReviewMetrics getMetrics() {
        return metrics;
    }

    public List<ReviewIssue> getIssues() {
        return issues;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public ReviewConfig getConfigUsed() {
        return configUsed;
    }

    /**
     * Замечания указанного уровня в исходном порядке.
     */
    public List<ReviewIssue> getIssues(Severity severity) {
        return issues.stream()
            .filter(issue -> issue.getSeverity() == severity)
            .toList();
    }

    public boolean hasHighSeverityIssues() {
        return metrics.count(Severity.HIGH) > 0;
    }

    @Override
    public String toString() {
        return "ReviewResult{" +
                "sessionId='" + sessionId + '\'' +
                ", analyzer='" + analyzer + '\'' +
                ", issues=" + issues.size() +
                ", qualityScore=" + metrics.getQualityScore() +
                '}';
    }

    public static final class Builder {
        private String sessionId;
        private Instant generatedAt;
        private String analyzer;
        private ReviewMetrics metrics;
        private final List<ReviewIssue> issues = new ArrayList<>();
        private final List<String> recommendations = new ArrayList<>();
        private ReviewConfig configUsed;

        private Builder() {
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public Builder analyzer(String analyzer) {
            this.analyzer = analyzer;
            return this;
        }

        public Builder metrics(ReviewMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder addIssue(ReviewIssue issue) {
            this.issues.add(Objects.requireNonNull(issue, "Issue cannot be null"));
            return this;
        }

        public Builder issues(List<ReviewIssue> issues) {
            this.issues.clear();
            issues.forEach(this::addIssue);
            return this;
        }

        public Builder addRecommendation(String recommendation) {
            this.recommendations.add(Objects.requireNonNull(recommendation, "Recommendation cannot be null"));
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations.clear();
            recommendations.forEach(this::addRecommendation);
            return this;
        }

        public Builder configUsed(ReviewConfig configUsed) {
            this.configUsed = configUsed;
            return this;
        }

        public ReviewResult build() {
            return new ReviewResult(this);
        }
    }
}
