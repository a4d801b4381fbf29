package model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.Objects;

/**
 * Одно замечание, найденное анализатором в конкретной строке файла.
 *
 * <p>Объект неизменяем. Создается через {@link #builder()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReviewIssue {

    /**
     * Порядок замечаний в отчете: файл, строка, затем более критичные раньше.
     */
    public static final Comparator<ReviewIssue> REPORT_ORDER = Comparator
        .comparing(ReviewIssue::getFilePath)
        .thenComparingInt(ReviewIssue::getLine)
        .thenComparing(issue -> -issue.getSeverity().getPriority())
        .thenComparing(issue -> issue.getRuleId() == null ? "" : issue.getRuleId());

    private final IssueCategory category;
    private final Severity severity;
    private final String filePath;
    private final int line;
    private final String description;
    private final String suggestion;
    private final String taxonomyCode;
    private final String ruleId;
    private final double confidence;

    private ReviewIssue(Builder builder) {
        this.category = Objects.requireNonNull(builder.category, "Category cannot be null");
        this.severity = Objects.requireNonNull(builder.severity, "Severity cannot be null");
        this.filePath = Objects.requireNonNull(builder.filePath, "File path cannot be null");
        this.description = Objects.requireNonNull(builder.description, "Description cannot be null");
        if (builder.line < 1) {
            throw new IllegalArgumentException("Line must be >= 1, got " + builder.line);
        }
        if (Double.isNaN(builder.confidence) || builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1], got " + builder.confidence);
        }
        this.line = builder.line;
        this.suggestion = builder.suggestion != null ? builder.suggestion : "";
        this.taxonomyCode = builder.taxonomyCode;
        this.ruleId = builder.ruleId;
        this.confidence = builder.confidence;
    }

    public static Builder builder() {
        return new Builder();
    }

    public IssueCategory getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getFilePath() {
        return filePath;
    }

    public int getLine() {
        return line;
    }

    public String getDescription() {
        return description;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Код в внешней таксономии, например {@code CWE-89}, или {@code null}.
     */
    public String getTaxonomyCode() {
        return taxonomyCode;
    }

    public String getRuleId() {
        return ruleId;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReviewIssue that)) {
            return false;
        }
        return line == that.line
            && Double.compare(confidence, that.confidence) == 0
            && category == that.category
            && severity == that.severity
            && filePath.equals(that.filePath)
            && description.equals(that.description)
            && suggestion.equals(that.suggestion)
            && Objects.equals(taxonomyCode, that.taxonomyCode)
            && Objects.equals(ruleId, that.ruleId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, severity, filePath, line, description, ruleId);
    }

    @Override
    public String toString() {
        return "ReviewIssue{" +
                "severity=" + severity +
                ", category=" + category +
                ", file='" + filePath + '\'' +
                ", line=" + line +
                ", rule='" + ruleId + '\'' +
                '}';
    }

    public static final class Builder {
        private IssueCategory category;
        private Severity severity;
        private String filePath;
        private int line = 1;
        private String description;
        private String suggestion;
        private String taxonomyCode;
        private String ruleId;
        private double confidence = 1.0;

        private Builder() {
        }

        public Builder category(IssueCategory category) {
            this.category = category;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder taxonomyCode(String taxonomyCode) {
            this.taxonomyCode = taxonomyCode;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public ReviewIssue build() {
            return new ReviewIssue(this);
        }
    }
}
