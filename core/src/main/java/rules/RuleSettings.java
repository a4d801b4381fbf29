package rules;

import model.IssueCategory;
import model.Language;
import model.ReviewConfig;
import model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Типизированное представление частей {@link ReviewConfig}, используемых правилами.
 *
 * <ul>
 *   <li>{@code analysis.<category>} - false отключает все правила категории</li>
 *   <li>{@code rules.maxLineLength} - переопределяет лимит языка</li>
 *   <li>{@code rules.styleGuide} - переопределяет название стандарта оформления языка</li>
 *   <li>{@code rules.maxComplexity} - порог цикломатической сложности, по умолчанию 10</li>
 *   <li>{@code filters.minSeverity} - замечания ниже этого уровня отбрасываются</li>
 *   <li>{@code filters.excludeFiles} - glob-шаблоны пропускаемых путей</li>
 * </ul>
 */
public final class RuleSettings {
    public static final int DEFAULT_MAX_COMPLEXITY = 10;

    private final ReviewConfig config;

    public RuleSettings(ReviewConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    public static RuleSettings defaults() {
        return new RuleSettings(ReviewConfig.empty());
    }

    public boolean isCategoryEnabled(IssueCategory category) {
        return config.getBoolean("analysis." + category.getKey(), true);
    }

    public int getMaxLineLength(Language language) {
        int configured = config.getInt("rules.maxLineLength", 0);
        return configured > 0 ? configured : language.getMaxLineLength();
    }

    public String getStyleGuide(Language language) {
        return config.getString("rules.styleGuide", language.getStyleGuide());
    }

    public int getMaxComplexity() {
        int configured = config.getInt("rules.maxComplexity", DEFAULT_MAX_COMPLEXITY);
        return configured > 0 ? configured : DEFAULT_MAX_COMPLEXITY;
    }

    public Severity getMinSeverity() {
        return Severity.fromString(config.getString("filters.minSeverity", null), Severity.LOW);
    }

    public List<String> getExcludePatterns() {
        return config.getStringList("filters.excludeFiles");
    }
}
