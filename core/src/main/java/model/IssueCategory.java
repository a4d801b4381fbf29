package model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Категории замечаний ревью.
 */
public enum IssueCategory {
    /** Проблемы безопасности */
    @JsonProperty("security")
    SECURITY("Security"),

    /** Проблемы производительности */
    @JsonProperty("performance")
    PERFORMANCE("Performance"),

    /** Нарушения стиля кода */
    @JsonProperty("style")
    STYLE("Style"),

    /** Избыточная сложность */
    @JsonProperty("complexity")
    COMPLEXITY("Complexity"),

    /** Проблемы документации */
    @JsonProperty("documentation")
    DOCUMENTATION("Documentation"),

    /** Сопровождаемость кода */
    @JsonProperty("maintainability")
    MAINTAINABILITY("Maintainability");

    private final String displayName;

    IssueCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Ключ категории в конфигурации и JSON ("security", "style", ...).
     */
    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
