package model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Уровни критичности замечаний ревью.
 * Приоритет используется для сортировки и фильтрации по минимальному уровню.
 */
public enum Severity {
    @JsonProperty("high") HIGH("High", 3),
    @JsonProperty("medium") MEDIUM("Medium", 2),
    @JsonProperty("low") LOW("Low", 1);

    private final String displayName;
    private final int priority;

    Severity(String displayName, int priority) {
        this.displayName = displayName;
        this.priority = priority;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getPriority() {
        return priority;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Проверяет, что уровень не ниже указанного.
     */
    public boolean isAtLeast(Severity other) {
        return priority >= other.priority;
    }

    /**
     * Разбор строкового значения без учета регистра.
     *
     * @param value строка вида "high", "Medium", "LOW"
     * @param defaultValue значение, если строка пустая или не распознана
     */
    public static Severity fromString(String value, Severity defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        return defaultValue;
    }
}
