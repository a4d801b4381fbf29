package model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Неизменяемая конфигурация ревью: дерево из map, list и скалярных значений.
 *
 * <p>Передается анализатору без изменений и сохраняется в результате как {@code configUsed}.
 * Вложенные значения адресуются путем через точку, например {@code rules.styleGuide}.
 * Пустая конфигурация допустима, все читатели возвращают значение по умолчанию.
 */
public final class ReviewConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ReviewConfig EMPTY = new ReviewConfig(Map.of());

    private final Map<String, Object> values;

    private ReviewConfig(Map<String, Object> values) {
        this.values = values;
    }

    public static ReviewConfig empty() {
        return EMPTY;
    }

    public static ReviewConfig of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ReviewConfig(freezeMap(values));
    }

    /**
     * Разбор конфигурации из JSON-объекта.
     *
     * @throws IllegalArgumentException если строка не является JSON-объектом
     */
    public static ReviewConfig fromJson(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        try {
            Map<String, Object> parsed = MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {});
            return of(parsed);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config JSON: " + e.getOriginalMessage(), e);
        }
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Значение по пути через точку, или {@code null} если путь не существует.
     */
    public Object get(String path) {
        Objects.requireNonNull(path, "Path cannot be null");
        Object current = values;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public boolean contains(String path) {
        return get(path) != null;
    }

    public String getString(String path, String defaultValue) {
        Object value = get(path);
        if (value == null || value instanceof Map || value instanceof List) {
            return defaultValue;
        }
        return value.toString();
    }

    public int getInt(String path, int defaultValue) {
        Object value = get(path);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String path, boolean defaultValue) {
        Object value = get(path);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return false;
            }
        }
        return defaultValue;
    }

    /**
     * Список строк по пути. Одиночное скалярное значение трактуется как список из одного элемента.
     */
    public List<String> getStringList(String path) {
        Object value = get(path);
        if (value == null || value instanceof Map) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return List.copyOf(result);
        }
        return List.of(value.toString());
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                copy.put(entry.getKey().toString(), freeze(entry.getValue()));
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    copy.add(freeze(item));
                }
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReviewConfig that)) {
            return false;
        }
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ReviewConfig" + values;
    }
}
