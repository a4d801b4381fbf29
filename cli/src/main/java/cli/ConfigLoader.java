package cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import model.ReviewConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Загрузка конфигурации ревью из YAML или JSON файла.
 *
 * <p>Формат определяется по расширению: {@code .yaml} и {@code .yml} читаются как YAML,
 * все остальное как JSON. Значения из файла накладываются на конфигурацию по умолчанию,
 * вложенные секции объединяются.
 *
 * <p>Если файл не указан или не существует, используется конфигурация по умолчанию.
 */
public final class ConfigLoader {
    private static final Logger logger = Logger.getLogger(ConfigLoader.class.getName());

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    /**
     * Конфигурация по умолчанию.
     */
    public static Map<String, Object> defaultConfig() {
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("security", true);
        analysis.put("performance", true);
        analysis.put("style", true);
        analysis.put("complexity", true);

        Map<String, Object> rules = new LinkedHashMap<>();
        rules.put("styleGuide", "pep8");
        rules.put("maxLineLength", 120);
        rules.put("maxComplexity", 10);
        rules.put("allowUnsafeOperations", false);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("format", "detailed");
        output.put("includeFixSuggestions", true);
        output.put("generateReport", true);

        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("minSeverity", "low");
        filters.put("excludeFiles", List.of(".git/*", "node_modules/*", "*.min.js"));
        filters.put("includeTests", true);

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("analysis", analysis);
        config.put("rules", rules);
        config.put("output", output);
        config.put("filters", filters);
        return config;
    }

    /**
     * Загружает конфигурацию.
     *
     * @param file путь к файлу конфигурации или null
     * @return конфигурация ревью
     * @throws IllegalArgumentException если файл не является YAML/JSON объектом
     * @throws IOException если файл не удалось прочитать
     */
    public ReviewConfig load(Path file) throws IOException {
        if (file == null) {
            return ReviewConfig.of(defaultConfig());
        }
        if (!Files.exists(file)) {
            logger.warning("Config file " + file + " not found, using defaults");
            return ReviewConfig.of(defaultConfig());
        }

        String content = Files.readString(file);
        Map<String, Object> loaded = parse(content, isYaml(file) ? yamlMapper : jsonMapper, file);
        logger.fine("Loaded config from " + file);
        return ReviewConfig.of(merge(defaultConfig(), loaded));
    }

    /**
     * Записывает конфигурацию по умолчанию в YAML файл, создавая недостающие каталоги.
     *
     * @param file путь к создаваемому файлу
     * @throws IOException если файл не удалось записать
     */
    public void writeDefaultConfig(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, yamlMapper.writeValueAsString(defaultConfig()));
        logger.fine("Wrote default config to " + file);
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static Map<String, Object> parse(String content, ObjectMapper mapper, Path file) {
        if (content.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = mapper.readValue(content, new TypeReference<Map<String, Object>>() {});
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config file " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overlay) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> entry : overlay.entrySet()) {
            Object existing = merged.get(entry.getKey());
            if (existing instanceof Map && entry.getValue() instanceof Map) {
                merged.put(entry.getKey(), merge((Map<String, Object>) existing, (Map<String, Object>) entry.getValue()));
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }
}
