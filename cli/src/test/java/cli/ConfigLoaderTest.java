package cli;

import model.ReviewConfig;
import model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void load_null_shouldReturnDefaults() throws Exception {
        ReviewConfig config = loader.load(null);

        assertEquals("pep8", config.getString("rules.styleGuide", null));
        assertEquals(120, config.getInt("rules.maxLineLength", 0));
        assertEquals(10, config.getInt("rules.maxComplexity", 0));
        assertEquals("low", config.getString("filters.minSeverity", null));
        assertEquals(List.of(".git/*", "node_modules/*", "*.min.js"), config.getStringList("filters.excludeFiles"));
        assertTrue(config.getBoolean("analysis.security", false));
    }

    @Test
    void load_missingFile_shouldFallBackToDefaults() throws Exception {
        ReviewConfig config = loader.load(tempDir.resolve("absent.yaml"));

        assertEquals(ReviewConfig.of(ConfigLoader.defaultConfig()), config);
    }

    @Test
    void load_yaml_shouldOverlayDefaults() throws Exception {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, """
            rules:
              maxLineLength: 100
            filters:
              minSeverity: medium
            analysis:
              style: false
            """);

        ReviewConfig config = loader.load(file);

        assertEquals(100, config.getInt("rules.maxLineLength", 0));
        assertEquals("pep8", config.getString("rules.styleGuide", null));
        assertEquals(Severity.MEDIUM, Severity.fromString(config.getString("filters.minSeverity", null), null));
        assertFalse(config.getBoolean("analysis.style", true));
        assertTrue(config.getBoolean("analysis.security", false));
    }

    @Test
    void load_json_shouldOverlayDefaults() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"rules\": {\"styleGuide\": \"google\"}, \"custom\": [1, 2]}");

        ReviewConfig config = loader.load(file);

        assertEquals("google", config.getString("rules.styleGuide", null));
        assertEquals(120, config.getInt("rules.maxLineLength", 0));
        assertEquals(List.of("1", "2"), config.getStringList("custom"));
    }

    @Test
    void load_malformedJson_shouldThrowIllegalArgument() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"rules\": ");

        assertThrows(IllegalArgumentException.class, () -> loader.load(file));
    }

    @Test
    void load_emptyFile_shouldReturnDefaults() throws Exception {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertEquals(ReviewConfig.of(ConfigLoader.defaultConfig()), loader.load(file));
    }
}
