package report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class JsonReporterTest {

    private final JsonReporter reporter = new JsonReporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void toJson_shouldCopyResultFields() throws Exception {
        JsonNode root = mapper.readTree(reporter.toJson(ReportFixtures.twoIssueResult()));

        assertEquals("session-1", root.get("sessionId").asText());
        assertEquals("test-analyzer", root.get("analyzer").asText());
        assertEquals("2025-01-02T15:00:00Z", root.get("generatedAt").asText());
        assertEquals(2, root.get("issues").size());
        assertEquals(2, root.get("recommendations").size());
        assertEquals(120, root.path("configUsed").path("rules").path("maxLineLength").asInt());
    }

    @Test
    void toJson_shouldWriteLowercaseEnums() throws Exception {
        JsonNode root = mapper.readTree(reporter.toJson(ReportFixtures.twoIssueResult()));

        JsonNode security = root.get("issues").get(1);
        assertEquals("security", security.get("category").asText());
        assertEquals("high", security.get("severity").asText());
        assertEquals("CWE-89", security.get("taxonomyCode").asText());

        JsonNode metrics = root.get("metrics");
        assertEquals(1, metrics.path("issuesBySeverity").path("high").asInt());
        assertEquals(0, metrics.path("issuesBySeverity").path("medium").asInt());
        assertEquals(1, metrics.path("issuesByCategory").path("security").asInt());
        assertEquals(0, metrics.path("issuesByCategory").path("maintainability").asInt());
        assertEquals(94, metrics.get("qualityScore").asInt());
    }

    @Test
    void toJson_shouldOmitMissingTaxonomyCode() throws Exception {
        JsonNode root = mapper.readTree(reporter.toJson(ReportFixtures.twoIssueResult()));

        assertFalse(root.get("issues").get(0).has("taxonomyCode"));
    }

    @Test
    void generate_shouldPrettyPrint() throws Exception {
        StringWriter buffer = new StringWriter();
        reporter.generate(ReportFixtures.twoIssueResult(), new PrintWriter(buffer));

        assertTrue(buffer.toString().contains("\n  \"sessionId\""));
        assertEquals(ReportFormat.JSON, reporter.getFormat());
    }
}
