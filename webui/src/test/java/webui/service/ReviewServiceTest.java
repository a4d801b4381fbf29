package webui.service;

import model.ReviewResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;
import report.ArchiveBuilder;
import report.ReportFormat;
import review.InputRejectedException;
import review.ReviewEngine;
import review.SessionNotFoundException;
import review.SessionSnapshot;
import review.SessionStatus;
import rules.RuleBasedCodeAnalyzer;
import webui.GatedAnalyzer;
import webui.ReviewTestSupport;
import webui.model.HealthResponse;
import webui.model.ReportDocument;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

class ReviewServiceTest {

    private ReviewEngine engine;
    private GatedAnalyzer gatedAnalyzer;

    @AfterEach
    void tearDown() {
        if (gatedAnalyzer != null) {
            gatedAnalyzer.release();
        }
        if (engine != null) {
            engine.close();
        }
    }

    private ReviewService ruleService() {
        engine = ReviewTestSupport.engine(new RuleBasedCodeAnalyzer());
        return ReviewTestSupport.service(engine);
    }

    private ReviewService gatedService() {
        gatedAnalyzer = new GatedAnalyzer();
        engine = ReviewTestSupport.engine(gatedAnalyzer);
        return ReviewTestSupport.service(engine);
    }

    private static MultipartFile file(String name, String content) {
        return new MockMultipartFile("files", name, "text/plain", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void submitBatch_vulnerableFile_shouldCompleteWithHighIssue() throws Exception {
        ReviewService service = ruleService();

        String sessionId = service.submitBatch(
            new MultipartFile[]{file("app.py", ReviewTestSupport.VULNERABLE_PY)}, null);
        SessionSnapshot snapshot = ReviewTestSupport.awaitTerminal(service, sessionId);

        assertEquals(SessionStatus.COMPLETED, snapshot.status());
        assertEquals(100, snapshot.progress());
        assertEquals(1, snapshot.fileCount());

        ReviewResult result = service.getResult(sessionId);
        assertEquals(sessionId, result.getSessionId());
        assertTrue(result.hasHighSeverityIssues());
        assertTrue(result.getIssues().stream().anyMatch(issue -> "app.py".equals(issue.getFilePath())));
    }

    @Test
    void submitBatch_withoutFiles_shouldRejectWithoutSession() {
        ReviewService service = ruleService();

        assertThrows(InputRejectedException.class, () -> service.submitBatch(new MultipartFile[0], null));
        assertThrows(InputRejectedException.class, () -> service.submitBatch(null, null));
        assertEquals(0, engine.sessionCount());
    }

    @Test
    void submitBatch_malformedConfig_shouldReject() {
        ReviewService service = ruleService();

        InputRejectedException e = assertThrows(InputRejectedException.class,
            () -> service.submitBatch(new MultipartFile[]{file("app.py", "x = 1\n")}, "{not json"));
        assertTrue(e.getMessage().contains("Invalid config JSON"));
        assertEquals(0, engine.sessionCount());
    }

    @Test
    void submitBatch_blankFileName_shouldUseGeneratedName() throws Exception {
        ReviewService service = ruleService();

        String sessionId = service.submitBatch(new MultipartFile[]{file("", "x = 1\n")}, null);
        SessionSnapshot snapshot = ReviewTestSupport.awaitTerminal(service, sessionId);

        assertEquals(SessionStatus.COMPLETED, snapshot.status());
        assertEquals(1, snapshot.fileCount());
    }

    @Test
    void getResult_unknownSession_shouldThrowNotFound() {
        ReviewService service = ruleService();

        assertThrows(SessionNotFoundException.class, () -> service.getResult("missing"));
        assertThrows(SessionNotFoundException.class, () -> service.getReport("missing"));
        assertThrows(SessionNotFoundException.class, () -> service.getArchive("missing"));
    }

    @Test
    void getReport_completedSession_shouldBeStableForFixedClock() throws Exception {
        ReviewService service = ruleService();
        String sessionId = service.submitBatch(
            new MultipartFile[]{file("app.py", ReviewTestSupport.VULNERABLE_PY)}, null);
        ReviewTestSupport.awaitTerminal(service, sessionId);

        String first = service.getReport(sessionId);
        String second = service.getReport(sessionId);

        assertEquals(first, second);
        assertTrue(first.contains("High Severity ("));
        assertTrue(first.contains("app.py"));
    }

    @Test
    void renderReport_markdownAndPdf_shouldNameFileAfterSession() throws Exception {
        ReviewService service = ruleService();
        String sessionId = service.submitBatch(
            new MultipartFile[]{file("app.py", ReviewTestSupport.VULNERABLE_PY)}, null);
        ReviewTestSupport.awaitTerminal(service, sessionId);

        ReportDocument markdown = service.renderReport(sessionId, ReportFormat.MARKDOWN);
        assertEquals("code_review_report_" + sessionId + ".md", markdown.fileName());
        assertEquals("text/markdown", markdown.contentType());
        assertTrue(new String(markdown.content(), StandardCharsets.UTF_8).startsWith("# Code Review Report"));

        ReportDocument pdf = service.renderReport(sessionId, ReportFormat.PDF);
        assertEquals("code_review_report_" + sessionId + ".pdf", pdf.fileName());
        assertEquals("%PDF", new String(pdf.content(), 0, 4, StandardCharsets.US_ASCII));
    }

    @Test
    void getArchive_completedSession_shouldContainResultsAndReport() throws Exception {
        ReviewService service = ruleService();
        String sessionId = service.submitBatch(
            new MultipartFile[]{file("app.py", ReviewTestSupport.VULNERABLE_PY)}, null);
        ReviewTestSupport.awaitTerminal(service, sessionId);

        byte[] archive = service.getArchive(sessionId);

        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        assertEquals(List.of(ArchiveBuilder.RESULTS_ENTRY, ArchiveBuilder.REPORT_ENTRY,
            ArchiveBuilder.README_ENTRY, ArchiveBuilder.CHANGELOG_ENTRY), names);
        assertArrayEquals(archive, service.getArchive(sessionId));
    }

    @Test
    void cancel_runningSession_shouldFailItAndRefuseSecondCancel() throws Exception {
        ReviewService service = gatedService();
        String sessionId = service.submitBatch(new MultipartFile[]{file("app.py", "x = 1\n")}, null);

        assertTrue(service.cancel(sessionId));
        SessionSnapshot snapshot = ReviewTestSupport.awaitTerminal(service, sessionId);
        assertEquals(SessionStatus.FAILED, snapshot.status());
        assertNotNull(snapshot.error());

        assertFalse(service.cancel(sessionId));
        assertThrows(SessionNotFoundException.class, () -> service.getResult(sessionId));
        assertThrows(SessionNotFoundException.class, () -> service.cancel("missing"));
    }

    @Test
    void health_shouldCountActiveAndStoredSessions() throws Exception {
        ReviewService service = gatedService();
        service.submitBatch(new MultipartFile[]{file("app.py", "x = 1\n")}, null);

        HealthResponse health = service.health();

        assertEquals("healthy", health.status());
        assertEquals(ReviewTestSupport.CLOCK.instant(), health.timestamp());
        assertEquals(1, health.activeSessions());
        assertEquals(1, health.totalSessions());
    }
}
