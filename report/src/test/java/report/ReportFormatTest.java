package report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReportFormatTest {

    @Test
    void fromString_shouldIgnoreCaseAndAcceptMdAlias() {
        assertEquals(ReportFormat.HTML, ReportFormat.fromString("html"));
        assertEquals(ReportFormat.PDF, ReportFormat.fromString(" Pdf "));
        assertEquals(ReportFormat.MARKDOWN, ReportFormat.fromString("md"));
        assertEquals(ReportFormat.MARKDOWN, ReportFormat.fromString("markdown"));
    }

    @Test
    void fromString_unknownOrEmpty_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> ReportFormat.fromString("docx"));
        assertThrows(IllegalArgumentException.class, () -> ReportFormat.fromString(" "));
        assertThrows(IllegalArgumentException.class, () -> ReportFormat.fromString(null));
    }

    @Test
    void reporterFactory_shouldCreateReporterForEveryFormat() {
        for (ReportFormat format : ReportFormat.values()) {
            Reporter reporter = ReporterFactory.createReporter(format, false, ReportFixtures.CLOCK);
            assertEquals(format, reporter.getFormat());
        }
    }

    @Test
    void extensions_shouldMatchDownloadNames() {
        assertEquals("html", ReportFormat.HTML.getExtension());
        assertEquals("md", ReportFormat.MARKDOWN.getExtension());
        assertEquals("application/pdf", ReportFormat.PDF.getContentType());
    }
}
