package report;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class PdfReporterTest {

    private final PdfReporter reporter = new PdfReporter(ReportFixtures.CLOCK);

    @Test
    void generateToOutputStream_shouldProduceReadablePdf() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        reporter.generateToOutputStream(ReportFixtures.twoIssueResult(), out);

        byte[] bytes = out.toByteArray();
        assertTrue(new String(bytes, 0, 5, java.nio.charset.StandardCharsets.US_ASCII).startsWith("%PDF"));
        try (PDDocument document = Loader.loadPDF(bytes)) {
            assertTrue(document.getNumberOfPages() >= 2);
            assertEquals("Code Review Report session-1", document.getDocumentInformation().getTitle());
        }
    }

    @Test
    void generateToOutputStream_withoutIssues_shouldStillRender() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        reporter.generateToOutputStream(ReportFixtures.emptyResult(), out);

        try (PDDocument document = Loader.loadPDF(out.toByteArray())) {
            assertEquals(2, document.getNumberOfPages());
        }
    }

    @Test
    void generate_textWriter_shouldPointToBinaryMethod() throws Exception {
        StringWriter buffer = new StringWriter();
        reporter.generate(ReportFixtures.twoIssueResult(), new PrintWriter(buffer));

        assertTrue(buffer.toString().contains("generateToOutputStream"));
    }

    @Test
    void sanitize_shouldReplaceUnsupportedCharacters() {
        assertEquals("a?b c", PdfReporter.sanitize("a—b\tc"));
        assertEquals("", PdfReporter.sanitize(null));
    }
}
