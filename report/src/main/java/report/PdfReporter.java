package report;

import model.IssueCategory;
import model.ReviewIssue;
import model.ReviewMetrics;
import model.ReviewResult;
import model.Severity;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.awt.Color;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Генератор PDF-отчетов о результатах ревью.
 *
 * <p>Структура PDF-отчета:
 * <ol>
 *   <li><b>Титульная страница</b> - сессия, дата, сводная статистика и круговая диаграмма по уровням</li>
 *   <li><b>Замечания</b> - сгруппированы по уровню критичности с цветовым кодированием</li>
 *   <li><b>Рекомендации</b></li>
 * </ol>
 *
 * <p><b>Важно:</b> PDF требует бинарного вывода, поэтому следует использовать
 * {@link #generateToOutputStream(ReviewResult, OutputStream)}.
 *
 * <p>Технические детали:
 * <ul>
 *   <li>Использует Apache PDFBox и стандартные шрифты Helvetica/Courier</li>
 *   <li>Формат: A4, новые страницы создаются автоматически</li>
 *   <li>Символы вне набора WinAnsi заменяются на '?'</li>
 * </ul>
 *
 * <p>Экземпляр хранит состояние текущего документа и не предназначен для одновременного
 * использования из нескольких потоков.
 *
 * @author Code Review Agent Team
 * @since 1.0
 * @see Reporter
 */
public final class PdfReporter implements Reporter {
    private static final Logger logger = Logger.getLogger(PdfReporter.class.getName());

    private static final float MARGIN = 50;
    private static final float PAGE_WIDTH = PDRectangle.A4.getWidth();
    private static final float PAGE_HEIGHT = PDRectangle.A4.getHeight();
    private static final float LINE_HEIGHT = 12;

    private final Clock clock;
    private final DateTimeFormatter dateFormatter;

    private PDDocument document;
    private PDPageContentStream currentContent;
    private float yPosition;

    private PDFont currentFont;
    private float currentFontSize;
    private PDFont regularFont;
    private PDFont boldFont;
    private PDFont monoFont;

    public PdfReporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.dateFormatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(clock.getZone());
    }

    public PdfReporter() {
        this(Clock.systemUTC());
    }

    /**
     * {@inheritDoc}
     *
     * <p><b>Примечание:</b> PDF требует бинарного вывода; метод только сообщает об этом.
     * Используйте {@link #generateToOutputStream(ReviewResult, OutputStream)}.
     */
    @Override
    public void generate(ReviewResult result, PrintWriter writer) throws IOException {
        writer.println("PDF format requires binary output. Use generateToOutputStream() method instead.");
        writer.flush();
    }

    /**
     * Генерирует PDF-отчет и записывает его в указанный поток вывода.
     *
     * @param result результат ревью
     * @param outputStream поток вывода для записи PDF (не закрывается)
     * @throws IOException если возникла ошибка при генерации или записи PDF
     */
    public synchronized void generateToOutputStream(ReviewResult result, OutputStream outputStream)
            throws IOException {
        Objects.requireNonNull(result, "Result cannot be null");
        Objects.requireNonNull(outputStream, "Output stream cannot be null");

        document = new PDDocument();
        currentContent = null;
        currentFont = null;
        regularFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        boldFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        monoFont = new PDType1Font(Standard14Fonts.FontName.COURIER);

        try {
            PDDocumentInformation info = document.getDocumentInformation();
            info.setTitle("Code Review Report " + result.getSessionId());
            info.setCreator(result.getAnalyzer());

            generateTitlePage(result);
            closeCurrentContent();

            generateIssuesSection(result);
            generateRecommendations(result.getRecommendations());
            closeCurrentContent();

            document.save(outputStream);
            logger.fine("Rendered PDF report for session " + result.getSessionId()
                + " (" + document.getNumberOfPages() + " pages)");
        } finally {
            closeCurrentContent();
            document.close();
            document = null;
        }
    }

    private void closeCurrentContent() throws IOException {
        if (currentContent != null) {
            currentContent.close();
            currentContent = null;
        }
    }

    private void addNewPage() throws IOException {
        PDFont savedFont = currentFont;
        float savedFontSize = currentFontSize;

        closeCurrentContent();
        PDPage page = new PDPage(PDRectangle.A4);
        document.addPage(page);
        currentContent = new PDPageContentStream(document, page);
        yPosition = PAGE_HEIGHT - 80;

        if (savedFont != null && savedFontSize > 0) {
            setFont(savedFont, savedFontSize);
        }
    }

    private void checkPageSpace(float neededSpace) throws IOException {
        if (currentContent == null || yPosition < MARGIN + neededSpace) {
            addNewPage();
        }
    }

    private void setFont(PDFont font, float size) throws IOException {
        currentFont = font;
        currentFontSize = size;
        currentContent.setFont(font, size);
    }

    private void generateTitlePage(ReviewResult result) throws IOException {
        addNewPage();
        ReviewMetrics metrics = result.getMetrics();

        setFont(boldFont, 28);
        drawText("Code Review Report", MARGIN, yPosition);
        yPosition -= 50;

        setFont(regularFont, 14);
        drawText("Session: " + result.getSessionId(), MARGIN, yPosition);
        yPosition -= 22;
        drawText("Report Date: " + dateFormatter.format(clock.instant()), MARGIN, yPosition);
        yPosition -= 22;
        drawText("Analyzer: " + result.getAnalyzer(), MARGIN, yPosition);
        yPosition -= 40;

        setFont(boldFont, 16);
        drawText("Summary Statistics:", MARGIN, yPosition);
        yPosition -= 25;

        setFont(regularFont, 12);
        drawText("Total Issues Found: " + metrics.getTotalIssues(), MARGIN + 10, yPosition);
        yPosition -= 18;
        drawText("Files Processed: " + metrics.getFilesProcessed(), MARGIN + 10, yPosition);
        yPosition -= 18;
        drawText("Lines of Code: " + metrics.getLinesOfCode(), MARGIN + 10, yPosition);
        yPosition -= 18;
        for (IssueCategory category : IssueCategory.values()) {
            drawText(category.getDisplayName() + " Issues: " + metrics.count(category), MARGIN + 10, yPosition);
            yPosition -= 18;
        }
        drawText("Quality Score: " + metrics.getQualityScore() + "/100", MARGIN + 10, yPosition);
        yPosition -= 30;

        Map<Severity, Integer> bySeverity = new LinkedHashMap<>(metrics.getIssuesBySeverity());
        if (metrics.getTotalIssues() > 0) {
            drawPieChart(bySeverity);
        }
    }

    private void generateIssuesSection(ReviewResult result) throws IOException {
        addNewPage();
        setFont(boldFont, 20);
        drawText("Issues", MARGIN, yPosition);
        yPosition -= 30;

        if (result.getIssues().isEmpty()) {
            setFont(regularFont, 12);
            drawText("No issues found.", MARGIN, yPosition);
            yPosition -= 20;
            return;
        }

        for (Severity severity : Severity.values()) {
            List<ReviewIssue> group = result.getIssues(severity);
            if (group.isEmpty()) {
                continue;
            }
            checkPageSpace(40);
            setFont(boldFont, 14);
            currentContent.setNonStrokingColor(getSeverityColor(severity));
            drawText(severity.getDisplayName() + " Severity (" + group.size() + ")", MARGIN, yPosition);
            currentContent.setNonStrokingColor(Color.BLACK);
            yPosition -= 20;

            for (ReviewIssue issue : group) {
                drawIssue(issue);
            }
        }
    }

    private void drawIssue(ReviewIssue issue) throws IOException {
        checkPageSpace(60);
        float maxWidth = PAGE_WIDTH - 2 * MARGIN - 20;

        currentContent.setNonStrokingColor(getSeverityColor(issue.getSeverity()));
        currentContent.addRect(MARGIN, yPosition - 2, 4, 10);
        currentContent.fill();
        currentContent.setNonStrokingColor(Color.BLACK);

        setFont(boldFont, 11);
        yPosition = drawWrappedText(issue.getCategory().getDisplayName() + ": " + issue.getDescription(),
            MARGIN + 10, yPosition, maxWidth);

        setFont(monoFont, 9);
        String location = issue.getFilePath() + ":" + issue.getLine()
            + (issue.getTaxonomyCode() != null ? "  " + issue.getTaxonomyCode() : "");
        yPosition = drawWrappedText(location, MARGIN + 10, yPosition, maxWidth);

        if (!issue.getSuggestion().isEmpty()) {
            setFont(regularFont, 10);
            yPosition = drawWrappedText("Suggestion: " + issue.getSuggestion(), MARGIN + 10, yPosition, maxWidth);
        }
        yPosition -= 8;
    }

    private void generateRecommendations(List<String> recommendations) throws IOException {
        if (recommendations.isEmpty()) {
            return;
        }
        checkPageSpace(60);
        yPosition -= 10;
        setFont(boldFont, 16);
        drawText("Recommendations", MARGIN, yPosition);
        yPosition -= 22;

        setFont(regularFont, 11);
        for (String recommendation : recommendations) {
            yPosition = drawWrappedText("* " + recommendation, MARGIN + 10, yPosition, PAGE_WIDTH - 2 * MARGIN - 20);
        }
    }

    private void drawPieChart(Map<Severity, Integer> data) throws IOException {
        float radius = 80;
        float centerX = PAGE_WIDTH / 2;
        float centerY = yPosition - radius - 10;

        long total = data.values().stream().mapToLong(Integer::longValue).sum();
        float startAngle = 0;
        for (Map.Entry<Severity, Integer> entry : data.entrySet()) {
            float sweepAngle = (entry.getValue() * 360.0f) / total;
            currentContent.setNonStrokingColor(getSeverityColor(entry.getKey()));
            drawPieSlice(centerX, centerY, radius, startAngle, sweepAngle);
            startAngle += sweepAngle;
        }

        float legendY = centerY - radius - 25;
        float legendX = centerX - 60;
        setFont(regularFont, 10);
        for (Map.Entry<Severity, Integer> entry : data.entrySet()) {
            currentContent.setNonStrokingColor(getSeverityColor(entry.getKey()));
            currentContent.addRect(legendX, legendY - 8, 10, 10);
            currentContent.fill();

            currentContent.setNonStrokingColor(Color.BLACK);
            double percentage = (entry.getValue() * 100.0) / total;
            drawText(String.format("%s: %d (%.1f%%)", entry.getKey().getDisplayName(), entry.getValue(), percentage),
                legendX + 15, legendY - 8);
            legendY -= 15;
        }
        yPosition = legendY - 10;
    }

    private void drawPieSlice(float centerX, float centerY, float radius, float startAngle, float sweepAngle)
            throws IOException {
        if (sweepAngle == 0) {
            return;
        }

        currentContent.moveTo(centerX, centerY);

        // дуга аппроксимируется отрезками
        int segments = Math.max(8, (int) (sweepAngle / 10));
        for (int i = 0; i <= segments; i++) {
            float angle = (float) Math.toRadians(startAngle + (sweepAngle * i / segments));
            float x = centerX + radius * (float) Math.cos(angle);
            float y = centerY + radius * (float) Math.sin(angle);
            currentContent.lineTo(x, y);
        }

        currentContent.closePath();
        currentContent.fill();
    }

    private void drawText(String text, float x, float y) throws IOException {
        currentContent.beginText();
        try {
            currentContent.newLineAtOffset(x, y);
            currentContent.showText(sanitize(text));
        } finally {
            currentContent.endText();
        }
    }

    private float drawWrappedText(String text, float x, float y, float maxWidth) throws IOException {
        if (text == null || text.isEmpty()) {
            return y;
        }

        float charWidth = currentFontSize * 0.5f;
        StringBuilder line = new StringBuilder();
        for (String word : text.split(" ")) {
            String testLine = line.length() == 0 ? word : line + " " + word;
            if (testLine.length() * charWidth > maxWidth && line.length() > 0) {
                y = drawLine(line.toString(), x, y);
                line = new StringBuilder(word);
            } else {
                line.append(line.length() == 0 ? "" : " ").append(word);
            }
        }
        if (line.length() > 0) {
            y = drawLine(line.toString(), x, y);
        }
        return y;
    }

    private float drawLine(String line, float x, float y) throws IOException {
        if (y < MARGIN + 15) {
            addNewPage();
            y = yPosition;
        }
        drawText(line, x, y);
        return y - LINE_HEIGHT;
    }

    static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder clean = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t' || c == '\r' || c == '\n') {
                clean.append(' ');
            } else if (c < 0x20 || c > 0x7E) {
                clean.append('?');
            } else {
                clean.append(c);
            }
        }
        return clean.toString();
    }

    private Color getSeverityColor(Severity severity) {
        return switch (severity) {
            case HIGH -> new Color(220, 38, 38);
            case MEDIUM -> new Color(255, 165, 0);
            case LOW -> new Color(100, 149, 237);
        };
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.PDF;
    }
}
