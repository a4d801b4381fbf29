package report;

import model.IssueCategory;
import model.ReviewMetrics;
import model.ReviewResult;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Сборка загружаемого ZIP-архива по результату ревью.
 *
 * <p>Состав архива (в этом порядке):
 * <ol>
 *   <li>{@value #RESULTS_ENTRY} - JSON-копия результата</li>
 *   <li>{@value #REPORT_ENTRY} - готовый HTML-отчет</li>
 *   <li>{@value #README_ENTRY} - сводка по метрикам и рекомендации</li>
 *   <li>{@value #CHANGELOG_ENTRY} - статический журнал изменений из classpath</li>
 * </ol>
 *
 * <p>Время модификации всех записей равно времени формирования результата, поэтому
 * одинаковые входные данные при одинаковых часах дают побайтно одинаковый архив.
 */
public final class ArchiveBuilder {
    private static final Logger logger = Logger.getLogger(ArchiveBuilder.class.getName());

    public static final String RESULTS_ENTRY = "review_results.json";
    public static final String REPORT_ENTRY = "report.html";
    public static final String README_ENTRY = "improved/README.md";
    public static final String CHANGELOG_ENTRY = "improved/CHANGELOG.md";

    private static final String CHANGELOG_RESOURCE = "/archive/CHANGELOG.md";

    private final Clock clock;
    private final JsonReporter jsonReporter;
    private final DateTimeFormatter timestampFormatter;
    private final String changelog;

    public ArchiveBuilder(Clock clock, JsonReporter jsonReporter) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.jsonReporter = Objects.requireNonNull(jsonReporter, "JSON reporter cannot be null");
        this.timestampFormatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(clock.getZone());
        this.changelog = loadChangelog();
    }

    public ArchiveBuilder(Clock clock) {
        this(clock, new JsonReporter());
    }

    /**
     * Собирает архив.
     *
     * @param result завершенный результат ревью
     * @param renderedReport HTML-отчет по этому результату
     * @return содержимое ZIP-файла
     * @throws IOException если результат не удалось сериализовать
     */
    public byte[] build(ReviewResult result, String renderedReport) throws IOException {
        Objects.requireNonNull(result, "Result cannot be null");
        Objects.requireNonNull(renderedReport, "Rendered report cannot be null");

        long entryTime = result.getGeneratedAt().toEpochMilli();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8)) {
            writeEntry(zip, RESULTS_ENTRY, jsonReporter.toJson(result), entryTime);
            writeEntry(zip, REPORT_ENTRY, renderedReport, entryTime);
            writeEntry(zip, README_ENTRY, buildReadme(result), entryTime);
            writeEntry(zip, CHANGELOG_ENTRY, changelog, entryTime);
        }

        byte[] archive = buffer.toByteArray();
        logger.fine("Built archive for session " + result.getSessionId() + " (" + archive.length + " bytes)");
        return archive;
    }

    String buildReadme(ReviewResult result) {
        ReviewMetrics metrics = result.getMetrics();
        StringBuilder readme = new StringBuilder();
        readme.append("# Code Review Results\n\n");
        readme.append("## Summary\n");
        readme.append("- Total Issues Found: ").append(metrics.getTotalIssues()).append('\n');
        for (IssueCategory category : IssueCategory.values()) {
            readme.append("- ").append(category.getDisplayName()).append(" Issues: ")
                .append(metrics.count(category)).append('\n');
        }
        readme.append("- Code Quality Score: ").append(metrics.getQualityScore()).append("/100\n\n");

        readme.append("## Key Improvements\n");
        List<String> recommendations = result.getRecommendations();
        for (String recommendation : recommendations) {
            readme.append("- ").append(recommendation).append('\n');
        }
        readme.append('\n');
        readme.append("Generated on: ").append(timestampFormatter.format(clock.instant())).append('\n');
        return readme.toString();
    }

    private static void writeEntry(ZipOutputStream zip, String name, String content, long time)
            throws IOException {
        ZipEntry entry = new ZipEntry(name);
        entry.setTime(time);
        zip.putNextEntry(entry);
        zip.write(content.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }

    private static String loadChangelog() {
        try (InputStream in = ArchiveBuilder.class.getResourceAsStream(CHANGELOG_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + CHANGELOG_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CHANGELOG_RESOURCE, e);
        }
    }
}
