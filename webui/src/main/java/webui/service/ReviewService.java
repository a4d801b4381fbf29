package webui.service;

import model.ReviewBatch;
import model.ReviewConfig;
import model.ReviewResult;
import model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import report.ArchiveBuilder;
import report.HtmlReporter;
import report.PdfReporter;
import report.ReportFormat;
import report.Reporter;
import report.ReporterFactory;
import review.InputRejectedException;
import review.ReviewEngine;
import review.SessionSnapshot;
import webui.model.HealthResponse;
import webui.model.ReportDocument;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Сервис управления сессиями ревью: прием файлов, статус, результат, отчеты и архив.
 *
 * <p>Все обращения к несуществующей или незавершенной сессии завершаются
 * {@link review.SessionNotFoundException}.
 */
@Service
public class ReviewService {
    private static final Logger logger = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewEngine engine;
    private final HtmlReporter htmlReporter;
    private final ArchiveBuilder archiveBuilder;
    private final Clock clock;

    public ReviewService(ReviewEngine engine, HtmlReporter htmlReporter,
                         ArchiveBuilder archiveBuilder, Clock clock) {
        this.engine = engine;
        this.htmlReporter = htmlReporter;
        this.archiveBuilder = archiveBuilder;
        this.clock = clock;
    }

    /**
     * Запуск ревью загруженных файлов.
     *
     * @param files      загруженные файлы, путь берется из имени файла
     * @param configJson конфигурация ревью в JSON, может отсутствовать
     * @return идентификатор новой сессии
     * @throws InputRejectedException если файлов нет, они превышают лимиты или конфигурация некорректна
     * @throws IOException если содержимое файла не удалось прочитать
     */
    public String submitBatch(MultipartFile[] files, String configJson) throws IOException {
        ReviewConfig config;
        try {
            config = ReviewConfig.fromJson(configJson);
        } catch (IllegalArgumentException e) {
            throw new InputRejectedException(e.getMessage(), e);
        }

        List<SourceFile> sources = new ArrayList<>();
        if (files != null) {
            for (MultipartFile file : files) {
                String name = file.getOriginalFilename();
                if (name == null || name.isBlank()) {
                    name = "file_" + (sources.size() + 1);
                }
                sources.add(SourceFile.fromBytes(name, file.getBytes()));
            }
        }

        String sessionId = engine.submit(new ReviewBatch(sources), config);
        logger.info("Review session {} started with {} file(s)", sessionId, sources.size());
        return sessionId;
    }

    public SessionSnapshot getStatus(String sessionId) {
        return engine.getStatus(sessionId);
    }

    public ReviewResult getResult(String sessionId) {
        return engine.getResult(sessionId);
    }

    /**
     * HTML-отчет по завершенной сессии.
     */
    public String getReport(String sessionId) {
        return htmlReporter.render(engine.getResult(sessionId));
    }

    /**
     * Отчет по завершенной сессии в заданном формате.
     */
    public ReportDocument renderReport(String sessionId, ReportFormat format) throws IOException {
        ReviewResult result = engine.getResult(sessionId);
        byte[] content;
        switch (format) {
            case HTML -> content = htmlReporter.render(result).getBytes(StandardCharsets.UTF_8);
            case PDF -> {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                new PdfReporter(clock).generateToOutputStream(result, out);
                content = out.toByteArray();
            }
            default -> {
                Reporter reporter = ReporterFactory.createReporter(format, false, clock);
                StringWriter buffer = new StringWriter();
                try (PrintWriter writer = new PrintWriter(buffer)) {
                    reporter.generate(result, writer);
                }
                content = buffer.toString().getBytes(StandardCharsets.UTF_8);
            }
        }
        return ReportDocument.of(sessionId, format, content);
    }

    /**
     * ZIP-архив с результатом, HTML-отчетом и сопроводительными документами.
     */
    public byte[] getArchive(String sessionId) throws IOException {
        ReviewResult result = engine.getResult(sessionId);
        return archiveBuilder.build(result, htmlReporter.render(result));
    }

    /**
     * @return false если сессия уже завершена
     */
    public boolean cancel(String sessionId) {
        return engine.cancel(sessionId);
    }

    public HealthResponse health() {
        return HealthResponse.healthy(clock.instant(), engine.activeSessionCount(), engine.sessionCount());
    }
}
