package webui.controller;

import model.ReviewResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import report.ReportFormat;
import review.CapacityExceededException;
import review.InputRejectedException;
import review.SessionNotFoundException;
import review.SessionSnapshot;
import webui.model.CancelResponse;
import webui.model.ErrorResponse;
import webui.model.HealthResponse;
import webui.model.ReportDocument;
import webui.model.StartReviewResponse;
import webui.service.ReviewService;

/**
 * REST API ревью кода.
 */
@RestController
@RequestMapping("/api")
public class ReviewController {
    private static final Logger logger = LoggerFactory.getLogger(ReviewController.class);

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    /**
     * Проверка состояния сервиса.
     * GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(reviewService.health());
    }

    /**
     * Запуск ревью загруженных файлов.
     * POST /api/review/start
     */
    @PostMapping(value = "/review/start", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> startReview(
            @RequestParam(value = "files", required = false) MultipartFile[] files,
            @RequestParam(value = "config", required = false) String config) {
        try {
            String sessionId = reviewService.submitBatch(files, config);
            return ResponseEntity.ok(StartReviewResponse.started(sessionId, files.length));
        } catch (InputRejectedException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        } catch (CapacityExceededException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.of(e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to start review", e);
            return ResponseEntity.internalServerError().body(ErrorResponse.of("Failed to start review"));
        }
    }

    /**
     * Статус сессии ревью.
     * GET /api/review/{sessionId}/status
     */
    @GetMapping("/review/{sessionId}/status")
    public ResponseEntity<?> getStatus(@PathVariable("sessionId") String sessionId) {
        try {
            SessionSnapshot snapshot = reviewService.getStatus(sessionId);
            return ResponseEntity.ok(snapshot);
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.sessionNotFound());
        }
    }

    /**
     * Результат завершенного ревью.
     * GET /api/review/{sessionId}/results
     */
    @GetMapping("/review/{sessionId}/results")
    public ResponseEntity<?> getResults(@PathVariable("sessionId") String sessionId) {
        try {
            ReviewResult result = reviewService.getResult(sessionId);
            return ResponseEntity.ok(result);
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.resultsNotFound());
        }
    }

    /**
     * Скачивание отчета в указанном формате.
     * GET /api/review/{sessionId}/report?format={format}
     */
    @GetMapping("/review/{sessionId}/report")
    public ResponseEntity<?> downloadReport(
            @PathVariable("sessionId") String sessionId,
            @RequestParam(value = "format", defaultValue = "html") String formatStr) {
        ReportFormat format;
        try {
            format = ReportFormat.fromString(formatStr);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        }
        if (format == ReportFormat.CONSOLE) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("Unsupported report format: " + formatStr));
        }

        try {
            ReportDocument document = reviewService.renderReport(sessionId, format);
            return attachment(document.content(), document.fileName(), MediaType.parseMediaType(document.contentType()));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.resultsNotFound());
        } catch (Exception e) {
            logger.error("Failed to render {} report for session {}", format, sessionId, e);
            return ResponseEntity.internalServerError().body(ErrorResponse.of("Failed to generate report"));
        }
    }

    /**
     * Скачивание ZIP-архива с результатами.
     * GET /api/review/{sessionId}/download
     */
    @GetMapping("/review/{sessionId}/download")
    public ResponseEntity<?> downloadArchive(@PathVariable("sessionId") String sessionId) {
        try {
            byte[] archive = reviewService.getArchive(sessionId);
            return attachment(archive, "improved_code_" + sessionId + ".zip", MediaType.parseMediaType("application/zip"));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.resultsNotFound());
        } catch (Exception e) {
            logger.error("Failed to build archive for session {}", sessionId, e);
            return ResponseEntity.internalServerError().body(ErrorResponse.of("Failed to build archive"));
        }
    }

    /**
     * Отмена ревью.
     * POST /api/review/{sessionId}/cancel
     */
    @PostMapping("/review/{sessionId}/cancel")
    public ResponseEntity<?> cancelReview(@PathVariable("sessionId") String sessionId) {
        try {
            if (reviewService.cancel(sessionId)) {
                return ResponseEntity.ok(CancelResponse.cancelled(sessionId));
            }
            String status = reviewService.getStatus(sessionId).status().getValue();
            return ResponseEntity.status(HttpStatus.CONFLICT).body(CancelResponse.alreadyFinished(sessionId, status));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.sessionNotFound());
        }
    }

    private static ResponseEntity<Resource> attachment(byte[] data, String fileName, MediaType mediaType) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(mediaType)
                .contentLength(data.length)
                .body(new ByteArrayResource(data));
    }
}
