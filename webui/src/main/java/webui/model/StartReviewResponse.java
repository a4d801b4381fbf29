package webui.model;

/**
 * Ответ на запуск ревью.
 */
public record StartReviewResponse(
    String sessionId,
    String status,
    String message
) {
    public static StartReviewResponse started(String sessionId, int fileCount) {
        return new StartReviewResponse(sessionId, "started",
            "Code review started for " + fileCount + " file(s)");
    }
}
