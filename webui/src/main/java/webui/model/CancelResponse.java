package webui.model;

/**
 * Результат запроса на отмену ревью.
 */
public record CancelResponse(
    String sessionId,
    String status,
    String message
) {
    public static CancelResponse cancelled(String sessionId) {
        return new CancelResponse(sessionId, "cancelled", "Review cancelled");
    }

    public static CancelResponse alreadyFinished(String sessionId, String status) {
        return new CancelResponse(sessionId, status, "Review already finished");
    }
}
