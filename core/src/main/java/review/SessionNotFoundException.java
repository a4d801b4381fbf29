package review;

/**
 * Неизвестный id сессии или запрос результата незавершенной сессии.
 */
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        this(sessionId, "Session not found: " + sessionId);
    }

    public SessionNotFoundException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
