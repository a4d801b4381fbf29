package webui.model;

import java.time.Instant;

/**
 * Состояние сервиса: число активных и всех хранимых сессий.
 */
public record HealthResponse(
    String status,
    Instant timestamp,
    int activeSessions,
    int totalSessions
) {
    public static HealthResponse healthy(Instant timestamp, int activeSessions, int totalSessions) {
        return new HealthResponse("healthy", timestamp, activeSessions, totalSessions);
    }
}
