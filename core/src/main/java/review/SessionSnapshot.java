package review;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Согласованный снимок сессии только для чтения, снятый под блокировкой сессии.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSnapshot(
    String sessionId,
    SessionStatus status,
    int progress,
    String currentStep,
    String error,
    int fileCount,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {
    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
