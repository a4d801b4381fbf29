package review;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Состояния жизненного цикла сессии ревью.
 * Allowed transitions: initializing → running → completed | failed,
 * and initializing → failed when a queued session is cancelled or times out.
 */
public enum SessionStatus {
    INITIALIZING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
