package review;

import model.ReviewConfig;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Изменяемое состояние одной задачи ревью.
 *
 * <p>Все изменения и {@link #snapshot()} синхронизированы на сессии, поэтому статус,
 * прогресс, шаг и ошибка всегда читаются согласованно. После перехода в
 * {@link SessionStatus#COMPLETED} или {@link SessionStatus#FAILED} любые изменения
 * игнорируются и возвращают {@code false}.
 */
public final class ReviewSession {
    public static final String INITIAL_STEP = "Starting analysis...";

    private final String id;
    private final ReviewConfig config;
    private final int fileCount;
    private final Instant createdAt;
    private final Clock clock;

    private SessionStatus status = SessionStatus.INITIALIZING;
    private int progress;
    private String currentStep = INITIAL_STEP;
    private String error;
    private Instant startedAt;
    private Instant completedAt;

    public ReviewSession(ReviewConfig config, int fileCount, Clock clock) {
        this(UUID.randomUUID().toString(), config, fileCount, clock);
    }

    public ReviewSession(String id, ReviewConfig config, int fileCount, Clock clock) {
        this.id = Objects.requireNonNull(id, "Session ID cannot be null");
        this.config = config != null ? config : ReviewConfig.empty();
        this.fileCount = fileCount;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.createdAt = clock.instant();
    }

    public String getId() {
        return id;
    }

    public ReviewConfig getConfig() {
        return config;
    }

    public int getFileCount() {
        return fileCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized int getProgress() {
        return progress;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    /**
     * Записывает прогресс. Первая запись переводит сессию из initializing в running.
     * Прогресс не уменьшается и не превышает 100.
     *
     * @return false если сессия уже завершена
     */
    public synchronized boolean updateProgress(int newProgress, String step) {
        if (status.isTerminal()) {
            return false;
        }
        if (status == SessionStatus.INITIALIZING) {
            status = SessionStatus.RUNNING;
            startedAt = clock.instant();
        }
        progress = Math.max(progress, Math.min(100, Math.max(0, newProgress)));
        if (step != null) {
            currentStep = step;
        }
        return true;
    }

    /**
     * Завершает сессию. Действие publish выполняется под блокировкой сессии непосредственно
     * перед сменой статуса, поэтому результат становится виден вместе со статусом completed.
     * Если publish бросает исключение, сессия не меняется, а исключение пробрасывается.
     *
     * @param publish сохраняет результат, не null
     * @return false если сессия уже завершена; publish в этом случае не вызывается
     */
    public synchronized boolean complete(Runnable publish) {
        if (status.isTerminal()) {
            return false;
        }
        publish.run();
        status = SessionStatus.COMPLETED;
        progress = 100;
        currentStep = "Analysis complete";
        completedAt = clock.instant();
        return true;
    }

    /**
     * Переводит сессию в failed с указанным сообщением.
     *
     * @return false если сессия уже завершена
     */
    public synchronized boolean fail(String message) {
        if (status.isTerminal()) {
            return false;
        }
        status = SessionStatus.FAILED;
        error = message == null || message.isBlank() ? "Review failed" : message;
        currentStep = "Analysis failed";
        completedAt = clock.instant();
        return true;
    }

    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(id, status, progress, currentStep, error, fileCount,
            createdAt, startedAt, completedAt);
    }

    @Override
    public String toString() {
        return "ReviewSession{id='" + id + "', status=" + getStatus() + ", progress=" + getProgress() + '}';
    }
}
