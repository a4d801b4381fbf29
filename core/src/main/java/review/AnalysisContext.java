package review;

import model.ReviewBatch;
import model.ReviewConfig;
import model.ReviewIssue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.BooleanSupplier;

/**
 * Состояние сессии, общее для всех фаз {@link CodeAnalyzer}.
 *
 * <p>Содержит неизменяемые входные данные, потокобезопасный сборщик замечаний и карту
 * атрибутов для передачи промежуточных результатов между фазами.
 */
public final class AnalysisContext {
    private final String sessionId;
    private final ReviewBatch batch;
    private final ReviewConfig config;
    private final Clock clock;
    private final BooleanSupplier cancellation;
    private final Collection<ReviewIssue> issues = new ConcurrentLinkedQueue<>();
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public AnalysisContext(String sessionId, ReviewBatch batch, ReviewConfig config,
                           Clock clock, BooleanSupplier cancellation) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.batch = Objects.requireNonNull(batch, "Batch cannot be null");
        this.config = config != null ? config : ReviewConfig.empty();
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.cancellation = cancellation != null ? cancellation : () -> false;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ReviewBatch getBatch() {
        return batch;
    }

    public ReviewConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * true, если сессия отменена, истекла по таймауту или поток обработки прерван.
     * Длинные фазы проверяют флаг и завершаются досрочно.
     */
    public boolean isCancelled() {
        return Thread.currentThread().isInterrupted() || cancellation.getAsBoolean();
    }

    public void addIssue(ReviewIssue issue) {
        issues.add(Objects.requireNonNull(issue, "Issue cannot be null"));
    }

    public void addIssues(Collection<ReviewIssue> newIssues) {
        newIssues.forEach(this::addIssue);
    }

    /**
     * Копия собранных замечаний в порядке добавления.
     */
    public List<ReviewIssue> getIssues() {
        return new ArrayList<>(issues);
    }

    public int getIssueCount() {
        return issues.size();
    }

    public void setAttribute(String key, Object value) {
        Objects.requireNonNull(key, "Key cannot be null");
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }

    public <T> Optional<T> getAttribute(String key, Class<T> type) {
        Object value = attributes.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
}
