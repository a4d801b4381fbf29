package review;

import model.ReviewResult;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Хранилище результатов ревью в памяти по id сессии; результат записывается один раз.
 */
public final class ResultStore {
    private final Map<String, ReviewResult> results = new ConcurrentHashMap<>();

    /**
     * Сохраняет результат сессии.
     *
     * @throws IllegalStateException если результат сессии уже сохранен
     */
    public void put(String sessionId, ReviewResult result) {
        Objects.requireNonNull(sessionId, "Session ID cannot be null");
        Objects.requireNonNull(result, "Result cannot be null");
        if (results.putIfAbsent(sessionId, result) != null) {
            throw new IllegalStateException("Result for session " + sessionId + " is already stored");
        }
    }

    public Optional<ReviewResult> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(results.get(sessionId));
    }

    /**
     * @throws SessionNotFoundException если результата для id нет
     */
    public ReviewResult get(String sessionId) {
        return find(sessionId).orElseThrow(() ->
            new SessionNotFoundException(sessionId, "Results not found for session: " + sessionId));
    }

    public boolean remove(String sessionId) {
        return sessionId != null && results.remove(sessionId) != null;
    }

    public int size() {
        return results.size();
    }
}
