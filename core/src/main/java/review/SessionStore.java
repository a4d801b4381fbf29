package review;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реестр сессий ревью в памяти по id сессии.
 */
public final class SessionStore {
    private final Map<String, ReviewSession> sessions = new ConcurrentHashMap<>();

    public void put(String sessionId, ReviewSession session) {
        Objects.requireNonNull(sessionId, "Session ID cannot be null");
        Objects.requireNonNull(session, "Session cannot be null");
        sessions.put(sessionId, session);
    }

    public Optional<ReviewSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws SessionNotFoundException если id неизвестен
     */
    public ReviewSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public boolean remove(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    public Collection<ReviewSession> values() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
