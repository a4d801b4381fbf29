package webui.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import review.ReviewEngine;
import review.SessionListener;
import review.SessionNotFoundException;
import review.SessionSnapshot;
import webui.model.ErrorResponse;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Обработчик WebSocket для обновлений статуса ревью в реальном времени.
 *
 * <p>Клиент отправляет {@code {"action":"subscribe","sessionId":"..."}} и сразу получает
 * текущий снимок сессии, а затем каждый следующий. Подписка на неизвестную или уже
 * завершенную сессию не регистрируется: клиент получает ошибку или итоговый снимок.
 * После терминального статуса и закрытия соединения пустые подписки удаляются.
 */
@Component
public class ReviewWebSocketHandler extends TextWebSocketHandler implements SessionListener {
    private static final Logger logger = LoggerFactory.getLogger(ReviewWebSocketHandler.class);

    // reviewSessionId -> подписанные WebSocket-соединения
    private final Map<String, Set<WebSocketSession>> subscriptions = new ConcurrentHashMap<>();
    private final ReviewEngine engine;
    private final ObjectMapper objectMapper;

    public ReviewWebSocketHandler(ReviewEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void register() {
        engine.addListener(this);
    }

    @PreDestroy
    public void unregister() {
        engine.removeListener(this);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        logger.info("WebSocket connection established: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Map<String, String> data;
        try {
            data = objectMapper.readValue(message.getPayload(), new TypeReference<Map<String, String>>() {});
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring malformed WebSocket message from {}: {}", session.getId(), e.getOriginalMessage());
            return;
        }

        String action = data.get("action");
        String reviewSessionId = data.get("sessionId");
        if (reviewSessionId == null) {
            return;
        }

        if ("subscribe".equals(action)) {
            subscribe(session, reviewSessionId);
        } else if ("unsubscribe".equals(action)) {
            unsubscribe(session, reviewSessionId);
            logger.info("WebSocket {} unsubscribed from review session {}", session.getId(), reviewSessionId);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        for (String reviewSessionId : List.copyOf(subscriptions.keySet())) {
            unsubscribe(session, reviewSessionId);
        }
        logger.info("WebSocket connection closed: {}", session.getId());
    }

    /**
     * Подписка соединения на обновления сессии ревью с немедленной отправкой текущего снимка.
     */
    void subscribe(WebSocketSession wsSession, String reviewSessionId) {
        SessionSnapshot current;
        try {
            current = engine.getStatus(reviewSessionId);
            if (!current.isTerminal()) {
                subscriptions.compute(reviewSessionId, (id, sessions) -> {
                    Set<WebSocketSession> set = sessions != null ? sessions : new CopyOnWriteArraySet<>();
                    set.add(wsSession);
                    return set;
                });
                // терминальный снимок мог быть разослан до регистрации
                current = engine.getStatus(reviewSessionId);
                if (current.isTerminal()) {
                    unsubscribe(wsSession, reviewSessionId);
                } else {
                    logger.info("WebSocket {} subscribed to review session {}", wsSession.getId(), reviewSessionId);
                }
            }
        } catch (SessionNotFoundException e) {
            unsubscribe(wsSession, reviewSessionId);
            logger.info("WebSocket {} requested unknown review session {}", wsSession.getId(), reviewSessionId);
            send(wsSession, ErrorResponse.sessionNotFound());
            return;
        }
        send(wsSession, current);
    }

    /**
     * Отписка соединения от обновлений сессии ревью.
     */
    void unsubscribe(WebSocketSession wsSession, String reviewSessionId) {
        subscriptions.computeIfPresent(reviewSessionId, (id, sessions) -> {
            sessions.remove(wsSession);
            return sessions.isEmpty() ? null : sessions;
        });
    }

    Set<WebSocketSession> subscribers(String reviewSessionId) {
        return subscriptions.getOrDefault(reviewSessionId, Set.of());
    }

    int subscribedSessionCount() {
        return subscriptions.size();
    }

    @Override
    public void onSessionUpdate(SessionSnapshot snapshot) {
        broadcastUpdate(snapshot);
        if (snapshot.isTerminal()) {
            subscriptions.remove(snapshot.sessionId());
        }
    }

    /**
     * Рассылка снимка всем подписчикам сессии ревью.
     */
    public void broadcastUpdate(SessionSnapshot snapshot) {
        Set<WebSocketSession> sessions = subscriptions.get(snapshot.sessionId());
        if (sessions == null || sessions.isEmpty()) {
            return;
        }

        TextMessage message = toMessage(snapshot);
        if (message == null) {
            return;
        }
        for (WebSocketSession session : sessions) {
            if (!session.isOpen() || !sendMessage(session, message)) {
                unsubscribe(session, snapshot.sessionId());
            }
        }
    }

    private void send(WebSocketSession session, Object payload) {
        TextMessage message = toMessage(payload);
        if (message != null && session.isOpen()) {
            sendMessage(session, message);
        }
    }

    private TextMessage toMessage(Object payload) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            logger.error("Error serializing WebSocket payload {}", payload, e);
            return null;
        }
    }

    /**
     * @return false если соединение больше не принимает сообщения
     */
    private boolean sendMessage(WebSocketSession session, TextMessage message) {
        try {
            // параллельная запись в одно соединение запрещена
            synchronized (session) {
                session.sendMessage(message);
            }
            return true;
        } catch (IOException e) {
            logger.error("Error sending WebSocket message to session {}", session.getId(), e);
            return false;
        } catch (IllegalStateException e) {
            logger.warn("WebSocket session {} is in invalid state, skipping update", session.getId());
            return true;
        }
    }
}
