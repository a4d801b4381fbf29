package webui.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import webui.websocket.ReviewWebSocketHandler;

/**
 * Канал {@code /ws/review} для push-обновлений статуса сессий ревью.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ReviewWebSocketHandler reviewWebSocketHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(ReviewWebSocketHandler reviewWebSocketHandler,
                           @Value("${review.web.allowed-origins}") String[] allowedOrigins) {
        this.reviewWebSocketHandler = reviewWebSocketHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(reviewWebSocketHandler, "/ws/review")
                .setAllowedOrigins(allowedOrigins);
    }
}
