package webui;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Точка входа в веб-интерфейс Code Review Agent.
 *
 * <p>Возможности:
 * <ul>
 *   <li>Загрузка пакета файлов и запуск ревью в фоне</li>
 *   <li>Опрос статуса и push-обновления через WebSocket</li>
 *   <li>Выгрузка результата, отчетов и ZIP-архива</li>
 * </ul>
 *
 * <p>Запуск: java -jar webui/target/code-review-agent-webui.jar
 * <br>Доступ: http://localhost:5000
 */
@SpringBootApplication
public class CodeReviewWebUI {

    public static void main(String[] args) {
        SpringApplication.run(CodeReviewWebUI.class, args);
    }

    /**
     * Настройка Jackson ObjectMapper для сериализации JSON.
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    /**
     * CORS для REST API. Разрешенные источники задаются свойством {@code review.web.allowed-origins}.
     */
    @Bean
    public WebMvcConfigurer corsConfigurer(@Value("${review.web.allowed-origins}") String[] allowedOrigins) {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins(allowedOrigins)
                        .allowedMethods("GET", "POST", "OPTIONS")
                        .allowedHeaders("*")
                        .exposedHeaders(HttpHeaders.CONTENT_DISPOSITION);
            }
        };
    }
}
