package report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import model.ReviewResult;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Генератор отчетов в формате JSON для программной обработки результатов.
 *
 * <p>Выводит полную копию {@link ReviewResult}: идентификатор сессии, время формирования,
 * метрики, список замечаний, рекомендации и использованную конфигурацию. Подходит для:
 * <ul>
 *   <li>Интеграции с системами CI/CD</li>
 *   <li>Сохранения в архиве результатов ({@code review_results.json})</li>
 *   <li>Сравнения результатов между запусками</li>
 * </ul>
 *
 * <p>Особенности формата:
 * <ul>
 *   <li>Pretty-print с отступами для читаемости</li>
 *   <li>Временные метки в ISO-8601 формате (не Unix timestamp)</li>
 *   <li>Уровни и категории записываются в нижнем регистре</li>
 * </ul>
 *
 * @author Code Review Agent Team
 * @since 1.0
 * @see Reporter
 */
public final class JsonReporter implements Reporter {

    private final ObjectMapper objectMapper;

    public JsonReporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void generate(ReviewResult result, PrintWriter writer) throws IOException {
        Objects.requireNonNull(writer, "Writer cannot be null");
        writer.println(toJson(result));
        writer.flush();
    }

    /**
     * Сериализует результат в строку JSON.
     *
     * @param result результат ревью
     * @return форматированный JSON-документ
     * @throws JsonProcessingException если результат не удалось сериализовать
     */
    public String toJson(ReviewResult result) throws JsonProcessingException {
        Objects.requireNonNull(result, "Result cannot be null");
        return objectMapper.writeValueAsString(result);
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.JSON;
    }
}
