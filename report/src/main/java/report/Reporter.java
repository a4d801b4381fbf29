package report;

import model.ReviewResult;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Интерфейс для генерации отчетов о результатах ревью в различных форматах.
 *
 * <p>Каждая реализация отвечает за один формат (HTML, JSON, Markdown, консоль, PDF).
 * Отчет формируется по завершенному {@link ReviewResult}; генерация не изменяет результат
 * и может выполняться сколько угодно раз.
 *
 * <p>Пример использования:
 * <pre>{@code
 * ReviewResult result = engine.getResult(sessionId);
 * Reporter reporter = ReporterFactory.createReporter(ReportFormat.HTML);
 * try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(target))) {
 *     reporter.generate(result, writer);
 * }
 * }</pre>
 *
 * @author Code Review Agent Team
 * @since 1.0
 * @see ReporterFactory
 */
public interface Reporter {

    /**
     * Генерирует отчет по результату ревью.
     *
     * @param result завершенный результат ревью
     * @param writer поток вывода для записи отчета
     * @throws IOException если возникла ошибка при записи отчета
     * @throws NullPointerException если {@code result} или {@code writer} равны null
     */
    void generate(ReviewResult result, PrintWriter writer) throws IOException;

    /**
     * Возвращает формат отчета, поддерживаемый данным генератором.
     *
     * @return формат отчета
     */
    ReportFormat getFormat();
}
