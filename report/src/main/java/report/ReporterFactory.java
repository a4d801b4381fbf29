package report;

import java.time.Clock;

/**
 * Фабрика для создания экземпляров генераторов отчетов.
 *
 * <p>Предоставляет централизованный способ создания {@link Reporter} для различных форматов вывода.
 * Часы передаются генераторам, которые печатают время формирования отчета.
 *
 * <p>Примеры использования:
 * <pre>{@code
 * // Консольный репортер без цветов
 * Reporter consoleReporter = ReporterFactory.createReporter(ReportFormat.CONSOLE, false);
 *
 * // HTML репортер с фиксированными часами
 * Reporter htmlReporter = ReporterFactory.createReporter(ReportFormat.HTML, true, clock);
 * }</pre>
 *
 * @author Code Review Agent Team
 * @since 1.0
 */
public final class ReporterFactory {

    private ReporterFactory() {
        // Утилитный класс - конструктор закрыт
    }

    /**
     * Создает генератор отчетов для указанного формата.
     *
     * @param format формат отчета из {@link ReportFormat}
     * @param useColors использовать ли ANSI цвета (применимо только для {@link ReportFormat#CONSOLE})
     * @param clock часы для отметки времени формирования отчета
     * @return экземпляр генератора отчетов для указанного формата
     * @throws NullPointerException если {@code format} равен null
     */
    public static Reporter createReporter(ReportFormat format, boolean useColors, Clock clock) {
        return switch (format) {
            case CONSOLE -> new ConsoleReporter(useColors);
            case JSON -> new JsonReporter();
            case HTML -> new HtmlReporter(clock);
            case MARKDOWN -> new MarkdownReporter(clock);
            case PDF -> new PdfReporter(clock);
        };
    }

    /**
     * Создает генератор отчетов с системными часами.
     */
    public static Reporter createReporter(ReportFormat format, boolean useColors) {
        return createReporter(format, useColors, Clock.systemUTC());
    }

    /**
     * Создает генератор отчетов для указанного формата с настройками по умолчанию.
     *
     * <p>Для консольного формата цвета включены по умолчанию.
     */
    public static Reporter createReporter(ReportFormat format) {
        return createReporter(format, true);
    }
}
