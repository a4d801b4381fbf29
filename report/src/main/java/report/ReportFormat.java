package report;

import java.util.Locale;

/**
 * Поддерживаемые форматы вывода отчетов о результатах ревью.
 *
 * <ul>
 *   <li>{@link #CONSOLE} - вывод в терминал, при желании с ANSI цветами</li>
 *   <li>{@link #JSON} - структурированная копия результата для CI/CD и интеграций</li>
 *   <li>{@link #HTML} - основной человекочитаемый отчет для браузера</li>
 *   <li>{@link #MARKDOWN} - отчет для pull request и wiki</li>
 *   <li>{@link #PDF} - документ для архивирования</li>
 * </ul>
 *
 * @author Code Review Agent Team
 * @since 1.0
 */
public enum ReportFormat {
    CONSOLE("Console output with colors", "txt", "text/plain"),
    JSON("JSON format", "json", "application/json"),
    HTML("HTML report", "html", "text/html"),
    MARKDOWN("Markdown report", "md", "text/markdown"),
    PDF("PDF report", "pdf", "application/pdf");

    private final String description;
    private final String extension;
    private final String contentType;

    ReportFormat(String description, String extension, String contentType) {
        this.description = description;
        this.extension = extension;
        this.contentType = contentType;
    }

    /**
     * Возвращает описание формата отчета.
     *
     * @return текстовое описание формата
     */
    public String getDescription() {
        return description;
    }

    /**
     * Расширение файла отчета без точки.
     */
    public String getExtension() {
        return extension;
    }

    /**
     * MIME-тип содержимого отчета.
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * Разбор названия формата без учета регистра; {@code md} принимается как синоним Markdown.
     *
     * @param value название формата ("html", "json", "markdown", ...)
     * @return формат отчета
     * @throws IllegalArgumentException если формат не поддерживается
     */
    public static ReportFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Report format cannot be empty");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("MD".equals(normalized)) {
            return MARKDOWN;
        }
        for (ReportFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported report format: " + value);
    }
}
