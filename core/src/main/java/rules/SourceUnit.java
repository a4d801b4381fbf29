package rules;

import model.Language;
import model.SourceFile;

import java.util.List;
import java.util.Objects;

/**
 * Файл, подготовленный к проверке правилами: путь, язык и строки без символов перевода строки.
 * Номера строк в замечаниях начинаются с 1.
 */
public final class SourceUnit {
    private final String path;
    private final Language language;
    private final List<String> lines;
    private final int linesOfCode;

    public SourceUnit(String path, Language language, String content) {
        this.path = Objects.requireNonNull(path, "Path cannot be null");
        this.language = language != null ? language : Language.UNKNOWN;
        this.lines = List.of(Objects.requireNonNull(content, "Content cannot be null").split("\\r?\\n", -1));
        this.linesOfCode = (int) lines.stream().filter(line -> !line.isBlank()).count();
    }

    public static SourceUnit of(SourceFile file) {
        return new SourceUnit(file.getPath(), file.getLanguage(), file.getContent());
    }

    public String getPath() {
        return path;
    }

    public Language getLanguage() {
        return language;
    }

    public List<String> getLines() {
        return lines;
    }

    /**
     * Строка по номеру, начиная с 1.
     */
    public String getLine(int lineNumber) {
        return lines.get(lineNumber - 1);
    }

    public int getLineCount() {
        return lines.size();
    }

    /**
     * Количество непустых строк.
     */
    public int getLinesOfCode() {
        return linesOfCode;
    }

    /**
     * Проверяет, является ли строка однострочным комментарием для языка файла.
     */
    public boolean isCommentLine(String line) {
        String trimmed = line.trim();
        switch (language) {
            case PYTHON, RUBY:
                return trimmed.startsWith("#");
            case PHP:
                return trimmed.startsWith("#") || trimmed.startsWith("//") || trimmed.startsWith("*");
            default:
                return trimmed.startsWith("//") || trimmed.startsWith("/*") || trimmed.startsWith("*");
        }
    }
}
