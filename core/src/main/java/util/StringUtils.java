package util;

/**
 * Общие утилиты для работы со строками.
 *
 * <p>Используются моделью, правилами анализа, CLI и WebUI.
 */
public final class StringUtils {

    private StringUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Проверяет, является ли строка пустой или null.
     *
     * @param str проверяемая строка
     * @return true если строка null, пустая или содержит только пробелы
     */
    public static boolean isEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }

    /**
     * Нормализует путь, заменяя обратные слеши на прямые (Windows → Unix).
     */
    public static String normalizePath(String path) {
        return path == null ? null : path.replace('\\', '/');
    }

    /**
     * Количество ведущих пробелов; табуляция считается за четыре.
     */
    public static int indentation(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += 4;
            } else {
                break;
            }
        }
        return width;
    }

    /**
     * Экранирует символы разметки HTML: {@code & < > " '}.
     *
     * @param str исходная строка (null превращается в пустую)
     */
    public static String escapeHtml(String str) {
        if (str == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(str.length() + 16);
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
