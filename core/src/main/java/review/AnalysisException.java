package review;

/**
 * Ошибка {@link CodeAnalyzer} при выполнении фазы или построении результата.
 * Сообщение становится ошибкой упавшей сессии.
 */
public class AnalysisException extends Exception {

    private final String phase;

    public AnalysisException(String message) {
        super(message);
        this.phase = null;
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
        this.phase = null;
    }

    public AnalysisException(String phase, String message, Throwable cause) {
        super(String.format("[%s] %s", phase, message), cause);
        this.phase = phase;
    }

    /**
     * Название упавшей фазы или {@code null}, если ошибка не связана с фазой.
     */
    public String getPhase() {
        return phase;
    }
}
