package review;

/**
 * Пакет файлов нарушает ограничения ввода. Бросается синхронно при отправке,
 * сессия при этом не создается.
 */
public class InputRejectedException extends RuntimeException {

    public InputRejectedException(String message) {
        super(message);
    }

    public InputRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
