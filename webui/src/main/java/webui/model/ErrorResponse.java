package webui.model;

/**
 * Тело ответа с ошибкой.
 */
public record ErrorResponse(String error) {

    public static ErrorResponse sessionNotFound() {
        return new ErrorResponse("Session not found");
    }

    public static ErrorResponse resultsNotFound() {
        return new ErrorResponse("Results not found");
    }

    public static ErrorResponse of(String message) {
        return new ErrorResponse(message);
    }
}
