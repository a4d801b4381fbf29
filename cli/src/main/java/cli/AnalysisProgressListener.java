package cli;

import review.SessionSnapshot;

/**
 * Интерфейс слушателя для отслеживания прогресса ревью и логирования.
 * Реализации могут использовать этот интерфейс для обновления UI, записи логов или отслеживания метрик.
 *
 * <ul>
 *   <li>{@link #onLog(String, String)} - произвольные сообщения</li>
 *   <li>{@link #onProgress(int, String)} - изменение прогресса и текущего шага</li>
 *   <li>{@link #onFinished(SessionSnapshot)} - переход сессии в конечное состояние</li>
 * </ul>
 *
 * @author Code Review Agent Team
 * @since 1.0
 */
public interface AnalysisProgressListener {

    /**
     * Вызывается при генерации сообщения лога.
     *
     * @param level уровень логирования (INFO, WARNING, ERROR и т.д.)
     * @param message сообщение лога
     */
    void onLog(String level, String message);

    /**
     * Вызывается при изменении прогресса сессии.
     *
     * @param progress процент выполнения от 0 до 100
     * @param step описание текущего шага
     */
    void onProgress(int progress, String step);

    /**
     * Вызывается один раз, когда сессия завершилась успешно или с ошибкой.
     *
     * @param snapshot итоговое состояние сессии
     */
    void onFinished(SessionSnapshot snapshot);

    /**
     * Возвращает реализацию по умолчанию, которая не выполняет никаких действий.
     * Используется когда не требуется отслеживание прогресса.
     *
     * @return no-op реализация интерфейса
     */
    static AnalysisProgressListener noOp() {
        return new AnalysisProgressListener() {
            @Override
            public void onLog(String level, String message) {
                // No-op
            }

            @Override
            public void onProgress(int progress, String step) {
                // No-op
            }

            @Override
            public void onFinished(SessionSnapshot snapshot) {
                // No-op
            }
        };
    }
}
