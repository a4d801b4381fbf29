package review;

import model.ReviewBatch;
import model.ReviewConfig;
import model.ReviewResult;

import java.util.List;

/**
 * Подключаемый анализ, выполняемый задачей ревью.
 *
 * <p>Список фаз запрашивается один раз, затем фазы выполняются по порядку в потоке
 * обработчика, после чего строится результат. Прогресс пишется после завершения каждой фазы.
 * Реализации используются многими сессиями одновременно; состояние сессии хранится
 * в {@link AnalysisContext}.
 */
public interface CodeAnalyzer {

    /**
     * Имя анализатора, записываемое в результат.
     */
    String getName();

    /**
     * Упорядоченные названия фаз для пакета файлов.
     */
    List<String> getPhases(ReviewBatch batch, ReviewConfig config);

    /**
     * Выполняет фазу с указанным индексом (с нуля).
     *
     * @throws AnalysisException если фазу не удалось выполнить
     */
    void runPhase(int index, AnalysisContext context) throws AnalysisException;

    /**
     * Строит итоговый результат после выполнения всех фаз.
     *
     * @throws AnalysisException если результат не удалось построить
     */
    ReviewResult buildResult(AnalysisContext context) throws AnalysisException;
}
