package rules;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;

import java.util.List;

/**
 * Одна проверка исходного кода, выполняемая {@link RuleBasedCodeAnalyzer}.
 *
 * <p>Реализации регистрируются в {@code META-INF/services/rules.CodeRule}
 * и находятся автоматически через {@link RuleAutoDiscovery}.
 * Реализации не хранят состояние и безопасны для параллельного использования.
 */
public interface CodeRule {

    /**
     * Уникальный идентификатор правила, например "dangerous-eval".
     */
    String getId();

    String getName();

    IssueCategory getCategory();

    /**
     * Применимо ли правило к файлам на данном языке.
     */
    boolean supports(Language language);

    /**
     * Проверяет файл и возвращает найденные замечания.
     *
     * @param unit подготовленный файл
     * @param settings настройки правил из конфигурации ревью
     * @return список замечаний, пустой если нарушений нет
     */
    List<ReviewIssue> check(SourceUnit unit, RuleSettings settings);
}
