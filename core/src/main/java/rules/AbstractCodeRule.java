package rules;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;
import model.Severity;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Абстрактный базовый класс для правил проверки кода.
 * Хранит метаданные правила и изолирует сбой одного правила от остального анализа.
 *
 * <p>Подклассы должны:
 * <ul>
 *   <li>Передать ID, имя, категорию и поддерживаемые языки в конструктор</li>
 *   <li>Реализовать {@link #performCheck(SourceUnit, RuleSettings)} с логикой проверки</li>
 * </ul>
 */
public abstract class AbstractCodeRule implements CodeRule {
    protected final Logger logger = Logger.getLogger(getClass().getName());

    private final String id;
    private final String name;
    private final IssueCategory category;
    private final Set<Language> languages;

    /**
     * @param languages поддерживаемые языки; пустое множество означает все известные языки
     */
    protected AbstractCodeRule(String id, String name, IssueCategory category, Set<Language> languages) {
        this.id = Objects.requireNonNull(id, "Rule ID cannot be null");
        this.name = Objects.requireNonNull(name, "Rule name cannot be null");
        this.category = Objects.requireNonNull(category, "Category cannot be null");
        this.languages = Set.copyOf(languages);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public IssueCategory getCategory() {
        return category;
    }

    @Override
    public boolean supports(Language language) {
        if (language == null || !language.isSupported()) {
            return false;
        }
        return languages.isEmpty() || languages.contains(language);
    }

    @Override
    public final List<ReviewIssue> check(SourceUnit unit, RuleSettings settings) {
        if (!supports(unit.getLanguage())) {
            return List.of();
        }
        try {
            return performCheck(unit, settings);
        } catch (RuntimeException e) {
            logger.warning(getName() + " check failed for " + unit.getPath() + ": " + e);
            return List.of();
        }
    }

    /**
     * Выполнить проверку файла, язык которого поддерживается правилом.
     */
    protected abstract List<ReviewIssue> performCheck(SourceUnit unit, RuleSettings settings);

    /**
     * Заготовка замечания с заполненными категорией, файлом, строкой и ID правила.
     */
    protected ReviewIssue.Builder issue(SourceUnit unit, int lineNumber, Severity severity) {
        return ReviewIssue.builder()
            .category(category)
            .severity(severity)
            .filePath(unit.getPath())
            .line(lineNumber)
            .ruleId(id);
    }
}
