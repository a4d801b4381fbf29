package rules;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Правило, которое ищет регулярное выражение в каждой строке файла.
 * На одну строку выдается не более одного замечания.
 */
public abstract class AbstractPatternRule extends AbstractCodeRule {

    protected AbstractPatternRule(String id, String name, IssueCategory category, Set<Language> languages) {
        super(id, name, category, languages);
    }

    /**
     * Шаблон для языка или {@code null}, если для языка проверки нет.
     */
    protected abstract Pattern getPattern(Language language);

    /**
     * Строит замечание для найденного совпадения.
     */
    protected abstract ReviewIssue createIssue(SourceUnit unit, int lineNumber, Matcher match, RuleSettings settings);

    /**
     * Пропускать ли строки-комментарии. По умолчанию да.
     */
    protected boolean skipComments() {
        return true;
    }

    @Override
    protected List<ReviewIssue> performCheck(SourceUnit unit, RuleSettings settings) {
        Pattern pattern = getPattern(unit.getLanguage());
        if (pattern == null) {
            return List.of();
        }

        List<ReviewIssue> issues = new ArrayList<>();
        List<String> lines = unit.getLines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (skipComments() && unit.isCommentLine(line)) {
                continue;
            }
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                issues.add(createIssue(unit, i + 1, matcher, settings));
            }
        }
        return issues;
    }
}
