package rules.security;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;
import model.Severity;
import rules.AbstractPatternRule;
import rules.RuleSettings;
import rules.SourceUnit;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Обнаруживает SQL-запросы, собранные конкатенацией или форматированием строк (CWE-89).
 *
 * <p>Срабатывает на строковый литерал с ключевым словом SQL, за которым следует
 * {@code +}, {@code %}, {@code .format(} или подстановка f-строки / шаблонной строки.
 */
public final class SqlConcatenationRule extends AbstractPatternRule {

    private static final String SQL = "(?i:\\b(select\\s.+\\sfrom|insert\\s+into|update\\s+\\w+\\s+set|delete\\s+from)\\b)";

    private static final Pattern CONCATENATION = Pattern.compile(
        "[\"'`][^\"'`]*" + SQL + "[^\"'`]*[\"'`]\\s*(\\+|%|\\.\\s*format\\s*\\()"
            + "|\\bf\"[^\"]*" + SQL + "[^\"]*\\{"
            + "|\\bf'[^']*" + SQL + "[^']*\\{"
            + "|`[^`]*" + SQL + "[^`]*\\$\\{");

    public SqlConcatenationRule() {
        super("sql-concatenation", "SQL Built by String Concatenation", IssueCategory.SECURITY, Set.of());
    }

    @Override
    protected Pattern getPattern(Language language) {
        return CONCATENATION;
    }

    @Override
    protected ReviewIssue createIssue(SourceUnit unit, int lineNumber, Matcher match, RuleSettings settings) {
        return issue(unit, lineNumber, Severity.HIGH)
            .description("SQL injection risk: query built from string concatenation")
            .suggestion("Use parameterized queries instead of string concatenation")
            .taxonomyCode("CWE-89")
            .confidence(0.85)
            .build();
    }
}
