package rules.security;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;
import model.Severity;
import rules.AbstractPatternRule;
import rules.RuleSettings;
import rules.SourceUnit;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Обнаруживает пароли, токены и ключи, записанные строковыми литералами (CWE-798).
 */
public final class HardcodedSecretRule extends AbstractPatternRule {

    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
        "(?i)\\b([\\w]*(password|passwd|pwd|secret|api[_-]?key|access[_-]?key|auth[_-]?token|private[_-]?key)[\\w]*)"
            + "[\"']?\\s*(=|:|=>)\\s*[\"']([^\"'\\s]{4,})[\"']");

    public HardcodedSecretRule() {
        super("hardcoded-secret", "Hard-coded Credentials", IssueCategory.SECURITY, Set.of());
    }

    @Override
    protected Pattern getPattern(Language language) {
        return SECRET_ASSIGNMENT;
    }

    @Override
    protected ReviewIssue createIssue(SourceUnit unit, int lineNumber, Matcher match, RuleSettings settings) {
        String value = match.group(4).toLowerCase(Locale.ROOT);
        boolean placeholder = value.contains("changeme") || value.contains("example")
            || value.contains("xxxx") || value.startsWith("${") || value.startsWith("<");
        return issue(unit, lineNumber, placeholder ? Severity.LOW : Severity.HIGH)
            .description("Hard-coded credential assigned to '" + match.group(1) + "'")
            .suggestion("Load secrets from environment variables or a secret manager")
            .taxonomyCode("CWE-798")
            .confidence(placeholder ? 0.4 : 0.8)
            .build();
    }
}
