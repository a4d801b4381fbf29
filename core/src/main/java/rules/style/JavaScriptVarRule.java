package rules.style;

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
 * Объявления {@code var} в JavaScript и TypeScript.
 */
public final class JavaScriptVarRule extends AbstractPatternRule {

    private static final Pattern VAR_DECLARATION = Pattern.compile("(^|[;{(\\s])var\\s+([A-Za-z_$][\\w$]*)");

    public JavaScriptVarRule() {
        super("no-var", "Use of var", IssueCategory.STYLE, Set.of(Language.JAVASCRIPT, Language.TYPESCRIPT));
    }

    @Override
    protected Pattern getPattern(Language language) {
        return VAR_DECLARATION;
    }

    @Override
    protected ReviewIssue createIssue(SourceUnit unit, int lineNumber, Matcher match, RuleSettings settings) {
        return issue(unit, lineNumber, Severity.LOW)
            .description("Variable '" + match.group(2) + "' declared with var")
            .suggestion("Use let or const instead of var")
            .confidence(0.95)
            .build();
    }
}
