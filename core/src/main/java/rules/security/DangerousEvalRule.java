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
 * Обнаруживает выполнение динамически построенного кода (CWE-95).
 *
 * <p>Python: {@code eval()}, {@code exec()}; JavaScript/TypeScript: {@code eval()},
 * {@code new Function()}; PHP: {@code eval()}; Ruby: {@code eval}.
 */
public final class DangerousEvalRule extends AbstractPatternRule {

    private static final Pattern PYTHON = Pattern.compile("(?<![\\w.])(eval|exec)\\s*\\(");
    private static final Pattern JAVASCRIPT = Pattern.compile("(?<![\\w.])(eval\\s*\\(|new\\s+Function\\s*\\()");
    private static final Pattern GENERIC = Pattern.compile("(?<![\\w.$])(eval)\\s*[(\\s]");

    public DangerousEvalRule() {
        super("dangerous-eval", "Dangerous Code Evaluation", IssueCategory.SECURITY,
            Set.of(Language.PYTHON, Language.JAVASCRIPT, Language.TYPESCRIPT, Language.PHP, Language.RUBY));
    }

    @Override
    protected Pattern getPattern(Language language) {
        switch (language) {
            case PYTHON:
                return PYTHON;
            case JAVASCRIPT:
            case TYPESCRIPT:
                return JAVASCRIPT;
            default:
                return GENERIC;
        }
    }

    @Override
    protected ReviewIssue createIssue(SourceUnit unit, int lineNumber, Matcher match, RuleSettings settings) {
        String call = match.group(1).replaceAll("\\s+", " ").replace("(", "").trim();
        return issue(unit, lineNumber, Severity.HIGH)
            .description("Use of " + call + "() allows execution of arbitrary code")
            .suggestion("Avoid evaluating dynamic code; parse input explicitly (e.g. ast.literal_eval or JSON.parse)")
            .taxonomyCode("CWE-95")
            .confidence(0.9)
            .build();
    }
}
