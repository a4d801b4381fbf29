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

public final class TrailingWhitespaceRule extends AbstractPatternRule {

    private static final Pattern TRAILING = Pattern.compile("\\S[ \\t]+$");

    public TrailingWhitespaceRule() {
        super("trailing-whitespace", "Trailing Whitespace", IssueCategory.STYLE, Set.of());
    }

    @Override
    protected Pattern getPattern(Language language) {
        return TRAILING;
    }

    @Override
    protected boolean skipComments() {
        return false;
    }

    @Override
    protected ReviewIssue createIssue(SourceUnit unit, int lineNumber, Matcher match, RuleSettings settings) {
        return issue(unit, lineNumber, Severity.LOW)
            .description("Trailing whitespace")
            .suggestion("Remove whitespace at the end of the line")
            .confidence(1.0)
            .build();
    }
}
