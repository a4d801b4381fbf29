package rules.performance;

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
 * Обнаруживает итерацию по индексам {@code for i in range(len(items))} в Python.
 */
public final class RangeLenLoopRule extends AbstractPatternRule {

    private static final Pattern RANGE_LEN = Pattern.compile("\\bfor\\s+\\w+\\s+in\\s+range\\s*\\(\\s*len\\s*\\(");

    public RangeLenLoopRule() {
        super("range-len-loop", "Index-based Iteration", IssueCategory.PERFORMANCE, Set.of(Language.PYTHON));
    }

    @Override
    protected Pattern getPattern(Language language) {
        return RANGE_LEN;
    }

    @Override
    protected ReviewIssue createIssue(SourceUnit unit, int lineNumber, Matcher match, RuleSettings settings) {
        return issue(unit, lineNumber, Severity.LOW)
            .description("Iteration over range(len(...)) instead of the sequence itself")
            .suggestion("Iterate directly over the sequence or use enumerate()")
            .confidence(0.9)
            .build();
    }
}
