package rules.maintainability;

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
 * Маркеры незавершенной работы: TODO, FIXME, XXX, HACK.
 */
public final class TodoCommentRule extends AbstractPatternRule {

    private static final Pattern MARKER = Pattern.compile("(#|//|/\\*|\\*)\\s*(TODO|FIXME|XXX|HACK)\\b:?\\s*(.*)");

    public TodoCommentRule() {
        super("todo-comment", "Unresolved TODO/FIXME", IssueCategory.MAINTAINABILITY, Set.of());
    }

    @Override
    protected Pattern getPattern(Language language) {
        return MARKER;
    }

    @Override
    protected boolean skipComments() {
        return false;
    }

    @Override
    protected ReviewIssue createIssue(SourceUnit unit, int lineNumber, Matcher match, RuleSettings settings) {
        String marker = match.group(2);
        Severity severity = "FIXME".equals(marker) || "HACK".equals(marker) ? Severity.MEDIUM : Severity.LOW;
        String note = match.group(3).replace("*/", "").trim();
        return issue(unit, lineNumber, severity)
            .description(note.isEmpty() ? marker + " marker left in code" : marker + ": " + note)
            .suggestion("Resolve the pending work or track it in the issue tracker")
            .confidence(1.0)
            .build();
    }
}
