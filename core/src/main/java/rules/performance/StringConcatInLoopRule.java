package rules.performance;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;
import model.Severity;
import rules.AbstractCodeRule;
import rules.RuleSettings;
import rules.SourceUnit;
import util.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Обнаруживает накопление строки через {@code +=} внутри цикла.
 *
 * <p>Тело цикла определяется по отступу для Python и по балансу фигурных скобок
 * для остальных языков.
 */
public final class StringConcatInLoopRule extends AbstractCodeRule {

    private static final Pattern LOOP_HEADER = Pattern.compile("^\\s*(for|while|do)\\b");
    private static final Pattern STRING_APPEND = Pattern.compile(
        "\\b\\w+\\s*\\+=\\s*(f?[\"'`]|str\\s*\\(|String\\.valueOf\\s*\\()");

    public StringConcatInLoopRule() {
        super("string-concat-in-loop", "String Concatenation in Loop", IssueCategory.PERFORMANCE,
            Set.of(Language.PYTHON, Language.JAVA, Language.JAVASCRIPT, Language.TYPESCRIPT,
                Language.CSHARP, Language.PHP, Language.GO));
    }

    @Override
    protected List<ReviewIssue> performCheck(SourceUnit unit, RuleSettings settings) {
        return unit.getLanguage() == Language.PYTHON
            ? checkIndentedLoops(unit)
            : checkBracedLoops(unit);
    }

    private List<ReviewIssue> checkIndentedLoops(SourceUnit unit) {
        List<ReviewIssue> issues = new ArrayList<>();
        Deque<Integer> loopIndents = new ArrayDeque<>();
        List<String> lines = unit.getLines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || unit.isCommentLine(line)) {
                continue;
            }
            int indent = StringUtils.indentation(line);
            while (!loopIndents.isEmpty() && indent <= loopIndents.peek()) {
                loopIndents.pop();
            }
            if (!loopIndents.isEmpty() && STRING_APPEND.matcher(line).find()) {
                issues.add(createIssue(unit, i + 1));
            }
            if (LOOP_HEADER.matcher(line).find()) {
                loopIndents.push(indent);
            }
        }
        return issues;
    }

    private List<ReviewIssue> checkBracedLoops(SourceUnit unit) {
        List<ReviewIssue> issues = new ArrayList<>();
        Deque<Integer> loopDepths = new ArrayDeque<>();
        boolean pendingLoop = false;
        int depth = 0;
        List<String> lines = unit.getLines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (unit.isCommentLine(line)) {
                continue;
            }
            if (!loopDepths.isEmpty() && STRING_APPEND.matcher(line).find()) {
                issues.add(createIssue(unit, i + 1));
            }
            if (LOOP_HEADER.matcher(line).find()) {
                pendingLoop = true;
            }
            for (char c : line.toCharArray()) {
                if (c == '{') {
                    depth++;
                    if (pendingLoop) {
                        loopDepths.push(depth);
                        pendingLoop = false;
                    }
                } else if (c == '}') {
                    while (!loopDepths.isEmpty() && loopDepths.peek() >= depth) {
                        loopDepths.pop();
                    }
                    depth = Math.max(0, depth - 1);
                }
            }
            if (pendingLoop && line.trim().endsWith(";")) {
                // тело цикла из одного оператора без скобок
                pendingLoop = false;
            }
        }
        return issues;
    }

    private ReviewIssue createIssue(SourceUnit unit, int lineNumber) {
        return issue(unit, lineNumber, Severity.MEDIUM)
            .description("String built by repeated concatenation inside a loop")
            .suggestion("Collect the parts in a list and join them, or use a StringBuilder")
            .confidence(0.7)
            .build();
    }
}
