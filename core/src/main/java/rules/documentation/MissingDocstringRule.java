package rules.documentation;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;
import model.Severity;
import rules.AbstractCodeRule;
import rules.RuleSettings;
import rules.SourceUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Публичные функции и классы Python без docstring.
 * Имена, начинающиеся с подчеркивания, не проверяются.
 */
public final class MissingDocstringRule extends AbstractCodeRule {

    private static final Pattern DEFINITION = Pattern.compile("^\\s*(?:async\\s+)?(def|class)\\s+(\\w+)");
    // "def f(): return 1" or "class A: pass"
    private static final Pattern ONE_LINE_BODY = Pattern.compile("\\)\\s*(->\\s*[^:]+)?:\\s*\\S|^class\\s+\\w+\\s*:\\s*\\S");
    private static final Pattern DOCSTRING_START = Pattern.compile("^\\s*[rRuUbB]?(\"\"\"|'''|\"|')");

    public MissingDocstringRule() {
        super("missing-docstring", "Missing Docstring", IssueCategory.DOCUMENTATION, Set.of(Language.PYTHON));
    }

    @Override
    protected List<ReviewIssue> performCheck(SourceUnit unit, RuleSettings settings) {
        List<ReviewIssue> issues = new ArrayList<>();
        List<String> lines = unit.getLines();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = DEFINITION.matcher(lines.get(i));
            if (!matcher.find() || matcher.group(2).startsWith("_")) {
                continue;
            }
            int headerEnd = findHeaderEnd(lines, i);
            if (headerEnd < 0 || hasDocstring(lines, headerEnd + 1, unit)) {
                continue;
            }
            String kind = "def".equals(matcher.group(1)) ? "Function" : "Class";
            issues.add(issue(unit, i + 1, Severity.LOW)
                .description(kind + " '" + matcher.group(2) + "' is missing a docstring")
                .suggestion("Add a docstring describing the purpose, parameters and return value")
                .confidence(0.9)
                .build());
        }
        return issues;
    }

    private static int findHeaderEnd(List<String> lines, int start) {
        for (int i = start; i < lines.size(); i++) {
            String code = stripComment(lines.get(i)).trim();
            if (code.endsWith(":")) {
                return i;
            }
            if (ONE_LINE_BODY.matcher(code).find()) {
                return -1;
            }
        }
        return -1;
    }

    private static boolean hasDocstring(List<String> lines, int from, SourceUnit unit) {
        for (int i = from; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || unit.isCommentLine(line)) {
                continue;
            }
            return DOCSTRING_START.matcher(line).find();
        }
        return false;
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }
}
