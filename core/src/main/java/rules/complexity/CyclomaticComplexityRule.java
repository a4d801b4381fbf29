package rules.complexity;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;
import model.Severity;
import rules.AbstractCodeRule;
import rules.RuleSettings;
import rules.SourceUnit;
import util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Оценка цикломатической сложности функций: 1 + число точек ветвления.
 *
 * <p>Для Python тело функции определяется по отступу, для остальных языков по балансу
 * фигурных скобок, начиная с заголовка функции. Превышение порога {@code rules.maxComplexity}
 * дает замечание уровня MEDIUM, превышение вдвое дает HIGH.
 */
public final class CyclomaticComplexityRule extends AbstractCodeRule {

    private static final Pattern PYTHON_DEF = Pattern.compile("^(\\s*)(?:async\\s+)?def\\s+(\\w+)");
    private static final Pattern PYTHON_BRANCH = Pattern.compile("\\b(if|elif|for|while|except|and|or|case)\\b");

    private static final Pattern BRACED_FUNCTION = Pattern.compile(
        "^\\s*(?:[\\w<>\\[\\],.*&?:]+\\s+)*(?:function\\s*\\*?\\s*|func\\s+(?:\\([^)]*\\)\\s*)?|fn\\s+)?"
            + "([A-Za-z_$][\\w$]*)\\s*(?:<[^>]*>)?\\s*\\([^;]*$");
    private static final Pattern ARROW_FUNCTION = Pattern.compile(
        "\\b([A-Za-z_$][\\w$]*)\\s*=\\s*(?:async\\s*)?(?:\\([^)]*\\)|[A-Za-z_$][\\w$]*)\\s*=>\\s*\\{");
    private static final Pattern BRACED_BRANCH = Pattern.compile(
        "\\b(if|for|while|case|catch)\\b|&&|\\|\\||\\?(?![.?:,>])");
    private static final Set<String> KEYWORDS = Set.of(
        "if", "for", "while", "switch", "catch", "return", "new", "else", "do", "try", "synchronized", "throw");

    public CyclomaticComplexityRule() {
        super("cyclomatic-complexity", "Cyclomatic Complexity", IssueCategory.COMPLEXITY, Set.of());
    }

    @Override
    protected List<ReviewIssue> performCheck(SourceUnit unit, RuleSettings settings) {
        List<FunctionComplexity> functions = measure(unit);
        int max = settings.getMaxComplexity();
        List<ReviewIssue> issues = new ArrayList<>();
        for (FunctionComplexity function : functions) {
            if (function.complexity() > max) {
                Severity severity = function.complexity() > 2 * max ? Severity.HIGH : Severity.MEDIUM;
                issues.add(issue(unit, function.line(), severity)
                    .description("Function '" + function.name() + "' has cyclomatic complexity "
                        + function.complexity() + " (max " + max + ")")
                    .suggestion("Split the function into smaller functions or simplify branching logic")
                    .confidence(0.75)
                    .build());
            }
        }
        return issues;
    }

    /**
     * Сложность каждой функции файла в порядке следования в исходном коде.
     */
    public List<FunctionComplexity> measure(SourceUnit unit) {
        return unit.getLanguage() == Language.PYTHON ? measureIndented(unit) : measureBraced(unit);
    }

    private List<FunctionComplexity> measureIndented(SourceUnit unit) {
        List<FunctionComplexity> result = new ArrayList<>();
        List<String> lines = unit.getLines();
        for (int i = 0; i < lines.size(); i++) {
            Matcher header = PYTHON_DEF.matcher(lines.get(i));
            if (!header.find()) {
                continue;
            }
            int indent = StringUtils.indentation(lines.get(i));
            int complexity = 1;
            for (int j = i + 1; j < lines.size(); j++) {
                String line = lines.get(j);
                if (line.isBlank() || unit.isCommentLine(line)) {
                    continue;
                }
                if (StringUtils.indentation(line) <= indent) {
                    break;
                }
                complexity += countMatches(PYTHON_BRANCH, stripStrings(line));
            }
            result.add(new FunctionComplexity(header.group(2), i + 1, complexity));
        }
        return result;
    }

    private List<FunctionComplexity> measureBraced(SourceUnit unit) {
        List<FunctionComplexity> result = new ArrayList<>();
        List<String> lines = unit.getLines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (unit.isCommentLine(line)) {
                continue;
            }
            String name = functionName(line);
            if (name == null) {
                continue;
            }
            int bodyStart = findOpeningBrace(lines, i);
            if (bodyStart < 0) {
                continue;
            }
            int complexity = 1;
            int depth = 0;
            boolean opened = false;
            for (int j = bodyStart; j < lines.size(); j++) {
                String bodyLine = stripStrings(lines.get(j));
                if (!unit.isCommentLine(bodyLine)) {
                    String counted = j == bodyStart ? bodyLine.substring(bodyLine.indexOf('{') + 1) : bodyLine;
                    complexity += countMatches(BRACED_BRANCH, counted);
                }
                depth += balance(bodyLine);
                opened = opened || bodyLine.indexOf('{') >= 0;
                if (opened && depth <= 0) {
                    break;
                }
            }
            result.add(new FunctionComplexity(name, i + 1, complexity));
        }
        return result;
    }

    private static String functionName(String line) {
        Matcher arrow = ARROW_FUNCTION.matcher(line);
        if (arrow.find()) {
            return arrow.group(1);
        }
        Matcher matcher = BRACED_FUNCTION.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1);
        if (KEYWORDS.contains(name) || line.trim().startsWith("return ") || line.contains(" new ")) {
            return null;
        }
        return name;
    }

    private static int findOpeningBrace(List<String> lines, int headerLine) {
        for (int i = headerLine; i < lines.size() && i <= headerLine + 3; i++) {
            String line = stripStrings(lines.get(i));
            if (line.indexOf('{') >= 0) {
                return i;
            }
            if (line.trim().endsWith(";")) {
                return -1;
            }
        }
        return -1;
    }

    private static int balance(String line) {
        int delta = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
        }
        return delta;
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    // строковые литералы могут содержать ключевые слова и скобки
    private static String stripStrings(String line) {
        return line.replaceAll("\"(?:\\\\.|[^\"\\\\])*\"|'(?:\\\\.|[^'\\\\])*'", "\"\"");
    }

    /**
     * Complexity of one function.
     */
    public record FunctionComplexity(String name, int line, int complexity) {
    }
}
