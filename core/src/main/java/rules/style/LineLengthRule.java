package rules.style;

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

/**
 * Строки длиннее лимита руководства по стилю.
 * ID правила в замечании: {@code <styleGuide>-line-length}, например {@code pep8-line-length}.
 */
public final class LineLengthRule extends AbstractCodeRule {

    public LineLengthRule() {
        super("line-length", "Line Length", IssueCategory.STYLE, Set.of());
    }

    @Override
    protected List<ReviewIssue> performCheck(SourceUnit unit, RuleSettings settings) {
        Language language = unit.getLanguage();
        int limit = settings.getMaxLineLength(language);
        String ruleId = settings.getStyleGuide(language) + "-line-length";

        List<ReviewIssue> issues = new ArrayList<>();
        List<String> lines = unit.getLines();
        for (int i = 0; i < lines.size(); i++) {
            int length = lines.get(i).length();
            if (length > limit) {
                issues.add(issue(unit, i + 1, Severity.LOW)
                    .ruleId(ruleId)
                    .description("Line exceeds maximum length (" + length + " > " + limit + " characters)")
                    .suggestion("Break long line into multiple lines")
                    .confidence(1.0)
                    .build());
            }
        }
        return issues;
    }
}
