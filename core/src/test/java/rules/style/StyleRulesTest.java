package rules.style;

import model.ReviewConfig;
import model.ReviewIssue;
import model.SourceFile;
import org.junit.jupiter.api.Test;
import rules.RuleSettings;
import rules.SourceUnit;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StyleRulesTest {

    @Test
    void lineLength_shouldUsePep8LimitForPython() {
        SourceUnit unit = unit("long.py", "x = 1\n" + "y = '" + "a".repeat(80) + "'\n");

        List<ReviewIssue> issues = new LineLengthRule().check(unit, RuleSettings.defaults());

        assertEquals(1, issues.size());
        assertEquals(2, issues.get(0).getLine());
        assertEquals("pep8-line-length", issues.get(0).getRuleId());
    }

    @Test
    void lineLength_configuredLimitAndStyleGuide_shouldOverrideLanguageDefaults() {
        RuleSettings settings = new RuleSettings(ReviewConfig.of(
            Map.of("rules", Map.of("maxLineLength", 20, "styleGuide", "airbnb"))));
        SourceUnit unit = unit("app.py", "short = 1\nthis_line_is_longer_than_twenty = 1\n");

        List<ReviewIssue> issues = new LineLengthRule().check(unit, settings);

        assertEquals(1, issues.size());
        assertEquals("airbnb-line-length", issues.get(0).getRuleId());
        assertTrue(issues.get(0).getDescription().contains("> 20"));
    }

    @Test
    void lineLength_javaScript_shouldAllow100Characters() {
        SourceUnit unit = unit("app.js", "const a = '" + "b".repeat(85) + "';\n");

        assertTrue(new LineLengthRule().check(unit, RuleSettings.defaults()).isEmpty());
    }

    @Test
    void trailingWhitespace_shouldFlagLinesEndingWithSpaces() {
        SourceUnit unit = unit("a.py", "x = 1   \ny = 2\n# comment \t\n");

        List<ReviewIssue> issues = new TrailingWhitespaceRule().check(unit, RuleSettings.defaults());

        assertEquals(List.of(1, 3), issues.stream().map(ReviewIssue::getLine).toList());
    }

    @Test
    void javaScriptVar_shouldFlagVarDeclarations() {
        SourceUnit unit = unit("legacy.js", "var count = 0;\nlet total = 1;\nfor (var i = 0; i < 3; i++) {}\n");

        List<ReviewIssue> issues = new JavaScriptVarRule().check(unit, RuleSettings.defaults());

        assertEquals(List.of(1, 3), issues.stream().map(ReviewIssue::getLine).toList());
        assertTrue(issues.get(0).getDescription().contains("'count'"));
    }

    @Test
    void javaScriptVar_shouldIgnorePython() {
        SourceUnit unit = unit("a.py", "var = 1\n");

        assertTrue(new JavaScriptVarRule().check(unit, RuleSettings.defaults()).isEmpty());
    }

    private static SourceUnit unit(String path, String content) {
        return SourceUnit.of(new SourceFile(path, content));
    }
}
