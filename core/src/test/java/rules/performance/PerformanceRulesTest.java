package rules.performance;

import model.ReviewIssue;
import model.SourceFile;
import org.junit.jupiter.api.Test;
import rules.RuleSettings;
import rules.SourceUnit;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceRulesTest {

    @Test
    void rangeLen_shouldFlagIndexIteration() {
        SourceUnit unit = unit("loop.py", """
            for i in range(len(items)):
                print(items[i])
            for item in items:
                print(item)
            """);

        List<ReviewIssue> issues = new RangeLenLoopRule().check(unit, RuleSettings.defaults());

        assertEquals(1, issues.size());
        assertEquals(1, issues.get(0).getLine());
    }

    @Test
    void stringConcat_shouldFlagAppendsInsidePythonLoops() {
        SourceUnit unit = unit("build.py", """
            result = ""
            result += "header"
            for row in rows:
                result += str(row)
                count += 1
            result += "footer"
            """);

        List<ReviewIssue> issues = new StringConcatInLoopRule().check(unit, RuleSettings.defaults());

        assertEquals(List.of(4), issues.stream().map(ReviewIssue::getLine).toList());
    }

    @Test
    void stringConcat_shouldFlagAppendsInsideBracedLoops() {
        SourceUnit unit = unit("Build.java", """
            String out = "";
            for (String part : parts) {
                out += "-" + part;
            }
            out += "end";
            """);

        List<ReviewIssue> issues = new StringConcatInLoopRule().check(unit, RuleSettings.defaults());

        assertEquals(List.of(3), issues.stream().map(ReviewIssue::getLine).toList());
    }

    private static SourceUnit unit(String path, String content) {
        return SourceUnit.of(new SourceFile(path, content));
    }
}
