package rules.maintainability;

import model.ReviewIssue;
import model.Severity;
import model.SourceFile;
import org.junit.jupiter.api.Test;
import rules.RuleSettings;
import rules.SourceUnit;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TodoCommentRuleTest {

    @Test
    void check_shouldFlagMarkersInComments() {
        SourceUnit unit = SourceUnit.of(new SourceFile("app.js", """
            // TODO: handle retries
            const todo = 1;
            doWork(); // FIXME broken on empty input
            """));

        List<ReviewIssue> issues = new TodoCommentRule().check(unit, RuleSettings.defaults());

        assertEquals(2, issues.size());
        assertEquals("TODO: handle retries", issues.get(0).getDescription());
        assertEquals(Severity.LOW, issues.get(0).getSeverity());
        assertEquals(3, issues.get(1).getLine());
        assertEquals(Severity.MEDIUM, issues.get(1).getSeverity());
    }
}
