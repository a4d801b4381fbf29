package rules.security;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;
import model.Severity;
import model.SourceFile;
import org.junit.jupiter.api.Test;
import rules.RuleSettings;
import rules.SourceUnit;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecurityRulesTest {

    private final RuleSettings settings = RuleSettings.defaults();

    @Test
    void dangerousEval_shouldDetectPythonEvalAndExec() {
        SourceUnit unit = unit("calc.py", """
            import ast
            value = eval(user_input)
            exec(code)
            safe = ast.literal_eval(user_input)
            # eval(commented)
            """);

        List<ReviewIssue> issues = new DangerousEvalRule().check(unit, settings);

        assertEquals(List.of(2, 3), issues.stream().map(ReviewIssue::getLine).toList());
        assertTrue(issues.stream().allMatch(i -> "CWE-95".equals(i.getTaxonomyCode())));
        assertTrue(issues.stream().allMatch(i -> i.getSeverity() == Severity.HIGH));
    }

    @Test
    void dangerousEval_shouldDetectJavaScriptFunctionConstructor() {
        SourceUnit unit = unit("app.js", "const f = new Function('a', 'return a');\n");

        List<ReviewIssue> issues = new DangerousEvalRule().check(unit, settings);

        assertEquals(1, issues.size());
        assertTrue(issues.get(0).getDescription().contains("new Function"));
    }

    @Test
    void dangerousEval_shouldNotApplyToJava() {
        assertFalse(new DangerousEvalRule().supports(Language.JAVA));
    }

    @Test
    void hardcodedSecret_shouldDetectLiteralPasswords() {
        SourceUnit unit = unit("settings.py", """
            DB_PASSWORD = "s3cr3t-value"
            API_KEY = 'abcd1234efgh'
            password = os.environ["DB_PASSWORD"]
            if password == "":
                pass
            """);

        List<ReviewIssue> issues = new HardcodedSecretRule().check(unit, settings);

        assertEquals(List.of(1, 2), issues.stream().map(ReviewIssue::getLine).toList());
        assertEquals("CWE-798", issues.get(0).getTaxonomyCode());
        assertEquals(IssueCategory.SECURITY, issues.get(0).getCategory());
    }

    @Test
    void hardcodedSecret_placeholder_shouldBeLowSeverity() {
        SourceUnit unit = unit("config.js", "const secret = \"changeme\";\n");

        List<ReviewIssue> issues = new HardcodedSecretRule().check(unit, settings);

        assertEquals(1, issues.size());
        assertEquals(Severity.LOW, issues.get(0).getSeverity());
    }

    @Test
    void sqlConcatenation_shouldDetectConcatenationAndFormatting() {
        SourceUnit unit = unit("db.py", """
            query = "SELECT * FROM users WHERE id = " + user_id
            query2 = "DELETE FROM orders WHERE id = %s" % order_id
            query3 = f"UPDATE users SET name = '{name}'"
            safe = cursor.execute("SELECT * FROM users WHERE id = %s", (user_id,))
            """);

        List<ReviewIssue> issues = new SqlConcatenationRule().check(unit, settings);

        assertEquals(List.of(1, 2, 3), issues.stream().map(ReviewIssue::getLine).toList());
        assertEquals("CWE-89", issues.get(0).getTaxonomyCode());
    }

    @Test
    void sqlConcatenation_shouldDetectJavaConcatenation() {
        SourceUnit unit = unit("Repo.java",
            "String sql = \"SELECT name FROM users WHERE id = \" + id;\n"
                + "PreparedStatement ps = c.prepareStatement(\"SELECT name FROM users WHERE id = ?\");\n");

        List<ReviewIssue> issues = new SqlConcatenationRule().check(unit, settings);

        assertEquals(1, issues.size());
        assertEquals(1, issues.get(0).getLine());
    }

    @Test
    void weakHash_shouldDetectMd5AndSha1() {
        SourceUnit unit = unit("hash.py", """
            digest = hashlib.md5(data).hexdigest()
            other = hashlib.sha256(data).hexdigest()
            legacy = hashlib.sha1(data)
            """);

        List<ReviewIssue> issues = new WeakHashRule().check(unit, settings);

        assertEquals(List.of(1, 3), issues.stream().map(ReviewIssue::getLine).toList());
        assertTrue(issues.get(0).getDescription().contains("MD5"));
        assertEquals(Severity.MEDIUM, issues.get(0).getSeverity());
    }

    @Test
    void weakHash_shouldDetectJavaMessageDigest() {
        SourceUnit unit = unit("Hasher.java", "MessageDigest md = MessageDigest.getInstance(\"SHA-1\");\n");

        List<ReviewIssue> issues = new WeakHashRule().check(unit, settings);

        assertEquals(1, issues.size());
        assertTrue(issues.get(0).getDescription().contains("SHA1"));
    }

    private static SourceUnit unit(String path, String content) {
        return SourceUnit.of(new SourceFile(path, content));
    }
}
