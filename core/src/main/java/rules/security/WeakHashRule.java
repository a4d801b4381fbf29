package rules.security;

import model.IssueCategory;
import model.Language;
import model.ReviewIssue;
import model.Severity;
import rules.AbstractPatternRule;
import rules.RuleSettings;
import rules.SourceUnit;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Обнаруживает слабые алгоритмы хеширования MD5 и SHA-1 (CWE-327).
 */
public final class WeakHashRule extends AbstractPatternRule {

    private static final Pattern WEAK_HASH = Pattern.compile(
        "hashlib\\.(md5|sha1)\\s*\\("
            + "|MessageDigest\\.getInstance\\(\\s*\"(MD5|SHA-?1)\""
            + "|createHash\\(\\s*['\"](md5|sha1)['\"]"
            + "|(?<![\\w.])(md5|sha1)\\s*\\(",
        Pattern.CASE_INSENSITIVE);

    public WeakHashRule() {
        super("weak-hash", "Weak Cryptographic Hash", IssueCategory.SECURITY, Set.of());
    }

    @Override
    protected Pattern getPattern(Language language) {
        return WEAK_HASH;
    }

    @Override
    protected ReviewIssue createIssue(SourceUnit unit, int lineNumber, Matcher match, RuleSettings settings) {
        String algorithm = firstGroup(match).toUpperCase(Locale.ROOT).replace("-", "");
        return issue(unit, lineNumber, Severity.MEDIUM)
            .description("Weak cryptographic algorithm (" + algorithm + ") detected")
            .suggestion("Use SHA-256 or stronger hashing algorithms")
            .taxonomyCode("CWE-327")
            .confidence(0.8)
            .build();
    }

    private static String firstGroup(Matcher match) {
        for (int i = 1; i <= match.groupCount(); i++) {
            if (match.group(i) != null) {
                return match.group(i);
            }
        }
        return match.group();
    }
}
