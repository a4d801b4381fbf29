package util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobMatcherTest {

    @Test
    void segmentPattern_shouldMatchAtAnyDepth() {
        GlobMatcher matcher = new GlobMatcher(List.of("node_modules", "*.min.js"));

        assertTrue(matcher.matches("node_modules/lib/index.js"));
        assertTrue(matcher.matches("web/node_modules/x.js"));
        assertTrue(matcher.matches("static/app.min.js"));
        assertFalse(matcher.matches("src/app.js"));
    }

    @Test
    void directoryPattern_shouldMatchEverythingBelow() {
        GlobMatcher matcher = new GlobMatcher(List.of(".git/*", "vendor/**"));

        assertTrue(matcher.matches(".git/config"));
        assertTrue(matcher.matches("vendor/lib/a.py"));
        assertFalse(matcher.matches("src/vendor.py"));
    }

    @Test
    void pathPattern_shouldRespectDirectoryBoundaries() {
        GlobMatcher matcher = new GlobMatcher(List.of("src/gen"));

        assertTrue(matcher.matches("src/gen/model.py"));
        assertFalse(matcher.matches("src/generator.py"));
    }

    @Test
    void blankPatterns_shouldBeIgnored() {
        GlobMatcher matcher = new GlobMatcher(List.of("", "  "));

        assertFalse(matcher.matches("a.py"));
        assertFalse(matcher.matches(null));
    }
}
