package util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Сопоставление путей файлов с шаблонами исключений.
 *
 * <p>Поддерживаются {@code *} (любые символы, кроме '/'), {@code **} (любые символы) и {@code ?}.
 * Шаблон без '/' сравнивается с каждым сегментом пути, поэтому {@code node_modules}
 * исключает каталог на любой глубине, а {@code *.min.js} исключает файл в любом каталоге.
 * Шаблон вида {@code .git/*} исключает все содержимое каталога.
 */
public final class GlobMatcher {
    private final List<Pattern> segmentPatterns = new ArrayList<>();
    private final List<Pattern> pathPatterns = new ArrayList<>();

    public GlobMatcher(Collection<String> globs) {
        for (String glob : globs) {
            if (StringUtils.isEmpty(glob)) {
                continue;
            }
            String normalized = StringUtils.normalizePath(glob.trim());
            if (normalized.endsWith("/*")) {
                // "dir/*" означает все, что лежит внутри dir
                normalized = normalized.substring(0, normalized.length() - 2);
            }
            if (normalized.contains("/")) {
                pathPatterns.add(toRegex(normalized));
            } else {
                segmentPatterns.add(toRegex(normalized));
            }
        }
    }

    public boolean matches(String path) {
        if (path == null) {
            return false;
        }
        String normalized = StringUtils.normalizePath(path);
        for (String segment : normalized.split("/")) {
            for (Pattern pattern : segmentPatterns) {
                if (pattern.matcher(segment).matches()) {
                    return true;
                }
            }
        }
        for (Pattern pattern : pathPatterns) {
            if (isDirectoryPrefix(pattern, normalized)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDirectoryPrefix(Pattern pattern, String path) {
        Matcher matcher = pattern.matcher(path);
        return matcher.lookingAt() && (matcher.end() == path.length() || path.charAt(matcher.end()) == '/');
    }

    static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return Pattern.compile(regex.toString());
    }
}
