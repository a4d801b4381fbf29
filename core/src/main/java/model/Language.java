package model;

import java.util.List;
import java.util.Locale;

/**
 * Языки исходного кода, распознаваемые по расширению файла.
 * Для каждого языка задан руководящий стиль и лимит длины строки по умолчанию.
 */
public enum Language {
    PYTHON("Python", "pep8", 79, List.of("py")),
    JAVASCRIPT("JavaScript", "airbnb", 100, List.of("js", "jsx", "mjs", "vue")),
    TYPESCRIPT("TypeScript", "airbnb", 100, List.of("ts", "tsx")),
    JAVA("Java", "google", 100, List.of("java")),
    C("C", "default", 120, List.of("c", "h")),
    CPP("C++", "default", 120, List.of("cpp", "cc", "hpp")),
    CSHARP("C#", "default", 120, List.of("cs")),
    PHP("PHP", "psr12", 120, List.of("php")),
    RUBY("Ruby", "default", 120, List.of("rb")),
    GO("Go", "default", 120, List.of("go")),
    RUST("Rust", "default", 100, List.of("rs")),
    UNKNOWN("Unknown", "default", 120, List.of());

    private final String displayName;
    private final String styleGuide;
    private final int maxLineLength;
    private final List<String> extensions;

    Language(String displayName, String styleGuide, int maxLineLength, List<String> extensions) {
        this.displayName = displayName;
        this.styleGuide = styleGuide;
        this.maxLineLength = maxLineLength;
        this.extensions = extensions;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getStyleGuide() {
        return styleGuide;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean isSupported() {
        return this != UNKNOWN;
    }

    /**
     * Определяет язык по расширению (с точкой или без).
     */
    public static Language fromExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return UNKNOWN;
        }
        String normalized = extension.startsWith(".") ? extension.substring(1) : extension;
        normalized = normalized.toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.extensions.contains(normalized)) {
                return language;
            }
        }
        return UNKNOWN;
    }
}
