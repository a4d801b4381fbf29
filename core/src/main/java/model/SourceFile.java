package model;

import util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Один файл из пакета на ревью.
 * Путь хранится в том виде, в каком его передал клиент, с прямыми слешами.
 */
public final class SourceFile {
    private final String path;
    private final String content;
    private final long sizeBytes;

    public SourceFile(String path, String content) {
        this(path, content, content == null ? 0 : content.getBytes(StandardCharsets.UTF_8).length);
    }

    public SourceFile(String path, String content, long sizeBytes) {
        if (StringUtils.isEmpty(path)) {
            throw new IllegalArgumentException("File path cannot be blank");
        }
        this.path = StringUtils.normalizePath(path.trim());
        this.content = Objects.requireNonNull(content, "Content cannot be null");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("File size cannot be negative: " + sizeBytes);
        }
        this.sizeBytes = sizeBytes;
    }

    /**
     * Создает файл из сырых байтов, декодируя их как UTF-8.
     */
    public static SourceFile fromBytes(String path, byte[] bytes) {
        Objects.requireNonNull(bytes, "Bytes cannot be null");
        return new SourceFile(path, new String(bytes, StandardCharsets.UTF_8), bytes.length);
    }

    public String getPath() {
        return path;
    }

    public String getContent() {
        return content;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public String getFileName() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Расширение без точки, или пустая строка.
     */
    public String getExtension() {
        String name = getFileName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1) : "";
    }

    public Language getLanguage() {
        return Language.fromExtension(getExtension());
    }

    @Override
    public String toString() {
        return "SourceFile{path='" + path + "', sizeBytes=" + sizeBytes + '}';
    }
}
