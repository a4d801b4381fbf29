package cli;

import model.SourceFile;
import util.GlobMatcher;
import util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Сбор исходных файлов для ревью из файлов и каталогов командной строки.
 *
 * <p>Каталоги обходятся рекурсивно; берутся файлы с подходящим расширением, не попадающие
 * под шаблоны исключений. Шаблоны сравниваются с путем относительно переданного каталога.
 * Явно указанный файл берется, если подходит его расширение.
 *
 * <p>Путь файла в ревью задается относительно переданного каталога, для явно указанного файла
 * это имя файла. При совпадении таких путей из разных аргументов используется полный путь.
 * Результат отсортирован по пути, дубликаты удаляются.
 */
public final class SourceCollector {
    private static final Logger logger = Logger.getLogger(SourceCollector.class.getName());

    public static final List<String> DEFAULT_EXTENSIONS = List.of(
        ".py", ".js", ".ts", ".java", ".cpp", ".c", ".cs", ".php", ".rb", ".go", ".rs");

    private final Set<String> extensions;
    private final GlobMatcher excludes;

    /**
     * @param extensions расширения файлов, с точкой или без; пустой список означает расширения по умолчанию
     * @param excludePatterns шаблоны исключаемых путей
     */
    public SourceCollector(Collection<String> extensions, Collection<String> excludePatterns) {
        Collection<String> source = extensions == null || extensions.isEmpty() ? DEFAULT_EXTENSIONS : extensions;
        this.extensions = source.stream()
            .filter(ext -> !StringUtils.isEmpty(ext))
            .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
            .map(ext -> ext.startsWith(".") ? ext : "." + ext)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        this.excludes = new GlobMatcher(excludePatterns == null ? List.of() : excludePatterns);
    }

    public Set<String> getExtensions() {
        return Set.copyOf(extensions);
    }

    /**
     * Собирает файлы.
     *
     * @param paths файлы и каталоги
     * @return найденные файлы в порядке пути
     * @throws IllegalArgumentException если путь не существует
     * @throws IOException если файл или каталог не удалось прочитать
     */
    public List<SourceFile> collect(List<Path> paths) throws IOException {
        Map<String, Path> found = new TreeMap<>();
        for (Path path : paths) {
            if (Files.isRegularFile(path)) {
                if (hasSupportedExtension(path)) {
                    add(found, path.getFileName().toString(), path);
                }
            } else if (Files.isDirectory(path)) {
                collectDirectory(path, found);
            } else {
                throw new IllegalArgumentException("Path does not exist: " + path);
            }
        }

        List<SourceFile> files = new ArrayList<>(found.size());
        for (Map.Entry<String, Path> entry : found.entrySet()) {
            files.add(SourceFile.fromBytes(entry.getKey(), Files.readAllBytes(entry.getValue())));
        }
        logger.fine("Collected " + files.size() + " source files");
        return files;
    }

    private void collectDirectory(Path root, Map<String, Path> found) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> candidates = walk
                .filter(Files::isRegularFile)
                .filter(this::hasSupportedExtension)
                .filter(file -> !excludes.matches(StringUtils.normalizePath(root.relativize(file).toString())))
                .toList();
            for (Path file : candidates) {
                add(found, root.relativize(file).toString(), file);
            }
        }
    }

    private boolean hasSupportedExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot));
    }

    private static void add(Map<String, Path> found, String relativePath, Path file) {
        String key = StringUtils.normalizePath(relativePath);
        Path existing = found.get(key);
        if (existing != null && !existing.toAbsolutePath().normalize().equals(file.toAbsolutePath().normalize())) {
            key = StringUtils.normalizePath(file.normalize().toString());
        }
        found.put(key, file);
    }
}
