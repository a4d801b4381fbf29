package cli;

import model.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceCollectorTest {

    @TempDir
    Path tempDir;

    private void write(String relative, String content) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static List<String> paths(List<SourceFile> files) {
        return files.stream().map(SourceFile::getPath).toList();
    }

    @Test
    void collect_directory_shouldFilterByExtensionAndSortByPath() throws Exception {
        write("b.py", "x = 1\n");
        write("a/util.js", "let y = 2;\n");
        write("notes.txt", "hello\n");

        SourceCollector collector = new SourceCollector(List.of(), List.of());

        assertEquals(List.of("a/util.js", "b.py"), paths(collector.collect(List.of(tempDir))));
    }

    @Test
    void collect_shouldApplyExcludePatternsToRelativePaths() throws Exception {
        write("app.py", "x = 1\n");
        write("node_modules/lib/index.js", "var a;\n");
        write(".git/hooks/pre-commit.py", "pass\n");
        write("static/app.min.js", "var b;\n");

        SourceCollector collector = new SourceCollector(List.of(),
            List.of(".git/*", "node_modules/*", "*.min.js"));

        assertEquals(List.of("app.py"), paths(collector.collect(List.of(tempDir))));
    }

    @Test
    void collect_customExtensions_shouldAcceptWithOrWithoutDot() throws Exception {
        write("main.go", "package main\n");
        write("lib.rs", "fn main() {}\n");
        write("app.py", "x = 1\n");

        SourceCollector collector = new SourceCollector(List.of("go", ".rs"), List.of());

        assertEquals(List.of("lib.rs", "main.go"), paths(collector.collect(List.of(tempDir))));
        assertEquals(2, collector.getExtensions().size());
    }

    @Test
    void collect_singleFile_shouldUseFileNameAndReadContent() throws Exception {
        write("src/app.py", "print('hi')\n");

        List<SourceFile> files = new SourceCollector(List.of(), List.of())
            .collect(List.of(tempDir.resolve("src/app.py")));

        assertEquals(1, files.size());
        assertEquals("app.py", files.get(0).getPath());
        assertEquals("print('hi')\n", files.get(0).getContent());
        assertEquals(12, files.get(0).getSizeBytes());
    }

    @Test
    void collect_sameFileTwice_shouldDeduplicate() throws Exception {
        write("app.py", "x = 1\n");

        List<SourceFile> files = new SourceCollector(List.of(), List.of())
            .collect(List.of(tempDir, tempDir.resolve("app.py")));

        assertEquals(1, files.size());
    }

    @Test
    void collect_missingPath_shouldThrow() {
        SourceCollector collector = new SourceCollector(List.of(), List.of());

        assertThrows(IllegalArgumentException.class,
            () -> collector.collect(List.of(tempDir.resolve("missing"))));
    }
}
