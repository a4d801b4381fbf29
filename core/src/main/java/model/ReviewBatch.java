package model;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Упорядоченный неизменяемый набор файлов, отправленный на ревью одним запросом.
 * Ограничения по количеству и размеру файлов проверяет движок при отправке.
 */
public final class ReviewBatch implements Iterable<SourceFile> {
    private final List<SourceFile> files;

    public ReviewBatch(List<SourceFile> files) {
        Objects.requireNonNull(files, "Files cannot be null");
        this.files = List.copyOf(files);
    }

    public static ReviewBatch of(SourceFile... files) {
        return new ReviewBatch(Arrays.asList(files));
    }

    public List<SourceFile> getFiles() {
        return files;
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public long totalBytes() {
        return files.stream().mapToLong(SourceFile::getSizeBytes).sum();
    }

    @Override
    public Iterator<SourceFile> iterator() {
        return files.iterator();
    }

    @Override
    public String toString() {
        return "ReviewBatch{files=" + files.size() + ", bytes=" + totalBytes() + '}';
    }
}
