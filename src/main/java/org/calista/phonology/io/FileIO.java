package org.calista.phonology.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Objects;

/**
 * FileIO: единая точка файлового I/O проекта (конфиг, таблицы признаков).
 *
 * <p>
 * - атомарная запись: tmp-файл рядом + move(ATOMIC_MOVE), fallback на REPLACE_EXISTING
 * - пропуск перезаписи, если содержимое не изменилось
 * - безопасный resolve внутри baseDir (anti path traversal)
 * </p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
    }

    /**
     * Резолвит относительный путь внутри baseDir, выход через ".." запрещён.
     * Абсолютные пути возвращаются нормализованными как есть.
     */
    public Path resolve(String path) {
        Objects.requireNonNull(path, "path");
        Path p = Paths.get(path.replace('\\', '/'));
        if (p.isAbsolute()) return p.normalize();

        Path r = baseDir.resolve(p).normalize();
        if (!r.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + path);
        return r;
    }

    public Path resolve(Path path) {
        Objects.requireNonNull(path, "path");
        return resolve(path.toString());
    }

    private static void ensureParentDir(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    /** @throws NoSuchFileException если файла нет */
    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (isSameContent(file, content)) {
            log.debug("writeString: skip unchanged content for {}", file);
            return;
        }

        if (!atomicWrites) {
            Files.writeString(file, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private boolean isSameContent(Path file, String content) throws IOException {
        if (!Files.isRegularFile(file)) return false;
        return Files.readString(file, charset).equals(content);
    }
}
