package org.calista.formalizer.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO — all reads and writes of config, stores, events and batch output.
 *
 * <ul>
 *   <li>whole-file writes go to a {@code .tmp} sibling and are moved over the target</li>
 *   <li>JSONL appends are serialized per instance</li>
 *   <li>{@link #resolve(String)} never leaves the base directory</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private static final Charset UTF8 = StandardCharsets.UTF_8;

    private final Path baseDir;
    private final Object appendLock = new Object();

    public FileIO(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create base directory " + this.baseDir, e);
        }
        log.debug("FileIO at {}", this.baseDir);
    }

    // ----------------------------
    // Paths
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    /** A path under baseDir; absolute paths and ".." escapes are rejected. */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("Expected a relative path: " + relative);

        Path p = baseDir.resolve(rel).normalize();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path leaves " + baseDir + ": " + relative);
        return p;
    }

    /** Relative paths are anchored at baseDir; absolute ones are only normalized. */
    public Path resolveExternal(String anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        Path p = Paths.get(anyPath);
        return p.isAbsolute() ? p.normalize() : baseDir.resolve(p).normalize();
    }

    public void ensureParentDir(Path file) throws IOException {
        Path parent = Objects.requireNonNull(file, "file").getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        return Files.exists(Objects.requireNonNull(file, "file"));
    }

    // ----------------------------
    // Whole files
    // ----------------------------

    public String readString(Path file) throws IOException {
        return Files.readString(Objects.requireNonNull(file, "file"), UTF8);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);
        Path tmp = tmpOf(file);
        Files.writeString(tmp, content, UTF8, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        moveOver(tmp, file);
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    /** Appends one line; blank lines are dropped. */
    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        ensureParentDir(file);
        synchronized (appendLock) {
            Files.writeString(file, s + System.lineSeparator(), UTF8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        }
    }

    /** Trimmed non-blank lines. Close the stream. */
    public Stream<String> jsonlStream(Path file) throws IOException {
        return Files.lines(Objects.requireNonNull(file, "file"), UTF8)
                .map(String::trim)
                .filter(x -> !x.isEmpty());
    }

    public List<String> readJsonl(Path file) throws IOException {
        try (Stream<String> s = jsonlStream(file)) {
            return s.collect(Collectors.toList());
        }
    }

    // ----------------------------
    // Streaming writer (store snapshots)
    // ----------------------------

    /** The writer fills a tmp sibling; {@link #commit} moves it over the target, {@link #rollback} drops it. */
    public WriterHandle openWriter(Path file) throws IOException {
        ensureParentDir(file);
        Path tmp = tmpOf(file);
        BufferedWriter w = Files.newBufferedWriter(tmp, UTF8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return new WriterHandle(file, tmp, w);
    }

    public void commit(WriterHandle h) throws IOException {
        Objects.requireNonNull(h, "handle");
        h.writer.close();
        moveOver(h.tmpFile, h.targetFile);
    }

    public void rollback(WriterHandle h) {
        if (h == null) return;
        try {
            h.writer.close();
            Files.deleteIfExists(h.tmpFile);
        } catch (IOException e) {
            log.warn("rollback of {} left {} behind: {}", h.targetFile, h.tmpFile, e.toString());
        }
    }

    public static final class WriterHandle {
        public final Path targetFile;
        public final Path tmpFile;
        public final BufferedWriter writer;

        private WriterHandle(Path targetFile, Path tmpFile, BufferedWriter writer) {
            this.targetFile = targetFile;
            this.tmpFile = tmpFile;
            this.writer = writer;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static Path tmpOf(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    private static void moveOver(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.trace("atomic move unsupported for {}, plain move", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
