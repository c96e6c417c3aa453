package org.calista.credence.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO — the single I/O entry point of the library.
 *
 * <ul>
 *     <li>sandboxed resolve under a base directory (no ".." escape, no absolute paths)</li>
 *     <li>atomic whole-file writes (tmp sibling + move) with optional fsync</li>
 *     <li>JSONL append with optional cross-process file lock and fsync</li>
 *     <li>streaming JSONL reads (trimmed, blank lines skipped)</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnAppend;
        public final boolean lockWrites;
        public final Duration lockTimeout;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnAppend = b.fsyncOnAppend;
            this.lockWrites = b.lockWrites;
            this.lockTimeout = b.lockTimeout;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnAppend = false;
            private boolean lockWrites = true;
            private Duration lockTimeout = Duration.ofSeconds(3);

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v, "charset");
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            /** Force every appended line to disk before returning. */
            public Builder fsyncOnAppend(boolean v) {
                this.fsyncOnAppend = v;
                return this;
            }

            public Builder lockWrites(boolean v) {
                this.lockWrites = v;
                return this;
            }

            public Builder lockTimeout(Duration v) {
                this.lockTimeout = Objects.requireNonNull(v, "lockTimeout");
                if (v.isNegative()) throw new IllegalArgumentException("lockTimeout must be >= 0");
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnAppend={}, lockWrites={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnAppend, opt.lockWrites);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create base directory " + this.baseDir, e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public Options options() {
        return opt;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Resolves a relative path inside baseDir. Absolute paths and ".." escapes are
     * rejected; backslashes are treated as separators.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        return Files.exists(Objects.requireNonNull(file, "file"));
    }

    // ----------------------------
    // Whole-file text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, opt.charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            Files.writeString(file, content, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    /**
     * Appends one JSON document as a line. The line must not contain a raw newline.
     */
    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) throw new IllegalArgumentException("empty JSONL record");
        if (s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("JSONL record spans multiple lines");
        }
        ensureParentDir(file);
        byte[] bytes = (s + "\n").getBytes(opt.charset);

        if (!opt.lockWrites) {
            try (FileChannel ch = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                write(ch, bytes);
            }
            return;
        }
        withWriteLock(file, ch -> write(ch, bytes));
    }

    /** Trimmed, non-blank lines. The stream must be closed. */
    public Stream<String> jsonlStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.lines(file, opt.charset)
                .map(String::trim)
                .filter(x -> !x.isEmpty());
    }

    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return List.of();
        try (Stream<String> s = jsonlStream(file)) {
            List<String> out = s.collect(Collectors.toList());
            log.debug("readJsonl: {} ({} records)", file, out.size());
            return out;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private void write(FileChannel ch, byte[] bytes) throws IOException {
        java.nio.ByteBuffer buf = java.nio.ByteBuffer.wrap(bytes);
        while (buf.hasRemaining()) ch.write(buf);
        if (opt.fsyncOnAppend) ch.force(false);
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("atomicCommit: could not remove {}", tmp, e);
            }
        }
    }

    private void withWriteLock(Path file, ChannelAction action) throws IOException {
        if (!Files.exists(file)) {
            try {
                Files.createFile(file);
            } catch (FileAlreadyExistsException ignored) {
                // another writer created it first
            }
        }

        long deadlineNs = System.nanoTime() + opt.lockTimeout.toNanos();

        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            while (true) {
                try {
                    FileLock lock = ch.tryLock();
                    if (lock != null) {
                        try (lock) {
                            action.run(ch);
                            return;
                        }
                    }
                } catch (OverlappingFileLockException ignored) {
                    // held by this JVM, retry until the deadline
                }

                if (System.nanoTime() >= deadlineNs) {
                    throw new IOException("Write lock timeout for " + file);
                }
                sleepQuiet(10);
            }
        }
    }

    private static void sleepQuiet(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface ChannelAction {
        void run(FileChannel ch) throws IOException;
    }
}
