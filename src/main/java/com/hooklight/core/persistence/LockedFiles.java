package com.hooklight.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive read-modify-write access to small JSON files shared by concurrent hook processes.
 * <p>
 * A mutation holds two locks: a {@link ReentrantLock} per file for threads in this JVM
 * (an OS file lock is held per process, so it cannot separate threads) and a
 * {@link FileLock} on a sidecar {@code <name>.lock} file for other processes.
 */
public final class LockedFiles {

    private static final Logger log = LoggerFactory.getLogger(LockedFiles.class);

    private static final ConcurrentHashMap<Path, ReentrantLock> JVM_LOCKS = new ConcurrentHashMap<>();

    private LockedFiles() {}

    /**
     * Work executed while the lock for a file is held.
     */
    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }

    /**
     * Runs {@code action} while holding the exclusive lock for {@code file}.
     * Parent directories are created if needed.
     */
    public static <T> T withLock(Path file, LockedAction<T> action) throws IOException {
        Path key = file.toAbsolutePath().normalize();
        ReentrantLock jvmLock = JVM_LOCKS.computeIfAbsent(key, k -> new ReentrantLock());
        jvmLock.lock();
        try {
            Files.createDirectories(key.getParent());
            Path lockFile = key.resolveSibling(key.getFileName() + ".lock");
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            }
        } finally {
            jvmLock.unlock();
        }
    }

    /**
     * Reads a file as UTF-8, replacing malformed bytes, or empty when it does not exist.
     */
    public static Optional<String> readIfExists(Path file) throws IOException {
        try {
            return Optional.of(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    /**
     * Replaces {@code file} with {@code content} through a temp file and a move, so readers never
     * observe a half-written document.
     */
    public static void writeAtomically(Path file, String content) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(temp, content, StandardCharsets.UTF_8);
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Appends one line to {@code file} under its lock.
     */
    public static void appendLine(Path file, String line) throws IOException {
        withLock(file, () -> {
            Files.writeString(file, line + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return null;
        });
    }
}
