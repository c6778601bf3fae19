package com.example.conservation.etl.service;

import com.example.conservation.etl.exception.RunLockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive lock on the run lock file, held for the duration of one run so that at most one
 * run writes to the store at a time. The file itself is left in place.
 */
public final class RunLock implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RunLock.class);

    private final Path path;
    private final FileChannel channel;
    private final FileLock lock;

    private RunLock(Path path, FileChannel channel, FileLock lock) {
        this.path = path;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * @throws RunLockException when another run holds the lock or the file cannot be opened.
     */
    public static RunLock acquire(Path path) {
        FileChannel channel = null;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                throw new RunLockException("Another run holds the lock on " + path);
            }
            log.info("Acquired run lock {}", path);
            return new RunLock(path, channel, lock);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new RunLockException("Another run in this process holds the lock on " + path, e);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new RunLockException("Cannot open run lock file " + path, e);
        } catch (RunLockException e) {
            closeQuietly(channel);
            throw e;
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        try {
            lock.release();
            log.info("Released run lock {}", path);
        } catch (IOException e) {
            log.warn("Failed to release run lock {}: {}", path, e.getMessage());
        } finally {
            closeQuietly(channel);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close run lock channel: {}", e.getMessage());
        }
    }
}
