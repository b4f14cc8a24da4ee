/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowgate.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File primitives shared by the JSON backed stores.
 *
 * <p>Whole-file replacement follows write temp file, fsync, atomic rename, fsync directory.
 * Exclusive access combines a per-path in-process lock with an OS {@link FileLock} on a
 * {@code .lock} sidecar, so that separate processes sharing a data directory serialise
 * their read-modify-write cycles.</p>
 *
 * <p>A lease is a lock file held open for as long as its owner lives. The operating system
 * drops the lock when the owning process exits, so another process can tell a live owner
 * from a dead one with {@link #isLeaseHeld(Path)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class DurableFiles {

    private static final Logger LOG = LoggerFactory.getLogger(DurableFiles.class);

    // FileLock is held per JVM, so threads of one process must queue on a local lock first.
    private static final ConcurrentMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    // leases held by this JVM; probing them through a second channel would release them on close
    private static final ConcurrentMap<Path, FileLease> HELD_LEASES = new ConcurrentHashMap<>();

    private DurableFiles() {
    }

    /**
     * Unit of work executed while the exclusive lock on a file is held.
     */
    @FunctionalInterface
    public interface IOAction<T> {
        T run() throws IOException;
    }

    /**
     * Runs {@code action} while holding the exclusive lock for {@code target}.
     */
    public static <T> T withExclusiveLock(Path target, IOAction<T> action) throws IOException {
        Path key = target.toAbsolutePath().normalize();
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(key, k -> new ReentrantLock());
        local.lock();
        try {
            if (local.getHoldCount() > 1) {
                return action.run();
            }
            Path parent = key.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path lockFile = key.resolveSibling(key.getFileName() + ".lock");
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            }
        } finally {
            local.unlock();
        }
    }

    /**
     * Replaces {@code target} with {@code content} atomically.
     */
    public static void writeAtomically(Path target, byte[] content, boolean fsync) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");

        try (FileChannel ch = FileChannel.open(tmp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(content);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            if (fsync) {
                ch.force(true);
            }
        }

        Files.move(tmp, target,
                StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.ATOMIC_MOVE);

        if (fsync && dir != null) {
            syncDirectory(dir);
        }
        LOG.trace("Wrote {} bytes to {}", content.length, target);
    }

    /**
     * Appends {@code content} to the end of {@code target}, creating it if needed.
     */
    public static void append(Path target, byte[] content, boolean fsync) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        try (FileChannel ch = FileChannel.open(target,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND,
                StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(content);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            if (fsync) {
                ch.force(true);
            }
        }
    }

    private static void syncDirectory(Path dir) throws IOException {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            // Windows doesn't support directory fsync
            return;
        }
        try (FileChannel dirChannel = FileChannel.open(dir, StandardOpenOption.READ)) {
            dirChannel.force(true);
        }
    }

    /**
     * Takes the lease on {@code leaseFile}, creating it if needed.
     *
     * @throws IOException if the lease is already held, here or by another process
     */
    public static FileLease acquireLease(Path leaseFile) throws IOException {
        Path key = leaseFile.toAbsolutePath().normalize();
        Path parent = key.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // closing a second channel on the file would drop the lock this JVM already holds
        if (HELD_LEASES.containsKey(key)) {
            throw new IOException("Lease " + key + " is already held");
        }
        FileChannel channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (IOException | OverlappingFileLockException e) {
            channel.close();
            throw new IOException("Lease " + key + " is already held", e);
        }
        if (lock == null) {
            channel.close();
            throw new IOException("Lease " + key + " is held by another process");
        }
        FileLease lease = new FileLease(key, channel, lock);
        HELD_LEASES.put(key, lease);
        LOG.debug("Acquired lease {}", key);
        return lease;
    }

    /**
     * Whether a live process holds the lease on {@code leaseFile}. A lease file left behind by a
     * dead owner is deleted.
     */
    public static boolean isLeaseHeld(Path leaseFile) throws IOException {
        Path key = leaseFile.toAbsolutePath().normalize();
        if (HELD_LEASES.containsKey(key)) {
            return true;
        }
        if (!Files.exists(key)) {
            return false;
        }
        try (FileChannel channel = FileChannel.open(key, StandardOpenOption.WRITE)) {
            FileLock attempt = channel.tryLock();
            if (attempt == null) {
                return true;
            }
            attempt.release();
        } catch (OverlappingFileLockException e) {
            return true;
        } catch (NoSuchFileException e) {
            return false;
        }
        Files.deleteIfExists(key);
        LOG.debug("Removed stale lease {}", key);
        return false;
    }

    /**
     * Lease taken with {@link #acquireLease(Path)}. Closing it releases the lock and deletes the file.
     */
    public static final class FileLease implements Closeable {
        private final Path path;
        private final FileChannel channel;
        private final FileLock lock;

        private FileLease(Path path, FileChannel channel, FileLock lock) {
            this.path = path;
            this.channel = channel;
            this.lock = lock;
        }

        public Path getPath() {
            return path;
        }

        @Override
        public void close() throws IOException {
            HELD_LEASES.remove(path, this);
            try {
                lock.release();
            } finally {
                channel.close();
                Files.deleteIfExists(path);
            }
        }
    }
}
