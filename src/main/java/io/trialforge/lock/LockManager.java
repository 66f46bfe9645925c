package io.trialforge.lock;

import io.trialforge.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Named cross-process try-locks backed by one file per name. Creation with {@code CREATE_NEW} is the
 * exclusivity point: exactly one process can create the file, everyone else gets
 * {@link LockContentionException}. Contenders never remove a lock; only
 * {@link #reapStaleLocks(long)}, run by a supervisor, clears abandoned ones.
 */
public final class LockManager {
    private static final String SUFFIX = ".lock";
    private static final String TOMBSTONE_SUFFIX = ".reaped";

    private final Path lockDir;
    private final Clock clock;
    private final ReapPolicy reapPolicy;

    public LockManager(Path lockDir, Clock clock, ReapPolicy reapPolicy) {
        this.lockDir = lockDir;
        this.clock = clock;
        this.reapPolicy = reapPolicy == null ? ReapPolicy.REQUIRE_DEAD_HOLDER : reapPolicy;
    }

    public Path lockDir() {
        return lockDir;
    }

    public ReapPolicy reapPolicy() {
        return reapPolicy;
    }

    public LockHandle acquire(String name) {
        String safeName = sanitizeName(name);
        requireLockDir();
        Path file = lockPath(safeName);
        double startedAt = nowSeconds();
        long pid = ProcessHandle.current().pid();
        FileChannel channel;
        try {
            channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            Optional<LockFile> holder = readLockFile(file);
            throw new LockContentionException(
                    safeName,
                    holder.map(LockFile::holderPid).orElse(-1L),
                    holder.map(LockFile::startedAt).orElse(-1.0d)
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to create lock file: " + file, e);
        }
        try {
            byte[] body = Jsons.toLine(new LockFile(safeName, startedAt, pid)).getBytes(StandardCharsets.UTF_8);
            ByteBuffer buffer = ByteBuffer.wrap(body);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (IOException e) {
            closeQuietly(channel);
            deleteQuietly(file);
            throw new RuntimeException("Failed to write lock file: " + file, e);
        }
        return new LockHandle(this, safeName, file, startedAt, pid, channel);
    }

    /**
     * Releases the lock. Returns {@code false} when the handle was already released. The file is
     * removed only while it still records this handle's holder, so a lock that was reaped and
     * re-acquired by someone else survives a late release.
     */
    public boolean release(LockHandle handle) {
        if (handle == null) {
            return false;
        }
        FileChannel channel = handle.detachChannel();
        if (channel == null) {
            return false;
        }
        IOException closeFailure = null;
        try {
            channel.close();
        } catch (IOException e) {
            closeFailure = e;
        }
        deleteIfOwned(handle.file(), handle.startedAt(), handle.holderPid());
        if (closeFailure != null) {
            throw new RuntimeException("Failed to close lock channel: " + handle.file(), closeFailure);
        }
        return true;
    }

    /**
     * Age check against the {@code started_at} currently on disk.
     */
    public boolean isStale(LockHandle handle, long maxAgeS) {
        double startedAt = readLockFile(handle.file())
                .map(LockFile::startedAt)
                .orElse(handle.startedAt());
        return nowSeconds() - startedAt > maxAgeS;
    }

    public List<String> reapStaleLocks(long maxAgeS) {
        requireLockDir();
        List<String> reaped = new ArrayList<>();
        double now = nowSeconds();
        for (Path file : listLockFiles()) {
            Optional<LockFile> body = readLockFile(file);
            double startedAt = body.map(LockFile::startedAt).orElseGet(() -> modifiedAtSeconds(file));
            if (now - startedAt <= maxAgeS) {
                continue;
            }
            if (reapPolicy == ReapPolicy.REQUIRE_DEAD_HOLDER
                    && body.isPresent()
                    && isProcessAlive(body.get().holderPid())) {
                continue;
            }
            if (reapIfUnchanged(file, body, startedAt)) {
                reaped.add(body.map(LockFile::name).orElseGet(() -> nameOf(file)));
            }
        }
        return reaped;
    }

    /**
     * Removes {@code file} only if it still holds the lock that was judged stale. The file is first
     * renamed to a private tombstone, so nobody can re-create the lock under the reaper between the
     * check and the delete. A tombstone whose holder differs from the judged one is a fresh lock and
     * is put back.
     */
    boolean reapIfUnchanged(Path file, Optional<LockFile> judged, double judgedStartedAt) {
        Path tombstone = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + TOMBSTONE_SUFFIX);
        try {
            Files.move(file, tombstone, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new RuntimeException("Failed to reap lock file: " + file, e);
        }
        Optional<LockFile> moved = readLockFile(tombstone);
        double movedStartedAt = moved.map(LockFile::startedAt).orElseGet(() -> modifiedAtSeconds(tombstone));
        boolean same = judged.map(LockFile::holderPid).orElse(-1L).equals(moved.map(LockFile::holderPid).orElse(-1L))
                && Double.compare(judgedStartedAt, movedStartedAt) == 0;
        try {
            if (same) {
                Files.delete(tombstone);
                return true;
            }
            // A link, unlike a rename, refuses to replace a lock created in the meantime.
            Files.createLink(file, tombstone);
            Files.delete(tombstone);
            return false;
        } catch (FileAlreadyExistsException e) {
            // Someone acquired while the fresh lock was parked; their file is the live one now.
            deleteQuietly(tombstone);
            return false;
        } catch (IOException e) {
            throw new RuntimeException("Failed to settle reaped lock file: " + tombstone, e);
        }
    }

    public List<LockInfo> list() {
        if (!Files.isDirectory(lockDir)) {
            return List.of();
        }
        double now = nowSeconds();
        List<LockInfo> out = new ArrayList<>();
        for (Path file : listLockFiles()) {
            Optional<LockFile> body = readLockFile(file);
            double startedAt = body.map(LockFile::startedAt).orElseGet(() -> modifiedAtSeconds(file));
            long pid = body.map(LockFile::holderPid).orElse(-1L);
            out.add(new LockInfo(
                    body.map(LockFile::name).orElseGet(() -> nameOf(file)),
                    startedAt,
                    pid,
                    isProcessAlive(pid),
                    Math.max(0.0d, now - startedAt)
            ));
        }
        return out;
    }

    static boolean isProcessAlive(long pid) {
        if (pid <= 0L) {
            return false;
        }
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    static String sanitizeName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Lock name must not be blank");
        }
        String value = raw.trim();
        if (value.length() > 128) {
            throw new IllegalArgumentException("Lock name too long: " + value.length());
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            if (!ok) {
                throw new IllegalArgumentException("Invalid lock name: " + raw);
            }
        }
        if (value.startsWith(".")) {
            throw new IllegalArgumentException("Invalid lock name: " + raw);
        }
        return value;
    }

    private void requireLockDir() {
        if (!Files.isDirectory(lockDir)) {
            throw new IllegalStateException("Lock directory does not exist: " + lockDir);
        }
    }

    private Path lockPath(String safeName) {
        return lockDir.resolve(safeName + SUFFIX);
    }

    private List<Path> listLockFiles() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(lockDir, "*" + SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list lock directory: " + lockDir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private Optional<LockFile> readLockFile(Path file) {
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(Jsons.mapper().readValue(raw, LockFile.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            // Half-written by a holder that crashed between create and write.
            return Optional.empty();
        }
    }

    private void deleteIfOwned(Path file, double startedAt, long pid) {
        Optional<LockFile> current = readLockFile(file);
        boolean owned = current.isEmpty()
                ? Files.exists(file) && isOwnEmptyFile(file)
                : current.get().holderPid() == pid && Double.compare(current.get().startedAt(), startedAt) == 0;
        if (!owned) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to remove lock file: " + file, e);
        }
    }

    private static boolean isOwnEmptyFile(Path file) {
        try {
            return Files.size(file) == 0L;
        } catch (IOException e) {
            return false;
        }
    }

    private double modifiedAtSeconds(Path file) {
        try {
            return Files.getLastModifiedTime(file).toMillis() / 1000.0d;
        } catch (IOException e) {
            return nowSeconds();
        }
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0d;
    }

    private static String nameOf(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - SUFFIX.length());
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ignored) {
            // Left for the reaper; its age falls back to the file's modification time.
        }
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException ignored) {
            // Already failing; the write error is the one reported.
        }
    }
}
