package io.trialforge.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.trialforge.lock.LockHandle;
import io.trialforge.lock.LockManager;
import io.trialforge.model.LifecycleState;
import io.trialforge.model.ZooidRecord;
import io.trialforge.util.Jsons;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Persisted zooid lifecycle map. {@link #load()} and {@link #save(Map)} assume the caller holds the
 * registry lock; {@link #update(Mutator)} is the full critical section for callers that do not
 * manage the lock themselves.
 */
public final class LifecycleRegistry {
    static final int SNAPSHOTS_KEPT = 10;

    private final Path registryFile;
    private final LockManager lockManager;
    private final String lockName;
    private final Clock clock;
    private final Pattern snapshotPattern;

    public LifecycleRegistry(Path registryFile, LockManager lockManager, String lockName, Clock clock) {
        this.registryFile = registryFile;
        this.lockManager = lockManager;
        this.lockName = lockName;
        this.clock = clock;
        this.snapshotPattern = Pattern.compile(Pattern.quote(baseName()) + "\\.v(\\d+)\\.json");
    }

    public Path registryFile() {
        return registryFile;
    }

    public String lockName() {
        return lockName;
    }

    public LockManager lockManager() {
        return lockManager;
    }

    public LinkedHashMap<String, ZooidRecord> load() {
        return readDocument().zooids();
    }

    public long version() {
        return readDocument().version();
    }

    /**
     * Bumps the version, writes a snapshot of the new version, then replaces the live document
     * through a temp file and atomic rename.
     */
    public long save(Map<String, ZooidRecord> zooids) {
        long next = readDocument().version() + 1L;
        RegistryFile doc = new RegistryFile(next, new LinkedHashMap<>(zooids));
        Path parent = registryFile.toAbsolutePath().getParent();
        Path tmp = registryFile.resolveSibling(registryFile.getFileName() + ".tmp");
        try {
            Files.createDirectories(parent);
            Jsons.mapper().writeValue(snapshotPath(next).toFile(), doc);
            Jsons.mapper().writeValue(tmp.toFile(), doc);
            try {
                Files.move(tmp, registryFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, registryFile, StandardCopyOption.REPLACE_EXISTING);
            }
            pruneSnapshots();
        } catch (IOException e) {
            throw new RuntimeException("Failed to save lifecycle registry: " + registryFile, e);
        }
        return next;
    }

    /**
     * Acquire lock, load, mutate, save when changed, release. The lock is released on every exit
     * path; {@link io.trialforge.lock.LockContentionException} propagates when another process
     * holds it.
     */
    public <T> T update(Mutator<T> mutator) {
        return commit(mutator).result();
    }

    /**
     * Same critical section as {@link #update(Mutator)}, also returning the registry version as of
     * the end of it: the saved version, or the loaded one when nothing changed.
     */
    public <T> Committed<T> commit(Mutator<T> mutator) {
        try (LockHandle ignored = lockManager.acquire(lockName)) {
            RegistryFile doc = readDocument();
            LinkedHashMap<String, ZooidRecord> zooids = doc.zooids();
            Mutation<T> mutation = mutator.apply(zooids);
            long version = mutation.changed() ? save(zooids) : doc.version();
            return new Committed<>(mutation.result(), version);
        }
    }

    /**
     * Entry point for the evidence accumulator. Unknown names start on probation; demoted records
     * are frozen and refuse updates.
     */
    public EvidenceOutcome recordEvidence(String name, double fitnessMean, int evidenceCount) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Zooid name must not be blank");
        }
        if (!Double.isFinite(fitnessMean) || evidenceCount < 0) {
            throw new IllegalArgumentException("Invalid evidence for " + name + ": fitness=" + fitnessMean + ", evidence=" + evidenceCount);
        }
        double now = clock.millis() / 1000.0d;
        return update(zooids -> {
            ZooidRecord existing = zooids.get(name);
            if (existing == null) {
                ZooidRecord created = ZooidRecord.probation(name, fitnessMean, evidenceCount, now);
                zooids.put(name, created);
                return Mutation.changed(new EvidenceOutcome(created, "registered"));
            }
            if (existing.lifecycleState() == LifecycleState.DEMOTED) {
                return Mutation.unchanged(new EvidenceOutcome(existing, "frozen"));
            }
            ZooidRecord updated = existing.withEvidence(fitnessMean, evidenceCount);
            zooids.put(name, updated);
            return Mutation.changed(new EvidenceOutcome(updated, "updated"));
        });
    }

    List<Path> snapshots() {
        Path parent = registryFile.toAbsolutePath().getParent();
        List<Path> out = new ArrayList<>();
        if (parent == null || !Files.isDirectory(parent)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent, baseName() + ".v*.json")) {
            for (Path path : stream) {
                if (snapshotVersion(path) >= 0L) {
                    out.add(path);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list registry snapshots: " + parent, e);
        }
        out.sort(Comparator.comparingLong(this::snapshotVersion));
        return out;
    }

    private void pruneSnapshots() throws IOException {
        List<Path> all = snapshots();
        for (int i = 0; i < all.size() - SNAPSHOTS_KEPT; i++) {
            Files.deleteIfExists(all.get(i));
        }
    }

    private RegistryFile readDocument() {
        if (!Files.exists(registryFile)) {
            return new RegistryFile(0L, new LinkedHashMap<>());
        }
        try {
            RegistryFile doc = Jsons.mapper().readValue(registryFile.toFile(), RegistryFile.class);
            LinkedHashMap<String, ZooidRecord> zooids = new LinkedHashMap<>();
            if (doc.zooids() != null) {
                doc.zooids().forEach((name, record) -> {
                    if (record != null) {
                        zooids.put(name, name.equals(record.name()) ? record : record.withName(name));
                    }
                });
            }
            return new RegistryFile(doc.version(), zooids);
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse lifecycle registry: " + registryFile, e);
        }
    }

    private Path snapshotPath(long version) {
        return registryFile.resolveSibling(baseName() + ".v" + version + ".json");
    }

    private long snapshotVersion(Path path) {
        Matcher matcher = snapshotPattern.matcher(path.getFileName().toString());
        return matcher.matches() ? Long.parseLong(matcher.group(1)) : -1L;
    }

    private String baseName() {
        String fileName = registryFile.getFileName().toString();
        return fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - ".json".length()) : fileName;
    }

    @FunctionalInterface
    public interface Mutator<T> {
        Mutation<T> apply(LinkedHashMap<String, ZooidRecord> zooids);
    }

    public record Mutation<T>(boolean changed, T result) {
        public static <T> Mutation<T> changed(T result) {
            return new Mutation<>(true, result);
        }

        public static <T> Mutation<T> unchanged(T result) {
            return new Mutation<>(false, result);
        }
    }

    public record Committed<T>(T result, long version) {
    }

    public record EvidenceOutcome(ZooidRecord record, String result) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegistryFile(
            @JsonProperty("version") long version,
            @JsonProperty("zooids") LinkedHashMap<String, ZooidRecord> zooids
    ) {
    }
}
