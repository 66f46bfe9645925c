package io.trialforge.ledger;

import io.trialforge.model.FamilyStats;
import io.trialforge.model.RollingRate;
import io.trialforge.model.TrialRecord;
import io.trialforge.util.Jsons;
import io.trialforge.util.TextFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only trial history, one JSON object per line. Readers never lock: a record being appended
 * concurrently is either fully visible or not yet visible, and a torn tail line is skipped.
 */
public final class Ledger {
    private final Path ledgerFile;
    private final AtomicLong malformedSkipped;

    public Ledger(Path ledgerFile) {
        this.ledgerFile = ledgerFile;
        this.malformedSkipped = new AtomicLong(0L);
    }

    public Path ledgerFile() {
        return ledgerFile;
    }

    public void append(TrialRecord record) {
        String line = Jsons.toLine(record) + "\n";
        try {
            Path parent = ledgerFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(ledgerFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append trial record for family: " + record.family(), e);
        }
    }

    public List<TrialRecord> readAll() {
        List<String> lines = readLines();
        List<TrialRecord> records = new ArrayList<>(lines.size());
        for (String line : lines) {
            TrialRecord record = parse(line);
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    /**
     * Last {@code n} records in insertion order. A missing ledger is an empty history.
     */
    public List<TrialRecord> readRecent(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<TrialRecord> all = readAll();
        if (all.size() <= n) {
            return all;
        }
        return new ArrayList<>(all.subList(all.size() - n, all.size()));
    }

    public FamilyStats aggregate(String family) {
        FamilyStats stats = FamilyStats.EMPTY;
        for (TrialRecord record : readAll()) {
            if (record.family().equals(family)) {
                stats = stats.plus(record.passed(), record.timestamp());
            }
        }
        return stats;
    }

    /**
     * Stats for every family in one pass, keyed in order of first appearance.
     */
    public Map<String, FamilyStats> aggregateAll() {
        Map<String, FamilyStats> out = new LinkedHashMap<>();
        for (TrialRecord record : readAll()) {
            out.merge(
                    record.family(),
                    FamilyStats.EMPTY.plus(record.passed(), record.timestamp()),
                    (current, ignored) -> current.plus(record.passed(), record.timestamp())
            );
        }
        return out;
    }

    public RollingRate rollingPassRate(String family, int window) {
        if (window <= 0) {
            return RollingRate.NONE;
        }
        List<TrialRecord> all = readAll();
        int successes = 0;
        int evidence = 0;
        for (int i = all.size() - 1; i >= 0 && evidence < window; i--) {
            TrialRecord record = all.get(i);
            if (!record.family().equals(family)) {
                continue;
            }
            evidence++;
            if (record.passed()) {
                successes++;
            }
        }
        if (evidence == 0) {
            return RollingRate.NONE;
        }
        return new RollingRate((double) successes / evidence, evidence);
    }

    /**
     * Malformed lines skipped by reads through this instance. A bad line counts once per read.
     */
    public long malformedSkipped() {
        return malformedSkipped.get();
    }

    private List<String> readLines() {
        try {
            return TextFiles.readLinesLenient(ledgerFile);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read ledger: " + ledgerFile, e);
        }
    }

    private TrialRecord parse(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(line, TrialRecord.class);
        } catch (IOException e) {
            malformedSkipped.incrementAndGet();
            return null;
        }
    }
}
