package io.trialforge.regret;

import io.trialforge.ledger.Ledger;
import io.trialforge.model.RegretItem;
import io.trialforge.model.TrialRecord;
import io.trialforge.security.SensitiveDataMasker;
import io.trialforge.util.Jsons;
import io.trialforge.util.TextFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Backlog of recent failures kept for replay. Items are appended and sampled, never consumed.
 */
public final class RegretQueue {
    static final int MAX_HINT_CHARS = 240;
    private static final List<String> HINT_KEYS = List.of("trace", "error", "stderr", "message", "reason");
    private static final String DEFAULT_HINT = "failed";

    private final Ledger ledger;
    private final Path queueFile;
    private final Random random;

    public RegretQueue(Ledger ledger, Path queueFile, Random random) {
        this.ledger = ledger;
        this.queueFile = queueFile;
        this.random = random;
    }

    public Path queueFile() {
        return queueFile;
    }

    public List<RegretItem> harvest(int window) {
        List<RegretItem> items = new ArrayList<>();
        for (TrialRecord record : ledger.readRecent(window)) {
            if (!record.passed()) {
                items.add(new RegretItem(record.family(), hintFor(record)));
            }
        }
        return items;
    }

    /**
     * Harvests the last {@code window} ledger records and appends every failure to the queue file.
     * Returns how many items were appended.
     */
    public int enqueue(int window) {
        List<RegretItem> items = harvest(window);
        if (items.isEmpty()) {
            return 0;
        }
        StringBuilder sb = new StringBuilder();
        for (RegretItem item : items) {
            sb.append(Jsons.toLine(item)).append('\n');
        }
        try {
            Path parent = queueFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(queueFile, sb.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append regret items: " + queueFile, e);
        }
        return items.size();
    }

    public Optional<RegretItem> maybeReplay(double probability) {
        if (random.nextDouble() >= probability) {
            return Optional.empty();
        }
        List<RegretItem> items = readQueue();
        if (items.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(items.get(random.nextInt(items.size())));
    }

    public int size() {
        return readQueue().size();
    }

    List<RegretItem> readQueue() {
        List<String> lines;
        try {
            lines = TextFiles.readLinesLenient(queueFile);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read regret queue: " + queueFile, e);
        }
        List<RegretItem> items = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                RegretItem item = Jsons.mapper().readValue(line, RegretItem.class);
                if (item.family() != null && !item.family().isBlank()) {
                    items.add(item);
                }
            } catch (IOException ignored) {
                // Torn line from an interrupted append; the rest of the queue is still usable.
            }
        }
        return items;
    }

    static String hintFor(TrialRecord record) {
        for (String key : HINT_KEYS) {
            Object value = record.metrics().get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return excerpt(String.valueOf(value));
            }
        }
        return DEFAULT_HINT;
    }

    static String excerpt(String raw) {
        String collapsed = SensitiveDataMasker.maskText(raw.trim().replaceAll("\\s+", " "));
        if (collapsed.length() <= MAX_HINT_CHARS) {
            return collapsed;
        }
        return collapsed.substring(0, MAX_HINT_CHARS - 3) + "...";
    }
}
