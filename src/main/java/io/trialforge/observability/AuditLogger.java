package io.trialforge.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.trialforge.security.SensitiveDataMasker;
import io.trialforge.util.Hashing;
import io.trialforge.util.Jsons;
import io.trialforge.util.TextFiles;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only JSONL event log. Every row links to the previous one through {@code prev_hash}, so a
 * truncated or edited log is detectable by {@link #verify()}.
 */
public final class AuditLogger {
    private static final int TAIL_WINDOW_BYTES = 8192;
    // FileLock is held per JVM, so loggers in one process also serialize on a shared monitor.
    private static final ConcurrentHashMap<Path, Object> FILE_MONITORS = new ConcurrentHashMap<>();

    private final Path auditFile;
    private final String namespace;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, Clock clock) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    /**
     * Appends one row. The file is locked while the chain tip is re-read and the row written, so
     * loggers in other processes sharing the file extend one chain.
     */
    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        synchronized (monitorFor(auditFile)) {
            try (FileChannel channel = FileChannel.open(auditFile,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                String prevHash = lastHash(channel);
                row.put("prev_hash", prevHash);
                String rowHash = Hashing.sha256Hex(Jsons.toLine(row));
                row.put("hash", rowHash);
                ByteBuffer buffer = ByteBuffer.wrap((Jsons.toLine(row) + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
                long position = channel.size();
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(false);
                previousHash = rowHash;
            } catch (IOException e) {
                throw new RuntimeException("Failed to write audit log", e);
            }
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Returns the most recent rows, oldest first. Unparseable lines are skipped.
     */
    public List<JsonNode> tail(int limit) {
        List<JsonNode> rows = readRows();
        if (limit <= 0 || rows.size() <= limit) {
            return rows;
        }
        return new ArrayList<>(rows.subList(rows.size() - limit, rows.size()));
    }

    public IntegrityOutcome verify() {
        List<JsonNode> rows = readRows();
        String expectedPrev = "";
        int checked = 0;
        for (JsonNode row : rows) {
            String prev = row.path("prev_hash").asText("");
            String hash = row.path("hash").asText("");
            if (!prev.equals(expectedPrev)) {
                return new IntegrityOutcome(false, checked, "prev_hash_mismatch");
            }
            Map<String, Object> body = Jsons.mapper().convertValue(row, LinkedHashMap.class);
            body.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toLine(body)).equals(hash)) {
                return new IntegrityOutcome(false, checked, "hash_mismatch");
            }
            expectedPrev = hash;
            checked++;
        }
        return new IntegrityOutcome(true, checked, "ok");
    }

    private List<JsonNode> readRows() {
        List<JsonNode> rows = new ArrayList<>();
        if (!Files.exists(auditFile)) {
            return rows;
        }
        List<String> lines;
        try {
            lines = TextFiles.readLinesLenient(auditFile);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                rows.add(Jsons.mapper().readTree(line));
            } catch (IOException ignored) {
                // A torn trailing row from a crashed writer; verify() reports the gap.
            }
        }
        return rows;
    }

    private String loadLastHash() {
        List<JsonNode> rows = readRows();
        if (rows.isEmpty()) {
            return "";
        }
        return rows.get(rows.size() - 1).path("hash").asText("");
    }

    /**
     * Hash of the last parseable row, scanning back from the end of the file in growing windows.
     */
    private static String lastHash(FileChannel channel) throws IOException {
        long end = channel.size();
        int window = TAIL_WINDOW_BYTES;
        while (end > 0L) {
            long start = Math.max(0L, end - window);
            ByteBuffer buffer = ByteBuffer.allocate((int) (end - start));
            long position = start;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
            String[] lines = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8).split("\\R");
            // The first line of a window that does not start at offset 0 may be cut.
            int first = start == 0L ? 0 : 1;
            for (int i = lines.length - 1; i >= first; i--) {
                String line = lines[i].trim();
                if (line.isEmpty()) {
                    continue;
                }
                String hash = hashOf(line);
                if (!hash.isEmpty()) {
                    return hash;
                }
            }
            if (start == 0L || window >= Integer.MAX_VALUE / 4) {
                return "";
            }
            window *= 4;
        }
        return "";
    }

    private static String hashOf(String line) {
        try {
            return Jsons.mapper().readTree(line).path("hash").asText("");
        } catch (IOException e) {
            // Torn row from a crashed writer; the chain continues from the last complete one.
            return "";
        }
    }

    private static Object monitorFor(Path file) {
        return FILE_MONITORS.computeIfAbsent(file.toAbsolutePath().normalize(), key -> new Object());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record IntegrityOutcome(boolean ok, int checkedRows, String reason) {
    }
}
