package io.trialforge.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TrialForgeConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE_NAME = "trialforge-settings.json";
    public static final String REGISTRY_LOCK_NAME = "lifecycle-registry";

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public TrialForgeConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static TrialForgeConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static TrialForgeConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new TrialForgeConfig(scoped, base, safeNamespace);
    }

    static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path ledgerRoot() {
        return rootDir.resolve("ledger");
    }

    public Path ledgerFile() {
        return ledgerRoot().resolve("trials.jsonl");
    }

    public Path regretRoot() {
        return rootDir.resolve("regret");
    }

    public Path regretFile() {
        return regretRoot().resolve("queue.jsonl");
    }

    public Path lockDir() {
        return rootDir.resolve("locks");
    }

    public Path registryRoot() {
        return rootDir.resolve("registry");
    }

    public Path registryFile() {
        return registryRoot().resolve("lifecycle.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
