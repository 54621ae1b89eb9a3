package io.meshward.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class MeshWardConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "meshward-settings.json";

    private final Path rootDir;

    public MeshWardConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static MeshWardConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new MeshWardConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
