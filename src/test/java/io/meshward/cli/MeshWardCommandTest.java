package io.meshward.cli;

import io.meshward.config.MeshSettings;
import io.meshward.config.MeshWardConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class MeshWardCommandTest {

    @Test
    void initWritesSettingsOnceUnlessForced() throws Exception {
        Path root = Files.createTempDirectory("meshward-test-cli-init-");
        try {
            CommandLine cli = new CommandLine(new MeshWardCommand());
            Assertions.assertEquals(0, cli.execute("--root", root.toString(), "init", "--node-id", "node-9"));
            MeshSettings written = MeshSettings.load(MeshWardConfig.fromRoot(root.toString()));
            Assertions.assertEquals("node-9", written.nodeId());

            Assertions.assertEquals(1, new CommandLine(new MeshWardCommand())
                    .execute("--root", root.toString(), "init"));
            Assertions.assertEquals(0, new CommandLine(new MeshWardCommand())
                    .execute("--root", root.toString(), "init", "--force"));
            Assertions.assertEquals(MeshSettings.DEFAULT_NODE_ID,
                    MeshSettings.load(MeshWardConfig.fromRoot(root.toString())).nodeId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void aclCheckExitCodeFollowsDecision() throws Exception {
        Path root = Files.createTempDirectory("meshward-test-cli-acl-");
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            Files.writeString(root.resolve(MeshWardConfig.SETTINGS_FILE_NAME), """
                    {
                      "localTags": ["edge"],
                      "aclPolicies": [{"source_tag": "edge", "target_tag": "restricted", "action": "deny"},
                                      {"source_tag": "*", "target_tag": "*", "action": "allow"}],
                      "peerTags": {"vault": ["restricted"]}
                    }
                    """, StandardCharsets.UTF_8);
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));

            int denied = new CommandLine(new MeshWardCommand()).execute("--root", root.toString(), "acl-check", "vault");
            int allowed = new CommandLine(new MeshWardCommand()).execute("--root", root.toString(), "acl-check", "web");

            Assertions.assertEquals(2, denied);
            Assertions.assertEquals(0, allowed);
            String out = captured.toString(StandardCharsets.UTF_8);
            Assertions.assertTrue(out.contains("explicit_deny"), out);
            Assertions.assertTrue(out.contains("explicit_allow"), out);
        } finally {
            System.setOut(originalOut);
            deleteRecursively(root);
        }
    }

    @Test
    void settingsPrintsEffectiveValues() throws Exception {
        Path root = Files.createTempDirectory("meshward-test-cli-settings-");
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            Assertions.assertEquals(0, new CommandLine(new MeshWardCommand()).execute("--root", root.toString(), "settings"));
            String out = captured.toString(StandardCharsets.UTF_8);
            Assertions.assertTrue(out.contains("\"totalNodes\" : 10"), out);
            Assertions.assertTrue(out.contains("\"aclProfile\" : \"default\""), out);
        } finally {
            System.setOut(originalOut);
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
