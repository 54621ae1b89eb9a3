package io.meshward.cli;

import io.meshward.config.MeshSettings;
import io.meshward.config.MeshWardConfig;
import io.meshward.observability.AuditLogger;
import io.meshward.routing.AclDecision;
import io.meshward.routing.StigmergyRouter;
import io.meshward.runtime.MeshNode;
import io.meshward.security.Ed25519SignatureScheme;
import io.meshward.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "meshward",
        mixinStandardHelpOptions = true,
        description = "MeshWard mesh node control plane CLI",
        subcommands = {
                MeshWardCommand.InitCommand.class,
                MeshWardCommand.SettingsCommand.class,
                MeshWardCommand.AclCheckCommand.class,
                MeshWardCommand.RunCommand.class
        }
)
public final class MeshWardCommand implements Runnable {
    @Option(names = {"--root"}, description = "Node data root directory", defaultValue = MeshWardConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | settings | acl-check | run");
    }

    MeshWardConfig config() {
        return MeshWardConfig.fromRoot(root);
    }

    MeshSettings settings() {
        return MeshSettings.load(config());
    }

    @Command(name = "init", description = "Write a default settings file under the data root")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        MeshWardCommand parent;

        @Option(names = {"--node-id"}, description = "Node id to store in the settings file")
        String nodeId;

        @Option(names = {"--force"}, description = "Overwrite an existing settings file")
        boolean force;

        @Override
        public Integer call() {
            MeshWardConfig config = parent.config();
            if (Files.exists(config.settingsFile()) && !force) {
                System.err.println("Settings file already exists: " + config.settingsFile() + " (use --force to overwrite)");
                return 1;
            }
            MeshSettings settings = MeshSettings.defaults().withNodeId(nodeId);
            settings.write(config.settingsFile());
            System.out.println("Initialized MeshWard at: " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "settings", description = "Print the effective settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        MeshWardCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.settings()));
            return 0;
        }
    }

    @Command(name = "acl-check", description = "Evaluate the ACL for a destination node")
    static final class AclCheckCommand implements Callable<Integer> {
        @ParentCommand
        MeshWardCommand parent;

        @Parameters(index = "0", description = "Destination node id")
        String destination;

        @Override
        public Integer call() {
            MeshSettings settings = parent.settings();
            StigmergyRouter router = new StigmergyRouter(
                    Clock.systemUTC(),
                    new HashSet<>(settings.localTags()),
                    settings.pheromoneDecayRate(),
                    settings.pheromoneBoost(),
                    settings.pheromoneMin()
            );
            router.updatePolicies(settings.aclPolicies(), settings.peerTags());
            router.updateProfile(settings.aclProfile());
            AclDecision decision = router.evaluate(destination);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("destination", destination);
            out.put("profile", settings.aclProfile());
            out.put("decision", decision);
            System.out.println(Jsons.toJson(out));
            return decision.allowed() ? 0 : 2;
        }
    }

    @Command(name = "run", description = "Run the node loops until terminated")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        MeshWardCommand parent;

        @Option(names = {"--status-interval-ms"}, defaultValue = "10000",
                description = "How often to print node status")
        long statusIntervalMs;

        @Option(names = {"--node-id"}, description = "Override the node id from the settings file")
        String nodeId;

        @Override
        public Integer call() throws Exception {
            MeshWardConfig config = parent.config();
            MeshSettings settings = parent.settings().withNodeId(nodeId);
            AuditLogger auditLogger = new AuditLogger(config.auditFile(), settings.nodeId());
            auditLogger.log(AuditLogger.AuditEvent.of("settings.load", "node/settings", "ok", Map.of(
                    "config", config.settingsFile().toString(),
                    "source", Files.exists(config.settingsFile()) ? "file" : "defaults"
            )));
            MeshNode node = new MeshNode(settings, Clock.systemUTC(), new Ed25519SignatureScheme(), auditLogger);
            AtomicBoolean running = new AtomicBoolean(true);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                node.stop();
            }, "meshward-shutdown-hook"));

            node.start();
            while (running.get()) {
                System.out.println(Jsons.toJson(node.status()));
                Thread.sleep(Math.max(100L, statusIntervalMs));
            }
            return 0;
        }
    }
}
