package com.lancluster.cli.commands;

import com.lancluster.node.ClusterConfig;
import com.lancluster.node.Dispatcher;
import com.lancluster.security.KeyFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import javax.crypto.SecretKey;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Start the dispatcher and wait for workers.
 */
@Command(name = "host", description = "Start the dispatcher")
public class HostCommand implements Callable<Integer> {

    @Option(
        names = {"-p", "--port"},
        description = "Port to listen on (default: LANCLUSTER_HOST_PORT or 8888)"
    )
    Integer port;

    @Option(
        names = {"-a", "--address"},
        description = "Address to bind (default: LANCLUSTER_HOST_ADDRESS or 0.0.0.0)"
    )
    String address;

    @Option(
        names = {"-k", "--key-file"},
        description = "File to load the bootstrap key from, created if missing (default: ${DEFAULT-VALUE})",
        defaultValue = "lancluster.key"
    )
    Path keyFile;

    @Option(
        names = {"--max-workers"},
        description = "Maximum number of connected workers (default: LANCLUSTER_MAX_WORKERS or 10)"
    )
    Integer maxWorkers;

    @Override
    public Integer call() throws Exception {
        ClusterConfig.Builder builder = ClusterConfig.fromEnvironment().toBuilder();
        if (port != null) {
            builder.port(port);
        }
        if (address != null) {
            builder.hostAddress(address);
        }
        if (maxWorkers != null) {
            builder.maxWorkers(maxWorkers);
        }
        ClusterConfig config = builder.build();

        boolean existed = Files.exists(keyFile);
        SecretKey key = KeyFiles.loadOrCreate(keyFile);

        System.out.println("========================================");
        System.out.println("  LanCluster Dispatcher - Starting");
        System.out.println("========================================");
        System.out.println();
        if (existed) {
            System.out.println("Using existing encryption key from " + keyFile);
        } else {
            System.out.println("Generated new encryption key and saved to " + keyFile);
        }

        Dispatcher dispatcher = new Dispatcher(config, key);
        dispatcher.start();
        Runtime.getRuntime().addShutdownHook(new Thread(dispatcher::stop, "Dispatcher-Shutdown"));

        System.out.println("[OK] Dispatcher started successfully");
        System.out.println("  Address: " + config.getHostAddress());
        System.out.println("  Port: " + dispatcher.getLocalPort());
        System.out.println("  One-time password: " + dispatcher.currentSessionSecret());
        System.out.println("  Encryption key: " + KeyFiles.fingerprint(key) + "...");
        System.out.println();
        System.out.println("Workers join with:");
        System.out.println("  lancluster join --host <this-host> --port " + dispatcher.getLocalPort()
                + " --key " + dispatcher.currentSessionSecret() + " --key-file " + keyFile);
        System.out.println();
        System.out.println("Press Ctrl+C to stop");
        System.out.println();

        // Keep alive until Ctrl+C
        Thread.currentThread().join();
        return 0;
    }
}
