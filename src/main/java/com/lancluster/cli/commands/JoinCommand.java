package com.lancluster.cli.commands;

import com.lancluster.node.ClusterConfig;
import com.lancluster.node.WorkerAgent;
import com.lancluster.security.KeyFiles;
import com.lancluster.task.builtin.BuiltinHandlers;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Join a dispatcher as a worker offering the built-in handlers.
 */
@Command(name = "join", description = "Join a dispatcher as a worker")
public class JoinCommand implements Callable<Integer> {

    @Option(
        names = {"-H", "--host"},
        description = "Dispatcher address",
        required = true
    )
    String host;

    @Option(
        names = {"-p", "--port"},
        description = "Dispatcher port (default: ${DEFAULT-VALUE})",
        defaultValue = "8888"
    )
    int port;

    @Option(
        names = {"--key"},
        description = "One-time password printed by the dispatcher",
        required = true
    )
    String otp;

    @Option(
        names = {"--worker-id"},
        description = "Worker id (default: <hostname>-<random>)"
    )
    String workerId;

    @Option(
        names = {"-k", "--key-file"},
        description = "File to load the bootstrap key from (default: ${DEFAULT-VALUE})",
        defaultValue = "lancluster.key"
    )
    Path keyFile;

    @Override
    public Integer call() throws Exception {
        if (!Files.exists(keyFile)) {
            System.err.println("Error: Key file " + keyFile + " not found!");
            System.err.println("Copy the key file written by 'lancluster host' to this machine first.");
            return 1;
        }
        SecretKey key = KeyFiles.load(keyFile);
        ClusterConfig config = ClusterConfig.fromEnvironment();

        WorkerAgent worker = new WorkerAgent(host, port, otp, key, config, workerId);
        BuiltinHandlers.registerAll(worker.getHandlers());

        System.out.println("Connecting to dispatcher " + host + ":" + port + " as worker " + worker.getWorkerId());
        System.out.println("Using encryption key from " + keyFile);

        try {
            worker.connect();
        } catch (IOException e) {
            System.err.println("Failed to connect: " + e.getMessage());
            return 1;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(worker::stop, "Worker-Shutdown"));

        System.out.println("[OK] Worker connected");
        System.out.println("  Handlers: " + String.join(", ", worker.getHandlers().names()));
        System.out.println();
        System.out.println("Press Ctrl+C to stop");

        worker.awaitDisconnect();
        System.out.println("Disconnected from dispatcher");
        return 0;
    }
}
