package com.lancluster.manual.node;

import com.lancluster.node.ClusterConfig;
import com.lancluster.node.WorkerAgent;
import com.lancluster.security.KeyFiles;
import com.lancluster.task.builtin.BuiltinHandlers;

import javax.crypto.SecretKey;
import java.nio.file.Paths;

/**
 * Test 2: Worker Joining the Dispatcher
 *
 * How to run:
 *   Terminal 1: mvn exec:java -Dexec.mainClass="com.lancluster.manual.node.TestDispatcherNode" -Dexec.classpathScope=test
 *   Terminal 2: mvn exec:java -Dexec.mainClass="com.lancluster.manual.node.TestWorkerNode" -Dexec.classpathScope=test -Dexec.args="OTP"
 *
 * Prerequisites:
 *   - Dispatcher running on localhost:8888, same working directory (shared manual-cluster.key)
 *
 * Expected behavior:
 *   - Handshake succeeds and heartbeats start
 *   - Dispatcher's next round prints sum(1..100) = 5050
 *   - Stopping the worker with Ctrl+C removes it from the dispatcher
 *
 * Stop with: Ctrl+C
 */
public class TestWorkerNode {

    public static void main(String[] args) throws Exception {
        System.out.println("========================================");
        System.out.println("  TEST 2: Worker Joining the Dispatcher");
        System.out.println("========================================");
        System.out.println();

        if (args.length < 1) {
            System.err.println("Usage: TestWorkerNode <OTP> [workerId]");
            System.exit(1);
        }

        SecretKey key = KeyFiles.load(Paths.get("manual-cluster.key"));
        WorkerAgent worker = new WorkerAgent("localhost", 8888, args[0], key,
                ClusterConfig.fromEnvironment(), args.length > 1 ? args[1] : null);
        BuiltinHandlers.registerAll(worker.getHandlers());
        worker.connect();
        Runtime.getRuntime().addShutdownHook(new Thread(worker::stop));

        System.out.println();
        System.out.println("[OK] Worker " + worker.getWorkerId() + " connected to localhost:8888");
        System.out.println("[OK] Handlers: " + worker.getHandlers().names());
        System.out.println();
        System.out.println("Check Dispatcher's terminal for 'registered' message");
        System.out.println("Press Ctrl+C to stop");
        System.out.println();

        worker.awaitDisconnect();
        System.out.println("Dispatcher closed the connection");
    }
}
