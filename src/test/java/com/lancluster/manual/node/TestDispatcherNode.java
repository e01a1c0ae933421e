package com.lancluster.manual.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.lancluster.node.ClusterConfig;
import com.lancluster.node.ClusterException;
import com.lancluster.node.Dispatcher;
import com.lancluster.node.WorkerInfo;
import com.lancluster.protocol.WorkUnit;
import com.lancluster.security.KeyFiles;
import com.lancluster.util.Jsons;

import javax.crypto.SecretKey;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Test 1: Dispatcher Startup
 *
 * Starts a dispatcher on port 8888 and, every 10 seconds, sends a "sum" task
 * to the first idle worker.
 *
 * How to run:
 *   mvn exec:java -Dexec.mainClass="com.lancluster.manual.node.TestDispatcherNode" -Dexec.classpathScope=test
 *
 * Expected behavior:
 *   - Key file manual-cluster.key is created in the working directory
 *   - OTP printed in the banner
 *   - "No available worker" until TestWorkerNode joins, then sum = 5050
 *
 * Stop with: Ctrl+C
 */
public class TestDispatcherNode {

    public static void main(String[] args) throws Exception {
        System.out.println("========================================");
        System.out.println("  TEST 1: Dispatcher Startup");
        System.out.println("========================================");
        System.out.println();

        Path keyFile = Paths.get("manual-cluster.key");
        SecretKey key = KeyFiles.loadOrCreate(keyFile);
        ClusterConfig config = new ClusterConfig.Builder().port(8888).build();

        Dispatcher dispatcher = new Dispatcher(config, key);
        dispatcher.start();
        Runtime.getRuntime().addShutdownHook(new Thread(dispatcher::stop));

        System.out.println();
        System.out.println("[OK] Dispatcher listening on port " + dispatcher.getLocalPort());
        System.out.println("[OK] OTP: " + dispatcher.currentSessionSecret());
        System.out.println("[OK] Key file: " + keyFile.toAbsolutePath());
        System.out.println();
        System.out.println("Start TestWorkerNode with the OTP above");
        System.out.println("Press Ctrl+C to stop");
        System.out.println();

        JsonNode range = Jsons.mapper().readTree("{\"start\": 1, \"end\": 100}");
        int round = 0;
        while (true) {
            Thread.sleep(10_000);
            round++;
            System.out.println("--- Round " + round + " ---");
            for (WorkerInfo worker : dispatcher.snapshotWorkers()) {
                System.out.println("  " + worker);
            }
            try {
                JsonNode sum = dispatcher.executeTask("sum_round" + round, new WorkUnit("sum", range));
                System.out.println("[OK] sum(1..100) = " + sum);
            } catch (ClusterException e) {
                System.out.println("[--] " + e.getMessage());
            }
        }
    }
}
