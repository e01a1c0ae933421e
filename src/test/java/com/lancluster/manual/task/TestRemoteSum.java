package com.lancluster.manual.task;

import com.lancluster.client.DispatcherClient;
import com.lancluster.client.RemoteFunction;
import com.lancluster.node.ClusterConfig;
import com.lancluster.node.Dispatcher;
import com.lancluster.node.WorkerAgent;
import com.lancluster.security.CipherCodec;
import com.lancluster.task.builtin.BuiltinHandlers;

import javax.crypto.SecretKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Test 3: Splitting a Range Across Workers
 *
 * Runs a dispatcher and three workers in one JVM, splits 1..3,000,000 into
 * three ranges and sums them in parallel through {@link DispatcherClient}.
 *
 * How to run:
 *   mvn exec:java -Dexec.mainClass="com.lancluster.manual.task.TestRemoteSum" -Dexec.classpathScope=test
 *
 * Expected behavior:
 *   - Each range goes to a different worker
 *   - Total = 4500001500000
 */
public class TestRemoteSum {

    private static final int WORKERS = 3;
    private static final long N = 3_000_000L;

    public static void main(String[] args) throws Exception {
        System.out.println("========================================");
        System.out.println("  TEST 3: Splitting a Range Across Workers");
        System.out.println("========================================");
        System.out.println();

        SecretKey key = CipherCodec.generateKey();
        ClusterConfig config = new ClusterConfig.Builder()
                .hostAddress("127.0.0.1")
                .port(0)
                .build();
        Dispatcher dispatcher = new Dispatcher(config, key);
        dispatcher.start();

        List<WorkerAgent> workers = new ArrayList<>();
        for (int i = 1; i <= WORKERS; i++) {
            WorkerAgent worker = new WorkerAgent("127.0.0.1", dispatcher.getLocalPort(),
                    dispatcher.currentSessionSecret(), key, config, "worker-" + i);
            BuiltinHandlers.registerAll(worker.getHandlers());
            worker.connect();
            workers.add(worker);
        }
        while (dispatcher.snapshotWorkers().size() < WORKERS) {
            Thread.sleep(50);
        }
        System.out.println("[OK] " + WORKERS + " workers joined");

        DispatcherClient client = new DispatcherClient(dispatcher);
        RemoteFunction<Map<String, Long>, Long> sum = client.function("sum", Long.class);
        ExecutorService callers = Executors.newFixedThreadPool(WORKERS);

        long start = System.currentTimeMillis();
        List<CompletableFuture<Long>> parts = new ArrayList<>();
        long chunk = N / WORKERS;
        for (int i = 0; i < WORKERS; i++) {
            Map<String, Long> range = new LinkedHashMap<>();
            range.put("start", i * chunk + 1);
            range.put("end", i == WORKERS - 1 ? N : (i + 1) * chunk);
            parts.add(sum.callAsync(range, callers));
        }

        long total = 0;
        for (CompletableFuture<Long> part : parts) {
            total += part.join();
        }
        long elapsed = System.currentTimeMillis() - start;

        System.out.println("[OK] Total = " + total + " (expected " + (N * (N + 1) / 2) + ")");
        System.out.println("[OK] Elapsed: " + elapsed + "ms");

        callers.shutdown();
        for (WorkerAgent worker : workers) {
            worker.stop();
        }
        dispatcher.stop();
    }
}
