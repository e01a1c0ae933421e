package com.lancluster.node;

import com.fasterxml.jackson.databind.node.TextNode;
import com.lancluster.network.ConnectionClosedException;
import com.lancluster.network.FramedChannel;
import com.lancluster.network.LoopbackSockets;
import com.lancluster.security.CipherCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

final class WorkerRegistryTest {

    private final List<FramedChannel> channels = new ArrayList<>();
    private WorkerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new WorkerRegistry();
    }

    @AfterEach
    void tearDown() {
        for (FramedChannel channel : channels) {
            channel.close();
        }
    }

    private WorkerRecord record(String id, long lastHeartbeat) throws Exception {
        FramedChannel[] pair = LoopbackSockets.channels(CipherCodec.generateKey());
        channels.add(pair[0]);
        channels.add(pair[1]);
        return new WorkerRecord(id, "host-" + id, pair[1], lastHeartbeat);
    }

    @Test
    void admissionRefusesDuplicateIdAndFullCluster() throws Exception {
        Assertions.assertNull(registry.checkAdmission("w1", 2));
        Assertions.assertTrue(registry.register(record("w1", 0)));

        Assertions.assertNotNull(registry.checkAdmission("w1", 2));
        Assertions.assertFalse(registry.register(record("w1", 0)));

        Assertions.assertTrue(registry.register(record("w2", 0)));
        Assertions.assertTrue(registry.checkAdmission("w3", 2).startsWith("Cluster full"));
    }

    @Test
    void reservePicksFirstIdleWorker() throws Exception {
        registry.register(record("w1", 0));
        registry.register(record("w2", 0));

        PendingResult first = registry.reserve("t1", null, Long.MAX_VALUE);
        PendingResult second = registry.reserve("t2", null, Long.MAX_VALUE);

        Assertions.assertEquals("w1", first.getWorkerId());
        Assertions.assertEquals("w2", second.getWorkerId());
        Assertions.assertThrows(NoAvailableWorkerException.class, () -> registry.reserve("t3", null, Long.MAX_VALUE));
    }

    @Test
    void targetedReserveRequiresRegisteredWorker() throws Exception {
        registry.register(record("w1", 0));

        Assertions.assertThrows(WorkerNotFoundException.class, () -> registry.reserve("t1", "ghost", Long.MAX_VALUE));
        Assertions.assertEquals("w1", registry.reserve("t1", "w1", Long.MAX_VALUE).getWorkerId());
    }

    @Test
    void duplicatePendingTaskIdIsRejected() throws Exception {
        registry.register(record("w1", 0));
        registry.register(record("w2", 0));
        registry.reserve("t1", null, Long.MAX_VALUE);

        Assertions.assertThrows(IllegalStateException.class, () -> registry.reserve("t1", null, Long.MAX_VALUE));
    }

    @Test
    void resultResolvesOnceAndFreesWorker() throws Exception {
        WorkerRecord worker = record("w1", 0);
        registry.register(worker);
        PendingResult slot = registry.reserve("t1", null, Long.MAX_VALUE);

        Assertions.assertTrue(registry.completeTask(worker, "t1", TextNode.valueOf("done")));
        Assertions.assertFalse(registry.completeTask(worker, "t1", TextNode.valueOf("again")));

        Assertions.assertEquals("done", slot.await().asText());
        Assertions.assertNull(registry.snapshot().get(0).getCurrentTask());
        Assertions.assertEquals(0, registry.pendingCount());
    }

    @Test
    void failureResolvesWithCause() throws Exception {
        WorkerRecord worker = record("w1", 0);
        registry.register(worker);
        PendingResult slot = registry.reserve("t1", null, Long.MAX_VALUE);

        registry.failTask(worker, "t1", new TaskExecutionException("t1", "boom"));

        ExecutionException e = Assertions.assertThrows(ExecutionException.class, slot::await);
        Assertions.assertEquals("boom", ((TaskExecutionException) e.getCause()).getWorkerMessage());
    }

    @Test
    void lateResultDoesNotClearNewerAssignment() throws Exception {
        WorkerRecord worker = record("w1", 0);
        registry.register(worker);
        PendingResult expired = registry.reserve("old", null, Long.MAX_VALUE);
        registry.abandon(expired);
        registry.reserve("new", null, Long.MAX_VALUE);

        Assertions.assertFalse(registry.completeTask(worker, "old", TextNode.valueOf("late")));

        Assertions.assertEquals("new", registry.snapshot().get(0).getCurrentTask());
        Assertions.assertTrue(registry.isPending("new"));
    }

    @Test
    void removeIsCompareAndRemoveByRecord() throws Exception {
        WorkerRecord stale = record("w1", 0);
        registry.register(stale);
        Assertions.assertEquals(List.of("w1"), registry.evictSilentWorkers(10_000, 100));

        WorkerRecord fresh = record("w1", 10_000);
        Assertions.assertTrue(registry.register(fresh));

        Assertions.assertFalse(registry.remove(stale));
        Assertions.assertTrue(registry.isRegistered(fresh));
        Assertions.assertFalse(registry.touchHeartbeat(stale, 20_000));
        Assertions.assertTrue(registry.remove(fresh));
        Assertions.assertEquals(0, registry.size());
    }

    @Test
    void evictionHonorsSilenceThreshold() throws Exception {
        WorkerRecord quiet = record("quiet", 1_000);
        WorkerRecord chatty = record("chatty", 1_000);
        registry.register(quiet);
        registry.register(chatty);
        registry.touchHeartbeat(chatty, 1_900);

        Assertions.assertEquals(List.of(), registry.evictSilentWorkers(1_150, 200));
        Assertions.assertEquals(List.of("quiet"), registry.evictSilentWorkers(2_000, 200));
        Assertions.assertEquals(1, registry.size());
        Assertions.assertFalse(registry.isRegistered(quiet));
        Assertions.assertTrue(quiet.getChannel().isClosed());
        Assertions.assertFalse(chatty.getChannel().isClosed());
    }

    @Test
    void evictedWorkerPeerSeesConnectionClosed() throws Exception {
        FramedChannel[] pair = LoopbackSockets.channels(CipherCodec.generateKey());
        channels.add(pair[0]);
        channels.add(pair[1]);
        registry.register(new WorkerRecord("mute", "box", pair[1], 0));

        registry.evictSilentWorkers(1_000, 100);

        pair[0].setReadTimeout(2000);
        Assertions.assertThrows(ConnectionClosedException.class, pair[0]::receive);
    }

    @Test
    void resultClaimedBeforeAbandonIsKept() throws Exception {
        WorkerRecord worker = record("w1", 0);
        registry.register(worker);
        PendingResult slot = registry.reserve("t1", null, 50);

        Assertions.assertTrue(registry.completeTask(worker, "t1", TextNode.valueOf("just in time")));

        Assertions.assertFalse(registry.abandon(slot));
        Assertions.assertTrue(slot.isResolved());
        Assertions.assertEquals("just in time", slot.join().asText());
    }

    @Test
    void abandonBeforeResultWins() throws Exception {
        WorkerRecord worker = record("w1", 0);
        registry.register(worker);
        PendingResult slot = registry.reserve("t1", null, 50);

        Assertions.assertTrue(registry.abandon(slot));

        Assertions.assertFalse(registry.completeTask(worker, "t1", TextNode.valueOf("late")));
        Assertions.assertFalse(slot.isResolved());
        Assertions.assertThrows(TimeoutException.class, slot::await);
    }
}
