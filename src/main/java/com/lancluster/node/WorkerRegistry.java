package com.lancluster.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.lancluster.monitor.HeartbeatTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatcher-side registry of connected workers and in-flight tasks.
 *
 * A single lock guards both maps and every mutable field of {@link WorkerRecord}.
 * Removal is compare-and-remove on the record instance, so a connection loop
 * that ends after its worker was evicted cannot remove a newer registration
 * under the same id. Pending results are resolved outside the lock.
 */
public class WorkerRegistry implements HeartbeatTable {
    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Object lock = new Object();

    // Insertion order gives "first idle worker" a stable meaning
    private final Map<String, WorkerRecord> workers = new LinkedHashMap<>();
    private final Map<String, PendingResult> pending = new HashMap<>();

    // ==================== Membership ====================

    /**
     * Checks whether a new worker with this id could be registered right now.
     *
     * @return null if admissible, otherwise the rejection reason
     */
    public String checkAdmission(String workerId, int maxWorkers) {
        synchronized (lock) {
            if (workers.containsKey(workerId)) {
                return "Worker id already connected: " + workerId;
            }
            if (workers.size() >= maxWorkers) {
                return "Cluster full (" + maxWorkers + " workers)";
            }
            return null;
        }
    }

    /**
     * Registers a worker unless its id is already taken.
     *
     * @return true if registered
     */
    public boolean register(WorkerRecord record) {
        synchronized (lock) {
            if (workers.containsKey(record.getWorkerId())) {
                log.warn("Worker {} already registered, skipping", record.getWorkerId());
                return false;
            }
            workers.put(record.getWorkerId(), record);
            log.info("Worker {} registered. Total workers: {}", record.getWorkerId(), workers.size());
            return true;
        }
    }

    /**
     * Removes the worker only if this exact record is still the registered one.
     *
     * @return true if the record was removed by this call
     */
    public boolean remove(WorkerRecord record) {
        synchronized (lock) {
            record.setActive(false);
            boolean removed = workers.remove(record.getWorkerId(), record);
            if (removed) {
                log.info("Worker {} removed. Remaining: {}", record.getWorkerId(), workers.size());
            }
            return removed;
        }
    }

    /**
     * @return true if this exact record is still registered and active
     */
    public boolean isRegistered(WorkerRecord record) {
        synchronized (lock) {
            return record.isActive() && workers.get(record.getWorkerId()) == record;
        }
    }

    /**
     * Refreshes the heartbeat timestamp of a registered worker.
     *
     * @param now {@link com.lancluster.util.MonotonicClock} reading
     * @return false if the record is no longer registered (the heartbeat is dropped)
     */
    public boolean touchHeartbeat(WorkerRecord record, long now) {
        synchronized (lock) {
            if (!record.isActive() || workers.get(record.getWorkerId()) != record) {
                return false;
            }
            record.setLastHeartbeat(now, System.currentTimeMillis());
            return true;
        }
    }

    /**
     * {@inheritDoc}
     *
     * The channel of every evicted worker is closed once the lock is released,
     * which ends its connection loop even if the peer never sends again.
     */
    @Override
    public List<String> evictSilentWorkers(long now, long maxSilenceMs) {
        List<WorkerRecord> evicted = new ArrayList<>();
        synchronized (lock) {
            Iterator<WorkerRecord> it = workers.values().iterator();
            while (it.hasNext()) {
                WorkerRecord record = it.next();
                if (now - record.getLastHeartbeat() > maxSilenceMs) {
                    record.setActive(false);
                    it.remove();
                    evicted.add(record);
                }
            }
        }

        List<String> ids = new ArrayList<>(evicted.size());
        for (WorkerRecord record : evicted) {
            record.getChannel().close();
            ids.add(record.getWorkerId());
        }
        return ids;
    }

    /**
     * Removes every worker, for dispatcher shutdown.
     */
    public List<WorkerRecord> drainWorkers() {
        synchronized (lock) {
            List<WorkerRecord> drained = new ArrayList<>(workers.values());
            for (WorkerRecord record : drained) {
                record.setActive(false);
            }
            workers.clear();
            return drained;
        }
    }

    public List<WorkerInfo> snapshot() {
        synchronized (lock) {
            List<WorkerInfo> infos = new ArrayList<>(workers.size());
            for (WorkerRecord record : workers.values()) {
                infos.add(record.toInfo());
            }
            return infos;
        }
    }

    public int size() {
        synchronized (lock) {
            return workers.size();
        }
    }

    // ==================== Task bookkeeping ====================

    /**
     * Picks a worker and records the task as pending on it, atomically.
     *
     * With a target id the named worker is used whether or not it is busy.
     * Without one, the first active worker with no current task is used.
     *
     * @param taskId caller-chosen task id, must not be pending already
     * @param targetWorker worker id to pin the task to, or null
     * @param timeoutMs how long the caller will wait for the result
     * @throws WorkerNotFoundException if the target is not registered and active
     * @throws NoAvailableWorkerException if no target was given and every worker is busy
     * @throws IllegalStateException if a task with the same id is still pending
     */
    public PendingResult reserve(String taskId, String targetWorker, long timeoutMs)
            throws WorkerNotFoundException, NoAvailableWorkerException {
        synchronized (lock) {
            if (pending.containsKey(taskId)) {
                throw new IllegalStateException("Task id already pending: " + taskId);
            }

            WorkerRecord chosen = null;
            if (targetWorker != null) {
                WorkerRecord record = workers.get(targetWorker);
                if (record == null || !record.isActive()) {
                    throw new WorkerNotFoundException(targetWorker);
                }
                chosen = record;
            } else {
                for (WorkerRecord record : workers.values()) {
                    if (record.isActive() && record.getCurrentTask() == null) {
                        chosen = record;
                        break;
                    }
                }
                if (chosen == null) {
                    throw new NoAvailableWorkerException();
                }
            }

            chosen.setCurrentTask(taskId);
            PendingResult result = new PendingResult(taskId, chosen, timeoutMs);
            pending.put(taskId, result);
            return result;
        }
    }

    /**
     * Applies a task_result received from {@code sender}.
     *
     * Clears the owning worker's current task only when it still names this task.
     *
     * @return true if a pending task was resolved, false if none was waiting
     */
    public boolean completeTask(WorkerRecord sender, String taskId, JsonNode result) {
        PendingResult slot = takePending(sender, taskId);
        return slot != null && slot.complete(result);
    }

    /**
     * Failure counterpart of {@link #completeTask}.
     */
    public boolean failTask(WorkerRecord sender, String taskId, Throwable cause) {
        PendingResult slot = takePending(sender, taskId);
        return slot != null && slot.fail(cause);
    }

    private PendingResult takePending(WorkerRecord sender, String taskId) {
        synchronized (lock) {
            PendingResult slot = pending.remove(taskId);
            WorkerRecord owner = slot != null ? slot.getWorker() : sender;
            if (taskId.equals(owner.getCurrentTask())) {
                owner.setCurrentTask(null);
            }
            return slot;
        }
    }

    /**
     * Withdraws a pending task the caller stopped waiting for and frees the
     * assigned worker's slot if it is still on that task.
     *
     * @return true if the slot was still pending; false if a result or
     *         {@link #drainPending()} took it first, in which case it is resolved
     *         or about to be
     */
    public boolean abandon(PendingResult slot) {
        synchronized (lock) {
            boolean removed = pending.remove(slot.getTaskId(), slot);
            WorkerRecord worker = slot.getWorker();
            if (slot.getTaskId().equals(worker.getCurrentTask())) {
                worker.setCurrentTask(null);
            }
            return removed;
        }
    }

    /**
     * Removes every pending result, for dispatcher shutdown.
     */
    public List<PendingResult> drainPending() {
        synchronized (lock) {
            List<PendingResult> drained = new ArrayList<>(pending.values());
            pending.clear();
            return drained;
        }
    }

    public boolean isPending(String taskId) {
        synchronized (lock) {
            return pending.containsKey(taskId);
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }
}
