package com.lancluster.monitor;

import java.util.List;

/**
 * Source of last-heartbeat timestamps that the {@link FailureDetector} sweeps.
 */
public interface HeartbeatTable {

    /**
     * Marks inactive and removes every worker whose last heartbeat is older
     * than {@code maxSilenceMs}, in one atomic step.
     *
     * @param now current {@link com.lancluster.util.MonotonicClock} reading
     * @param maxSilenceMs silence tolerated before a worker is declared dead
     * @return ids of the evicted workers
     */
    List<String> evictSilentWorkers(long now, long maxSilenceMs);
}
