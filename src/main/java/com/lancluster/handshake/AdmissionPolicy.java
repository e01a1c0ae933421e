package com.lancluster.handshake;

/**
 * Dispatcher-side decisions consulted during a handshake.
 */
public interface AdmissionPolicy {

    /**
     * @return the OTP a worker must present right now
     */
    String currentSessionSecret();

    /**
     * Called after the OTP matched, before the success response is sent.
     *
     * @param identity the worker asking to join
     * @return null to admit, otherwise the reason sent back in the rejection
     */
    String checkAdmission(WorkerIdentity identity);
}
