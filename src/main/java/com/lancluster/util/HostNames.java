package com.lancluster.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Small helpers for naming workers.
 */
public final class HostNames {
    private static final Logger log = LoggerFactory.getLogger(HostNames.class);

    private HostNames() {
    }

    /**
     * @return this machine's hostname, or "localhost" if it cannot be resolved
     */
    public static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Cannot resolve local hostname: {}", e.getMessage());
            return "localhost";
        }
    }

    /**
     * Generates a worker id of the form {@code <hostname>-<8 hex chars>}.
     */
    public static String generateWorkerId() {
        return localHostname() + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
