package io.github.hotbrkm.proxybroker.meter;

import io.github.hotbrkm.proxybroker.endpoint.EndpointKey;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable usage ledger of one endpoint identity. Every update runs under the entry's own lock.
 * <p>
 * Only {@link ProxyMeter} mutates entries; readers get an {@link EndpointMetricsSnapshot}.
 */
final class EndpointMetrics {

    private final ReentrantLock lock = new ReentrantLock();
    private final EndpointKey key;
    private final String proxyType;
    private final String region;
    private final Set<String> sessions = new HashSet<>();

    private String purpose;
    private long acquisitions;
    private long requestsCount;
    private long successCount;
    private long failureCount;
    private long bytesSent;
    private long bytesReceived;
    private double costEstimate;
    private Instant firstSeen;
    private Instant lastSeen;
    private Instant lastAcquiredAt;
    private int activeLeases;
    private String lastReleaseReason;
    private Duration totalActiveDuration = Duration.ZERO;

    EndpointMetrics(ProxyEndpoint endpoint, Instant now) {
        this.key = endpoint.key();
        this.proxyType = endpoint.proxyType() == null ? null : endpoint.proxyType().value();
        this.region = endpoint.region();
        this.firstSeen = now;
        this.lastSeen = now;
    }

    /**
     * @return true if the session id had not been seen under this key before
     */
    boolean onAcquire(String session, String purpose, Instant now) {
        lock.lock();
        try {
            acquisitions++;
            activeLeases++;
            lastAcquiredAt = now;
            lastSeen = now;
            if (purpose != null) {
                this.purpose = purpose;
            }
            return session != null && sessions.add(session);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Accumulates one request and recomputes the cost from the running totals.
     *
     * @return failure count after the update
     */
    long onRequest(long sent, long received, boolean success, double pricePerGb, Instant now) {
        lock.lock();
        try {
            requestsCount++;
            if (success) {
                successCount++;
            } else {
                failureCount++;
            }
            bytesSent += sent;
            bytesReceived += received;
            costEstimate = (bytesSent + bytesReceived) / ProxyMeter.BYTES_PER_GB * pricePerGb;
            lastSeen = now;
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return acquired-to-released duration of this release, or null if no lease was open
     */
    Duration onRelease(String reason, Instant now) {
        lock.lock();
        try {
            lastReleaseReason = reason;
            lastSeen = now;
            if (activeLeases == 0) {
                return null;
            }
            activeLeases--;
            Duration held = lastAcquiredAt == null ? Duration.ZERO : Duration.between(lastAcquiredAt, now);
            if (held.isNegative()) {
                held = Duration.ZERO;
            }
            totalActiveDuration = totalActiveDuration.plus(held);
            return held;
        } finally {
            lock.unlock();
        }
    }

    EndpointKey key() {
        return key;
    }

    EndpointMetricsSnapshot snapshot() {
        lock.lock();
        try {
            return new EndpointMetricsSnapshot(key, proxyType, region, purpose, acquisitions, requestsCount,
                    successCount, failureCount, bytesSent, bytesReceived, costEstimate, sessions.size(),
                    firstSeen, lastSeen, activeLeases > 0, lastReleaseReason, totalActiveDuration);
        } finally {
            lock.unlock();
        }
    }
}
