package io.github.hotbrkm.proxybroker.meter;

import io.github.hotbrkm.proxybroker.endpoint.EndpointKey;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of one endpoint's usage ledger.
 *
 * @param key                 Endpoint identity
 * @param proxyType           Proxy type name, or null
 * @param region              Region code, or null
 * @param purpose             Purpose tag of the most recent acquisition
 * @param acquisitions        Number of recorded acquisitions
 * @param requestsCount       Recorded requests
 * @param successCount        Successful requests
 * @param failureCount        Failed requests
 * @param bytesSent           Bytes sent through the endpoint
 * @param bytesReceived       Bytes received through the endpoint
 * @param costEstimate        Cost derived from the endpoint's own provider price
 * @param uniqueSessions      Distinct session ids seen under this key
 * @param firstSeen           First acquisition or request time
 * @param lastSeen            Most recent activity time
 * @param active              Whether at least one acquisition is unreleased
 * @param lastReleaseReason   Reason passed to the most recent release, or null
 * @param totalActiveDuration Accumulated acquired-to-released time
 */
public record EndpointMetricsSnapshot(EndpointKey key, String proxyType, String region, String purpose,
                                      long acquisitions, long requestsCount, long successCount, long failureCount,
                                      long bytesSent, long bytesReceived, double costEstimate, int uniqueSessions,
                                      Instant firstSeen, Instant lastSeen, boolean active, String lastReleaseReason,
                                      Duration totalActiveDuration) {

    public String provider() {
        return key.provider();
    }

    public long totalBytes() {
        return bytesSent + bytesReceived;
    }

    public double totalGb() {
        return totalBytes() / ProxyMeter.BYTES_PER_GB;
    }

    /**
     * Success rate in percent (0-100); 0.0 when nothing was recorded.
     */
    public double successRate() {
        if (requestsCount == 0) {
            return 0.0;
        }
        return (double) successCount / requestsCount * 100;
    }
}
