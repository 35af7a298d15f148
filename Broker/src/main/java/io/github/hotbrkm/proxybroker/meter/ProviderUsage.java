package io.github.hotbrkm.proxybroker.meter;

/**
 * Usage totals of one provider across its endpoints.
 */
public record ProviderUsage(String provider, int endpoints, long requests, long bytes, long errors, double cost) {

    public double gb() {
        return bytes / ProxyMeter.BYTES_PER_GB;
    }

    ProviderUsage plus(EndpointMetricsSnapshot metrics) {
        return new ProviderUsage(provider, endpoints + 1, requests + metrics.requestsCount(),
                bytes + metrics.totalBytes(), errors + metrics.failureCount(), cost + metrics.costEstimate());
    }
}
