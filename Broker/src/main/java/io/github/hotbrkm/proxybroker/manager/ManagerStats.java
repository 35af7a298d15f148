package io.github.hotbrkm.proxybroker.manager;

import io.github.hotbrkm.proxybroker.meter.UsageSummary;

import java.util.Map;

/**
 * Snapshot returned by {@link ProxyManager#getStats()}.
 *
 * @param providers    Per-provider admission state, in declaration order
 * @param usageSummary Meter aggregate, or null when metering is disabled
 */
public record ManagerStats(Map<String, ProviderStats> providers, UsageSummary usageSummary) {

    public boolean meteringEnabled() {
        return usageSummary != null;
    }

    public int totalActive() {
        return providers.values().stream().mapToInt(ProviderStats::active).sum();
    }
}
