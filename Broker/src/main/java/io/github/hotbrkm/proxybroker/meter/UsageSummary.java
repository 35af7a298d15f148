package io.github.hotbrkm.proxybroker.meter;

import java.util.Map;

/**
 * Aggregate over every retained endpoint ledger.
 * <p>
 * {@code totalCostEstimate} is the sum of per-endpoint costs, each computed with its own
 * provider's price, never a single global rate.
 *
 * @param totalEndpoints     Number of retained endpoint ledgers
 * @param activeEndpoints    Ledgers with an unreleased acquisition
 * @param totalRequests      Recorded requests
 * @param totalBytes         Bytes sent plus received
 * @param totalGb            {@code totalBytes / 2^30}
 * @param totalErrors        Failed requests
 * @param overallSuccessRate Percent of successful requests (0-100)
 * @param totalCostEstimate  Sum of endpoint cost estimates
 * @param byProvider         Totals per provider name
 */
public record UsageSummary(int totalEndpoints, int activeEndpoints, long totalRequests, long totalBytes, double totalGb,
                           long totalErrors, double overallSuccessRate, double totalCostEstimate,
                           Map<String, ProviderUsage> byProvider) {

    public static UsageSummary empty() {
        return new UsageSummary(0, 0, 0, 0, 0.0, 0, 0.0, 0.0, Map.of());
    }
}
