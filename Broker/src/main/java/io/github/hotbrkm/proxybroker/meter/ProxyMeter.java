package io.github.hotbrkm.proxybroker.meter;

import io.github.hotbrkm.proxybroker.endpoint.EndpointKey;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Usage ledger keyed by endpoint identity.
 * <p>
 * Records acquisitions, per-request bytes and outcome, and releases, and derives a cost estimate
 * per endpoint from that endpoint's provider price. Entries are retained for the lifetime of the
 * meter (or until {@link #reset()}) so that released endpoints still count in aggregates.
 * <p>
 * Thread-safe: the entry map is concurrent and each entry guards its own counters.
 */
@Slf4j
public class ProxyMeter {

    /** Billing unit: 2^30 bytes. */
    public static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

    private final Map<EndpointKey, EndpointMetrics> metrics = new ConcurrentHashMap<>();
    private final Map<String, Double> providerPrices = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProxyMeter() {
        this(Clock.systemUTC());
    }

    public ProxyMeter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Registers the price per GiB of a provider. A provider's price is fixed once registered,
     * which keeps every cost estimate non-decreasing.
     */
    public void registerProviderPrice(String provider, double pricePerGb) {
        Objects.requireNonNull(provider, "provider must not be null");
        if (Double.isNaN(pricePerGb) || pricePerGb < 0) {
            throw new IllegalArgumentException("pricePerGb must be >= 0: " + pricePerGb);
        }
        Double previous = providerPrices.putIfAbsent(provider, pricePerGb);
        if (previous != null && previous != pricePerGb) {
            log.warn("Ignoring price change for already registered provider. provider={}, price={}, ignored={}",
                    provider, previous, pricePerGb);
            return;
        }
        log.debug("Registered provider price. provider={}, pricePerGb={}", provider, pricePerGb);
    }

    public double getProviderPrice(String provider) {
        return provider == null ? 0.0 : providerPrices.getOrDefault(provider, 0.0);
    }

    /**
     * Records an acquisition, creating the ledger for the endpoint's identity on first sight.
     */
    public void recordAcquire(ProxyEndpoint endpoint, String purpose) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        Instant now = clock.instant();
        EndpointMetrics entry = entryFor(endpoint, now);
        boolean newSession = entry.onAcquire(endpoint.session(), purpose, now);
        if (newSession) {
            log.debug("New session tracked. provider={}, session={}", endpoint.provider(), endpoint.session());
        }
    }

    /**
     * Records one request made through the endpoint.
     *
     * @throws IllegalArgumentException if a byte count is negative
     */
    public void recordRequest(ProxyEndpoint endpoint, long bytesSent, long bytesReceived, boolean success) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        if (bytesSent < 0 || bytesReceived < 0) {
            throw new IllegalArgumentException("byte counts must be >= 0: sent=" + bytesSent + ", received=" + bytesReceived);
        }
        Instant now = clock.instant();
        EndpointMetrics entry = entryFor(endpoint, now);
        long failures = entry.onRequest(bytesSent, bytesReceived, success, getProviderPrice(endpoint.provider()), now);
        if (!success) {
            log.warn("Proxy request failed. provider={}, endpoint={}, failures={}",
                    endpoint.provider(), endpoint.address(), failures);
        } else {
            log.debug("Proxy request recorded. provider={}, endpoint={}, sent={}, received={}",
                    endpoint.provider(), endpoint.address(), bytesSent, bytesReceived);
        }
    }

    /**
     * Records a release. The ledger is kept; only its active state changes.
     */
    public void recordRelease(ProxyEndpoint endpoint, String reason) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        EndpointMetrics entry = metrics.get(endpoint.key());
        if (entry == null) {
            log.warn("Release recorded for unknown endpoint. key={}, reason={}", endpoint.key(), reason);
            return;
        }
        Duration held = entry.onRelease(reason, clock.instant());
        if (held == null) {
            log.warn("Release recorded for endpoint with no open acquisition. key={}, reason={}", endpoint.key(), reason);
            return;
        }
        log.info("Proxy released. provider={}, endpoint={}, session={}, reason={}, heldMs={}",
                endpoint.provider(), endpoint.address(), endpoint.session(),
                reason == null ? "normal" : reason, held.toMillis());
    }

    public Map<EndpointKey, EndpointMetricsSnapshot> getMetrics() {
        return getMetrics(null);
    }

    /**
     * Returns snapshots of every retained ledger, optionally only those of one provider.
     */
    public Map<EndpointKey, EndpointMetricsSnapshot> getMetrics(String provider) {
        Map<EndpointKey, EndpointMetricsSnapshot> result = new LinkedHashMap<>();
        for (EndpointMetrics entry : metrics.values()) {
            if (provider == null || provider.equals(entry.key().provider())) {
                result.put(entry.key(), entry.snapshot());
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public UsageSummary getSummary() {
        int endpoints = 0;
        int active = 0;
        long requests = 0;
        long bytes = 0;
        long errors = 0;
        double cost = 0.0;
        Map<String, ProviderUsage> byProvider = new LinkedHashMap<>();

        for (EndpointMetrics entry : metrics.values()) {
            EndpointMetricsSnapshot snapshot = entry.snapshot();
            endpoints++;
            if (snapshot.active()) {
                active++;
            }
            requests += snapshot.requestsCount();
            bytes += snapshot.totalBytes();
            errors += snapshot.failureCount();
            cost += snapshot.costEstimate();
            byProvider.merge(snapshot.provider(),
                    new ProviderUsage(snapshot.provider(), 0, 0, 0, 0, 0.0).plus(snapshot),
                    (existing, added) -> existing.plus(snapshot));
        }

        double successRate = requests == 0 ? 0.0 : (double) (requests - errors) / requests * 100;
        return new UsageSummary(endpoints, active, requests, bytes, bytes / BYTES_PER_GB, errors, successRate, cost,
                Collections.unmodifiableMap(byProvider));
    }

    /**
     * Drops every ledger.
     */
    public void reset() {
        int count = metrics.size();
        metrics.clear();
        log.warn("Proxy meter reset. clearedEndpoints={}", count);
    }

    private EndpointMetrics entryFor(ProxyEndpoint endpoint, Instant now) {
        return metrics.computeIfAbsent(endpoint.key(), key -> {
            log.info("New proxy endpoint metered. provider={}, endpoint={}, type={}, region={}",
                    endpoint.provider(), endpoint.address(),
                    endpoint.proxyType() == null ? null : endpoint.proxyType().value(), endpoint.region());
            return new EndpointMetrics(endpoint, now);
        });
    }
}
