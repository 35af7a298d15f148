package io.github.hotbrkm.proxybroker.manager;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.endpoint.EndpointKey;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.github.hotbrkm.proxybroker.provider.ProxyProvider;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission state of one provider, guarded by its own lock so unrelated providers never contend.
 * <p>
 * Outstanding leases are counted per endpoint identity; a release without a matching lease
 * (double release) changes nothing.
 */
final class ProviderSlot {

    private final ProxyProvider provider;
    private final int order;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<EndpointKey, Integer> outstanding = new HashMap<>();
    private int active;

    ProviderSlot(ProxyProvider provider, int order) {
        this.provider = provider;
        this.order = order;
    }

    /**
     * Checks capacity and, if there is room, acquires from the provider and counts the lease,
     * all under the slot lock. Returns empty without any change when the slot is full.
     */
    Optional<ProxyEndpoint> tryAcquire(String region, String purpose) {
        lock.lock();
        try {
            if (!hasCapacity()) {
                return Optional.empty();
            }
            ProxyEndpoint endpoint = provider.acquire(region, purpose);
            outstanding.merge(endpoint.key(), 1, Integer::sum);
            active++;
            return Optional.of(endpoint);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false if the endpoint had no outstanding lease in this slot
     */
    boolean release(EndpointKey key) {
        lock.lock();
        try {
            Integer leases = outstanding.get(key);
            if (leases == null) {
                return false;
            }
            if (leases == 1) {
                outstanding.remove(key);
            } else {
                outstanding.put(key, leases - 1);
            }
            active = Math.max(0, active - 1);
            return true;
        } finally {
            lock.unlock();
        }
    }

    int active() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    boolean hasCapacity() {
        lock.lock();
        try {
            return config().isUnlimited() || active < config().concurrencyLimit();
        } finally {
            lock.unlock();
        }
    }

    ProviderStats stats() {
        ProviderConfig config = config();
        return new ProviderStats(config.name(), config.type().tag(), active(), config.concurrencyLimit(), config.pricePerGb());
    }

    ProxyProvider provider() {
        return provider;
    }

    ProviderConfig config() {
        return provider.config();
    }

    int order() {
        return order;
    }
}
