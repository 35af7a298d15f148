package io.github.hotbrkm.proxybroker.manager;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.config.ProxyConfigurationException;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.github.hotbrkm.proxybroker.meter.ProxyMeter;
import io.github.hotbrkm.proxybroker.provider.ProxyProvider;
import io.github.hotbrkm.proxybroker.provider.ProxyProviderFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Hands out proxy endpoints with per-provider admission control and optional metering.
 * <p>
 * Acquisition never blocks: when a provider is full the call fails fast and retry policy is
 * left to the caller. Selection without a provider name picks the cheapest provider with spare
 * capacity; price ties go to the provider declared first.
 * <p>
 * One manager owns its providers; pass it explicitly to the code that needs endpoints.
 */
@Slf4j
public class ProxyManager {

    private static final Comparator<ProviderSlot> CHEAPEST_FIRST =
            Comparator.comparingDouble((ProviderSlot slot) -> slot.config().pricePerGb())
                    .thenComparingInt(ProviderSlot::order);

    private final Map<String, ProviderSlot> slots;
    private final List<ProviderSlot> selectionOrder;
    private final ProxyMeter meter;

    /**
     * Builds providers from descriptors with metering enabled.
     */
    public ProxyManager(List<ProviderConfig> configs) {
        this(configs, true);
    }

    public ProxyManager(List<ProviderConfig> configs, boolean meteringEnabled) {
        this(configs, meteringEnabled ? new ProxyMeter() : null);
    }

    /**
     * @param configs Provider descriptors in declaration order
     * @param meter   Meter to report to, or null to disable metering
     */
    public ProxyManager(List<ProviderConfig> configs, ProxyMeter meter) {
        this(configs, meter, ProxyProviderFactory::create);
    }

    ProxyManager(List<ProviderConfig> configs, ProxyMeter meter, Function<ProviderConfig, ProxyProvider> providerFactory) {
        Objects.requireNonNull(configs, "configs must not be null");
        Objects.requireNonNull(providerFactory, "providerFactory must not be null");
        this.meter = meter;

        Map<String, ProviderSlot> built = new LinkedHashMap<>();
        int order = 0;
        for (ProviderConfig config : configs) {
            if (built.containsKey(config.name())) {
                throw new ProxyConfigurationException("Duplicate provider name: " + config.name());
            }
            built.put(config.name(), new ProviderSlot(providerFactory.apply(config), order++));
            if (meter != null) {
                meter.registerProviderPrice(config.name(), config.pricePerGb());
            }
        }
        this.slots = Collections.unmodifiableMap(built);

        List<ProviderSlot> ordered = new ArrayList<>(built.values());
        ordered.sort(CHEAPEST_FIRST);
        this.selectionOrder = List.copyOf(ordered);

        log.info("Proxy manager initialized. providers={}, metering={}", slots.keySet(), meter != null);
    }

    public ProxyEndpoint acquire() {
        return acquire(null, null, null);
    }

    /**
     * Acquires an endpoint.
     *
     * @param name    Provider name, or null to auto-select the cheapest provider with capacity
     * @param region  Optional region code passed to the provider
     * @param purpose Optional purpose tag, recorded by the meter
     * @throws IllegalArgumentException     if {@code name} is not a configured provider
     * @throws ConcurrencyLimitException    if the named provider is at its limit
     * @throws NoProviderAvailableException if auto-selection finds no provider with capacity
     */
    public ProxyEndpoint acquire(String name, String region, String purpose) {
        ProxyEndpoint endpoint = name != null ? acquireNamed(name, region, purpose) : acquireCheapest(region, purpose);
        if (meter != null) {
            meter.recordAcquire(endpoint, purpose);
        }
        return endpoint;
    }

    public void release(ProxyEndpoint endpoint) {
        release(endpoint, null);
    }

    /**
     * Returns an endpoint's admission slot. Releasing an endpoint that holds no slot (double release,
     * unknown provider) is logged and otherwise ignored.
     */
    public void release(ProxyEndpoint endpoint, String reason) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        ProviderSlot slot = endpoint.provider() == null ? null : slots.get(endpoint.provider());
        if (slot == null) {
            log.warn("Release for endpoint of unknown provider ignored. provider={}, endpoint={}",
                    endpoint.provider(), endpoint.address());
        } else if (!slot.release(endpoint.key())) {
            log.warn("Duplicate release ignored. provider={}, key={}, reason={}", slot.config().name(), endpoint.key(), reason);
        } else {
            log.debug("Proxy slot released. provider={}, active={}, reason={}", slot.config().name(), slot.active(), reason);
        }
        if (meter != null) {
            meter.recordRelease(endpoint, reason);
        }
    }

    /**
     * Reports one request made through an endpoint to the meter; no-op when metering is disabled.
     */
    public void recordRequest(ProxyEndpoint endpoint, long bytesSent, long bytesReceived, boolean success) {
        if (meter != null) {
            meter.recordRequest(endpoint, bytesSent, bytesReceived, success);
        }
    }

    public ManagerStats getStats() {
        Map<String, ProviderStats> providers = new LinkedHashMap<>();
        for (ProviderSlot slot : slots.values()) {
            providers.put(slot.config().name(), slot.stats());
        }
        return new ManagerStats(Collections.unmodifiableMap(providers), meter == null ? null : meter.getSummary());
    }

    public int activeCount(String name) {
        return requireSlot(name).active();
    }

    public ProxyProvider getProvider(String name) {
        return requireSlot(name).provider();
    }

    public List<String> providerNames() {
        return List.copyOf(slots.keySet());
    }

    /**
     * @return the meter, or empty when metering is disabled
     */
    public Optional<ProxyMeter> meter() {
        return Optional.ofNullable(meter);
    }

    private ProxyEndpoint acquireNamed(String name, String region, String purpose) {
        ProviderSlot slot = requireSlot(name);
        ProxyEndpoint endpoint = slot.tryAcquire(region, purpose).orElseThrow(() -> {
            log.warn("Concurrency limit reached. provider={}, limit={}", name, slot.config().concurrencyLimit());
            return new ConcurrencyLimitException(name, slot.config().concurrencyLimit());
        });
        log.debug("Proxy acquired. provider={}, endpoint={}, active={}", name, endpoint.address(), slot.active());
        return endpoint;
    }

    private ProxyEndpoint acquireCheapest(String region, String purpose) {
        for (ProviderSlot slot : selectionOrder) {
            Optional<ProxyEndpoint> endpoint = slot.tryAcquire(region, purpose);
            if (endpoint.isPresent()) {
                log.debug("Proxy auto-selected. provider={}, pricePerGb={}, endpoint={}",
                        slot.config().name(), slot.config().pricePerGb(), endpoint.get().address());
                return endpoint.get();
            }
            log.debug("Provider full, trying next candidate. provider={}", slot.config().name());
        }
        List<String> candidates = selectionOrder.stream().map(slot -> slot.config().name()).toList();
        log.warn("No proxy provider available. candidates={}", candidates);
        throw new NoProviderAvailableException(candidates);
    }

    private ProviderSlot requireSlot(String name) {
        ProviderSlot slot = slots.get(name);
        if (slot == null) {
            throw new IllegalArgumentException("Proxy provider not found: " + name);
        }
        return slot;
    }
}
