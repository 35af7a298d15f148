package io.github.hotbrkm.proxybroker.provider;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;

/**
 * Source of proxy endpoints implementing one acquisition strategy.
 * <p>
 * Implementations must be thread-safe; any cursor or session state is private to the instance.
 * Admission control is not the provider's concern, it is enforced by the manager.
 */
public interface ProxyProvider {

    ProviderConfig config();

    default String name() {
        return config().name();
    }

    /**
     * Produces an endpoint.
     *
     * @param region  Optional region/country code; providers without targeting ignore it
     * @param purpose Optional free-form purpose tag, recorded in metadata where supported
     * @return A new or pooled endpoint
     * @throws ProviderGenerationException if the endpoint cannot be synthesized
     */
    ProxyEndpoint acquire(String region, String purpose);
}
