package io.github.hotbrkm.proxybroker.provider;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Builds the provider implementation matching a descriptor's type.
 */
@UtilityClass
public class ProxyProviderFactory {

    public static ProxyProvider create(ProviderConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return switch (config.type()) {
            case STATIC_LIST -> new StaticListProvider(config);
            case BRIGHTDATA -> new BrightDataProvider(config);
            case MOOPROXY -> new MooProxyProvider(config);
        };
    }
}
