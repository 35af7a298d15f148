package io.github.hotbrkm.proxybroker.config;

import java.util.Map;

/**
 * Immutable descriptor of one configured provider. Secret references in {@code options}
 * have already been resolved by {@link ProviderConfigLoader}.
 *
 * @param name             Unique provider name
 * @param type             Provider kind
 * @param pricePerGb       Price per GiB transferred, used for cost estimates and cheapest-first selection
 * @param concurrencyLimit Maximum concurrently active endpoints; {@link #UNLIMITED} for no limit
 * @param options          Provider specific options
 */
public record ProviderConfig(String name, ProviderType type, double pricePerGb, int concurrencyLimit,
                             Map<String, String> options) {

    public static final int UNLIMITED = 0;

    public ProviderConfig {
        if (name == null || name.isBlank()) {
            throw new ProxyConfigurationException("Provider name must not be blank");
        }
        if (type == null) {
            throw new ProxyConfigurationException("Provider type must not be null: " + name);
        }
        if (Double.isNaN(pricePerGb) || pricePerGb < 0) {
            throw new ProxyConfigurationException("price_per_gb must be >= 0 for provider " + name + ": " + pricePerGb);
        }
        if (concurrencyLimit < 0) {
            throw new ProxyConfigurationException("concurrency_limit must be >= 0 for provider " + name + ": " + concurrencyLimit);
        }
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public boolean isUnlimited() {
        return concurrencyLimit == UNLIMITED;
    }

    public String option(String key) {
        return options.get(key);
    }

    public String option(String key, String defaultValue) {
        String value = options.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    @Override
    public String toString() {
        // options may hold resolved secrets
        return "ProviderConfig[name=" + name + ", type=" + type.tag() + ", pricePerGb=" + pricePerGb
                + ", concurrencyLimit=" + (isUnlimited() ? "unlimited" : concurrencyLimit)
                + ", options=" + options.keySet() + "]";
    }
}
