package io.github.hotbrkm.proxybroker.config;

import java.util.Locale;

/**
 * Provider kinds that can be declared in configuration.
 */
public enum ProviderType {
    /** Round-robin over a fixed pool of endpoints. */
    STATIC_LIST("static_list"),
    /** Fixed gateway with a fresh session token embedded in the username per acquisition. */
    BRIGHTDATA("brightdata"),
    /** Pre-generated session strings, or a session suffix synthesized into the password. */
    MOOPROXY("mooproxy");

    private final String tag;

    ProviderType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ProviderType fromTag(String tag) {
        if (tag == null) {
            throw new ProxyConfigurationException("Provider type is missing");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        throw new ProxyConfigurationException("Unknown proxy provider type: " + tag);
    }
}
