package io.github.hotbrkm.proxybroker.endpoint;

import java.util.Locale;

public enum IpVersion {
    IPV4, IPV6;

    /**
     * Accepts "ipv4"/"ipv6" as well as the short forms "v4"/"v6".
     */
    public static IpVersion of(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("V")) {
            normalized = "IP" + normalized;
        }
        return valueOf(normalized);
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
