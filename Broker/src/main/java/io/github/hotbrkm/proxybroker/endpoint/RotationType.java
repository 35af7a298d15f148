package io.github.hotbrkm.proxybroker.endpoint;

import java.util.Locale;

/**
 * ROTATING endpoints may change egress IP per request; STICKY ones keep it for the session.
 */
public enum RotationType {
    ROTATING, STICKY;

    public static RotationType of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
