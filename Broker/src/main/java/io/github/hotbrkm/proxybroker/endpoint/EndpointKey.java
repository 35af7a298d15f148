package io.github.hotbrkm.proxybroker.endpoint;

import java.util.Objects;

/**
 * Identity of an endpoint for concurrency accounting and metering.
 * <p>
 * A missing session is normalized to an empty string so that session-less endpoints
 * of the same provider/host/port share one key.
 */
public record EndpointKey(String provider, String host, int port, String session) {

    public EndpointKey {
        Objects.requireNonNull(host, "host must not be null");
        provider = provider == null ? "" : provider;
        session = session == null ? "" : session;
    }

    @Override
    public String toString() {
        return session.isEmpty()
                ? provider + ":" + host + ":" + port
                : provider + ":" + host + ":" + port + ":" + session;
    }
}
