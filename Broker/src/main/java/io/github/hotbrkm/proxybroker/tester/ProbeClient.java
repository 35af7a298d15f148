package io.github.hotbrkm.proxybroker.tester;

import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;

import java.time.Duration;

/**
 * Issues a single GET request through a proxy endpoint.
 */
@FunctionalInterface
public interface ProbeClient {

    /**
     * Performs the request. Implementations must give up once {@code timeout} has elapsed.
     *
     * @param endpoint Endpoint to route through
     * @param url      Target URL
     * @param timeout  Deadline for connect plus response
     * @return Status code and body
     * @throws Exception on any network or proxy failure; the caller classifies it
     */
    ProbeResponse get(ProxyEndpoint endpoint, String url, Duration timeout) throws Exception;
}
