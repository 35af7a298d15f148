package io.github.hotbrkm.proxybroker.tester;

import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;

import java.time.Instant;

/**
 * Outcome of probing one endpoint.
 *
 * @param endpoint       Endpoint under test
 * @param success        Whether the echo URL answered 200 through the endpoint
 * @param responseTimeMs Round-trip time, null if no response arrived
 * @param statusCode     HTTP status, null if no response arrived
 * @param egressIp       Address reported by the echo service, null on failure or unparsable body
 * @param errorType      Failure class, null on success
 * @param error          Failure detail, null on success
 * @param testUrl        URL probed
 * @param testedAt       Time the probe finished
 */
public record ProxyTestResult(ProxyEndpoint endpoint, boolean success, Double responseTimeMs, Integer statusCode,
                              String egressIp, TestErrorType errorType, String error, String testUrl, Instant testedAt) {

    static ProxyTestResult success(ProxyEndpoint endpoint, double responseTimeMs, int statusCode, String egressIp,
                                   String testUrl, Instant testedAt) {
        return new ProxyTestResult(endpoint, true, responseTimeMs, statusCode, egressIp, null, null, testUrl, testedAt);
    }

    static ProxyTestResult failure(ProxyEndpoint endpoint, Double responseTimeMs, Integer statusCode, TestErrorType errorType,
                                   String error, String testUrl, Instant testedAt) {
        return new ProxyTestResult(endpoint, false, responseTimeMs, statusCode, null, errorType, error, testUrl, testedAt);
    }
}
