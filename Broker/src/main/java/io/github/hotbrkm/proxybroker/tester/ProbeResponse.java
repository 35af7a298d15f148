package io.github.hotbrkm.proxybroker.tester;

/**
 * Response of an IP-echo request made through a proxy.
 */
public record ProbeResponse(int statusCode, String body) {
}
