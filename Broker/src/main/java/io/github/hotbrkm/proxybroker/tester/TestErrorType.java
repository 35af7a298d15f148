package io.github.hotbrkm.proxybroker.tester;

/**
 * Classification of a failed endpoint probe.
 */
public enum TestErrorType {
    /** Connect, read or overall probe deadline exceeded. */
    TIMEOUT,
    /** Proxy rejected the credentials (HTTP 407 or SOCKS authentication failure). */
    AUTH,
    /** Proxy unreachable, refused, reset or closed the connection. */
    CONNECTION,
    UNKNOWN
}
