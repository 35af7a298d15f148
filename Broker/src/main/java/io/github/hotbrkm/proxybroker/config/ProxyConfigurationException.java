package io.github.hotbrkm.proxybroker.config;

/**
 * Raised while loading provider configuration: malformed descriptor, unresolved secret
 * reference or an empty static pool.
 * <p>
 * Configuration problems always surface at load time, never at acquisition time.
 */
public class ProxyConfigurationException extends RuntimeException {
    public ProxyConfigurationException(String message) {
        super(message);
    }

    public ProxyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
