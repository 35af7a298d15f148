package io.github.hotbrkm.proxybroker.provider;

import lombok.Getter;

/**
 * A provider failed to synthesize a valid endpoint, e.g. a malformed pre-generated session string.
 */
@Getter
public class ProviderGenerationException extends RuntimeException {
    private final String providerName;

    public ProviderGenerationException(String providerName, String message) {
        super("Provider " + providerName + ": " + message);
        this.providerName = providerName;
    }

    public ProviderGenerationException(String providerName, String message, Throwable cause) {
        super("Provider " + providerName + ": " + message, cause);
        this.providerName = providerName;
    }
}
