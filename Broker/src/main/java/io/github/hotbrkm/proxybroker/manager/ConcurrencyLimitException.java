package io.github.hotbrkm.proxybroker.manager;

import lombok.Getter;

/**
 * The requested provider is already at its concurrency limit. No state was changed.
 */
@Getter
public class ConcurrencyLimitException extends RuntimeException {
    private final String providerName;
    private final int limit;

    public ConcurrencyLimitException(String providerName, int limit) {
        super("Proxy provider " + providerName + " is at its concurrency limit (" + limit + ")");
        this.providerName = providerName;
        this.limit = limit;
    }
}
