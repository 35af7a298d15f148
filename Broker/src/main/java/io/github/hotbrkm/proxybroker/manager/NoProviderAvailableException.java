package io.github.hotbrkm.proxybroker.manager;

import lombok.Getter;

import java.util.List;

/**
 * Auto-selection found no provider with spare capacity.
 */
@Getter
public class NoProviderAvailableException extends RuntimeException {
    private final List<String> candidates;

    public NoProviderAvailableException(List<String> candidates) {
        super(candidates.isEmpty()
                ? "No proxy providers configured"
                : "No proxy provider has spare capacity: " + candidates);
        this.candidates = List.copyOf(candidates);
    }
}
