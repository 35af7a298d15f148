package io.github.hotbrkm.proxybroker.importer;

import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;

import java.util.List;

/**
 * Outcome of a batch import.
 *
 * @param endpoints Endpoints built from accepted lines, in input order
 * @param rejected  Lines that could not be parsed
 */
public record ImportResult(List<ProxyEndpoint> endpoints, List<RejectedLine> rejected) {

    public ImportResult {
        endpoints = List.copyOf(endpoints);
        rejected = List.copyOf(rejected);
    }

    /**
     * @param lineNumber 1-based position among the non-comment input lines
     * @param line       Raw line content
     */
    public record RejectedLine(int lineNumber, String line) {
    }
}
