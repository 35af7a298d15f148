package io.github.hotbrkm.proxybroker.manager;

/**
 * Admission state of one provider.
 *
 * @param name       Provider name
 * @param type       Provider type tag
 * @param active     Currently active endpoints
 * @param limit      Concurrency limit, 0 when unlimited
 * @param pricePerGb Configured price per GiB
 */
public record ProviderStats(String name, String type, int active, int limit, double pricePerGb) {

    public boolean isUnlimited() {
        return limit == 0;
    }
}
