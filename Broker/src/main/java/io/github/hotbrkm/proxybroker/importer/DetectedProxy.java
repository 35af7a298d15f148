package io.github.hotbrkm.proxybroker.importer;

import io.github.hotbrkm.proxybroker.endpoint.IpVersion;
import io.github.hotbrkm.proxybroker.endpoint.ProxyAddress;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import io.github.hotbrkm.proxybroker.endpoint.RotationType;

import java.util.Map;

/**
 * A parsed proxy line together with the attributes inferred from it.
 *
 * @param address      Connection part of the line
 * @param provider     Recognised vendor tag, or null if unknown
 * @param proxyType    Inferred network class
 * @param ipVersion    Inferred IP version
 * @param rotationType Inferred rotation behaviour
 * @param session      Session id embedded in the password, or null
 * @param region       Country code embedded in the password, or null
 */
public record DetectedProxy(ProxyAddress address, String provider, ProxyType proxyType, IpVersion ipVersion,
                            RotationType rotationType, String session, String region) {

    public boolean providerRecognised() {
        return provider != null;
    }

    /**
     * Builds an endpoint attributed to the detected vendor, or to {@code fallbackProvider} when none was recognised.
     */
    public ProxyEndpoint toEndpoint(String fallbackProvider, ProxyType typeOverride, int batchIndex) {
        return ProxyEndpoint.builder()
                .scheme(address.scheme())
                .host(address.host())
                .port(address.port())
                .username(address.username())
                .password(address.password())
                .provider(provider != null ? provider : fallbackProvider)
                .session(session)
                .proxyType(typeOverride != null ? typeOverride : proxyType)
                .ipVersion(ipVersion)
                .rotationType(rotationType)
                .region(region)
                .metadata(Map.of("kind", "imported",
                        "confidence", providerRecognised() ? "high" : "low",
                        "batch_index", String.valueOf(batchIndex)))
                .build();
    }
}
