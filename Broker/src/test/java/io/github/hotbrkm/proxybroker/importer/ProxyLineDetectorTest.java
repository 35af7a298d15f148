package io.github.hotbrkm.proxybroker.importer;

import io.github.hotbrkm.proxybroker.endpoint.IpVersion;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import io.github.hotbrkm.proxybroker.endpoint.RotationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProxyLineDetector")
class ProxyLineDetectorTest {

    private final ProxyLineDetector detector = new ProxyLineDetector();

    @Test
    @DisplayName("Should detect MooProxy session and region from the password")
    void testMooProxyLine() {
        DetectedProxy detected = detector.parse("gw.mooproxy.net:7777:alice:pw_country-US_session-Ab12_x").orElseThrow();

        assertThat(detected.provider()).isEqualTo("mooproxy");
        assertThat(detected.session()).isEqualTo("Ab12_x");
        assertThat(detected.region()).isEqualTo("US");
        assertThat(detected.rotationType()).isEqualTo(RotationType.STICKY);
        assertThat(detected.address().username()).isEqualTo("alice");
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "user:pass@zproxy.lum-superproxy.io:22225, brightdata",
            "http://u:p@gate.smartproxy.com:7000, smartproxy",
            "pr.oxylabs.io:7777:u:p, oxylabs",
            "geo.iproyal.com:12321:u:p, iproyal"
    })
    @DisplayName("Should recognise vendors by host")
    void testVendors(String line, String provider) {
        assertThat(detector.parse(line).orElseThrow().provider()).isEqualTo(provider);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "resi.example.com:8000, RESIDENTIAL",
            "isp-pool.example.com:8000, ISP",
            "mobile.example.com:8000, MOBILE",
            "dc1.example.com:8000:u:pass-4g, MOBILE",
            "203.0.113.9:3128, DATACENTER"
    })
    @DisplayName("Should infer the network class from keywords")
    void testProxyType(String line, ProxyType expected) {
        assertThat(detector.parse(line).orElseThrow().proxyType()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should detect IPv6 hosts")
    void testIpv6() {
        assertThat(detector.parse("[2001:db8::2]:8080").orElseThrow().ipVersion()).isEqualTo(IpVersion.IPV6);
        assertThat(detector.parse("1.2.3.4:8080").orElseThrow().ipVersion()).isEqualTo(IpVersion.IPV4);
    }

    @Test
    @DisplayName("Unknown vendors and unparsable lines")
    void testUnknownAndInvalid() {
        DetectedProxy plain = detector.parse("1.2.3.4:8080").orElseThrow();

        assertThat(plain.providerRecognised()).isFalse();
        assertThat(plain.session()).isNull();
        assertThat(detector.parse("not a proxy")).isEmpty();
        assertThat(detector.parse("host:99999")).isEmpty();
    }
}
