package io.github.hotbrkm.proxybroker.provider;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.config.ProviderType;
import io.github.hotbrkm.proxybroker.config.ProxyConfigurationException;
import io.github.hotbrkm.proxybroker.endpoint.IpVersion;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import io.github.hotbrkm.proxybroker.endpoint.RotationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StaticListProvider")
class StaticListProviderTest {

    @Nested
    @DisplayName("Parsing entries")
    class Parsing {

        @Test
        @DisplayName("Should parse every supported entry form with provider defaults")
        void testParseEntries() {
            StaticListProvider provider = provider(Map.of("entries",
                    "1.2.3.4:8000, user:pass@5.6.7.8:9000\nsocks5://u:p@9.9.9.9:1080"));

            List<ProxyEndpoint> entries = provider.entries();
            assertThat(entries).hasSize(3);
            assertThat(entries.get(0).hasCredentials()).isFalse();
            assertThat(entries.get(1).username()).isEqualTo("user");
            assertThat(entries.get(2).scheme()).isEqualTo("socks5");
            assertThat(entries).allSatisfy(endpoint -> {
                assertThat(endpoint.provider()).isEqualTo("static");
                assertThat(endpoint.proxyType()).isEqualTo(ProxyType.DATACENTER);
                assertThat(endpoint.ipVersion()).isEqualTo(IpVersion.IPV4);
                assertThat(endpoint.rotationType()).isEqualTo(RotationType.STICKY);
                assertThat(endpoint.session()).isNull();
            });
        }

        @Test
        @DisplayName("Should apply configured type, version and region")
        void testOptionOverrides() {
            StaticListProvider provider = provider(Map.of("entries", "1.2.3.4:8000", "proxy_type", "isp",
                    "ip_version", "ipv6", "rotation_type", "rotating", "region", "DE", "scheme", "https"));

            ProxyEndpoint endpoint = provider.acquire(null, null);
            assertThat(endpoint.proxyType()).isEqualTo(ProxyType.ISP);
            assertThat(endpoint.ipVersion()).isEqualTo(IpVersion.IPV6);
            assertThat(endpoint.rotationType()).isEqualTo(RotationType.ROTATING);
            assertThat(endpoint.region()).isEqualTo("DE");
            assertThat(endpoint.scheme()).isEqualTo("https");
        }

        @Test
        @DisplayName("Should fail on an empty pool or a malformed entry")
        void testRejectsBadPools() {
            assertThatThrownBy(() -> provider(Map.of()))
                    .isInstanceOf(ProxyConfigurationException.class);
            assertThatThrownBy(() -> provider(Map.of("entries", " , \n ")))
                    .isInstanceOf(ProxyConfigurationException.class);
            assertThatThrownBy(() -> provider(Map.of("entries", "1.2.3.4:8000, not-a-proxy")))
                    .isInstanceOf(ProxyConfigurationException.class)
                    .hasMessageContaining("malformed");
            assertThatThrownBy(() -> provider(Map.of("entries", "1.2.3.4:8000", "proxy_type", "satellite")))
                    .isInstanceOf(ProxyConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Round-robin")
    class RoundRobin {

        @Test
        @DisplayName("Should cycle entries in order and wrap around")
        void testCycle() {
            StaticListProvider provider = provider(Map.of("entries", "1.1.1.1:1, 2.2.2.2:2, 3.3.3.3:3"));

            List<String> hosts = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                hosts.add(provider.acquire(null, null).host());
            }

            assertThat(hosts).containsExactly("1.1.1.1", "2.2.2.2", "3.3.3.3", "1.1.1.1", "2.2.2.2", "3.3.3.3", "1.1.1.1");
            assertThat(provider.position()).isEqualTo(7);
        }

        @Test
        @DisplayName("Should ignore the region argument")
        void testIgnoresRegion() {
            StaticListProvider provider = provider(Map.of("entries", "1.1.1.1:1"));

            assertThat(provider.acquire("FR", "scrape").region()).isNull();
        }

        @Test
        @DisplayName("Concurrent acquisitions should each receive a distinct slot before the pool wraps")
        void testConcurrentAcquireDistinct() throws Exception {
            int size = 200;
            List<String> lines = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                lines.add("10.0." + (i / 250) + "." + (i % 250) + ":" + (1000 + i));
            }
            StaticListProvider provider = provider(Map.of("entries", String.join("\n", lines)));

            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            Map<Integer, Boolean> seenPorts = new ConcurrentHashMap<>();
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < size; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        ProxyEndpoint endpoint = provider.acquire(null, null);
                        assertThat(seenPorts.putIfAbsent(endpoint.port(), Boolean.TRUE)).isNull();
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(seenPorts).hasSize(size);
            assertThat(provider.position()).isEqualTo(size);
        }
    }

    private static StaticListProvider provider(Map<String, String> options) {
        return new StaticListProvider(new ProviderConfig("static", ProviderType.STATIC_LIST, 0.0, 0, options));
    }
}
