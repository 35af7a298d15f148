package io.github.hotbrkm.proxybroker.importer;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.config.ProviderType;
import io.github.hotbrkm.proxybroker.config.ProxyConfigurationException;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import io.github.hotbrkm.proxybroker.manager.ProxyManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProxyBatchImporter")
class ProxyBatchImporterTest {

    private final ProxyBatchImporter importer = new ProxyBatchImporter();

    @Test
    @DisplayName("Should import valid lines, skip comments and report rejected ones")
    void testImportLines() {
        ImportResult result = importer.importLines(List.of(
                "# exported list",
                "1.2.3.4:8000",
                "",
                "garbage",
                "gw.mooproxy.net:7777:alice:pw_country-DE_session-s1"), "my-list", null);

        assertThat(result.endpoints()).hasSize(2);
        assertThat(result.endpoints().get(0).provider()).isEqualTo("my-list");
        assertThat(result.endpoints().get(0).metadata()).containsEntry("confidence", "low").containsEntry("batch_index", "1");
        ProxyEndpoint moo = result.endpoints().get(1);
        assertThat(moo.provider()).isEqualTo("mooproxy");
        assertThat(moo.session()).isEqualTo("s1");
        assertThat(moo.region()).isEqualTo("DE");
        assertThat(result.rejected()).containsExactly(new ImportResult.RejectedLine(2, "garbage"));
    }

    @Test
    @DisplayName("A type override should win over detection")
    void testTypeOverride() {
        ImportResult result = importer.importLines(List.of("resi.example.com:8000"), "x", ProxyType.ISP);

        assertThat(result.endpoints().get(0).proxyType()).isEqualTo(ProxyType.ISP);
    }

    @Test
    @DisplayName("Should import a file and fail clearly when it is missing")
    void testImportFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("proxies.txt");
        Files.writeString(file, "1.1.1.1:80\nu:p@2.2.2.2:81\n");

        assertThat(importer.importFile(file).endpoints()).hasSize(2);
        assertThatThrownBy(() -> importer.importFile(dir.resolve("missing.txt")))
                .isInstanceOf(ProxyConfigurationException.class);
    }

    @Test
    @DisplayName("Imported endpoints should round-trip through a static list provider")
    void testToStaticListConfig() {
        List<ProxyEndpoint> endpoints = importer.importLines(List.of(
                "10.0.0.1:8000:bob:pa:ss@word",
                "[2001:db8::5]:3128",
                "socks5://carol:pw@10.0.0.3:1080")).endpoints();

        ProviderConfig config = importer.toStaticListConfig("imported", 1.5, 2, endpoints);
        ProxyManager manager = new ProxyManager(List.of(config));

        assertThat(config.type()).isEqualTo(ProviderType.STATIC_LIST);
        ProxyEndpoint first = manager.acquire("imported", null, null);
        ProxyEndpoint second = manager.acquire("imported", null, null);
        manager.release(first);
        manager.release(second);
        ProxyEndpoint third = manager.acquire("imported", null, null);

        assertThat(first.username()).isEqualTo("bob");
        assertThat(first.password()).isEqualTo("pa:ss@word");
        assertThat(second.host()).isEqualTo("2001:db8::5");
        assertThat(third.scheme()).isEqualTo("socks5");
        assertThat(third.password()).isEqualTo("pw");
    }

    @Test
    @DisplayName("Static list endpoints should drop detected sessions and keep them only in the credentials")
    void testStaticListDropsSessions() {
        List<ProxyEndpoint> endpoints = importer.importLines(List.of(
                "gw.mooproxy.net:7777:alice:pw_country-US_session-aaa1",
                "gw.mooproxy.net:7777:alice:pw_country-US_session-bbb2")).endpoints();

        assertThat(endpoints).extracting(ProxyEndpoint::session).containsExactly("aaa1", "bbb2");
        assertThat(endpoints.get(0).key()).isNotEqualTo(endpoints.get(1).key());

        ProxyManager manager = new ProxyManager(List.of(importer.toStaticListConfig("moo-import", 0.0, 0, endpoints)));
        ProxyEndpoint first = manager.acquire("moo-import", null, null);
        ProxyEndpoint second = manager.acquire("moo-import", null, null);

        assertThat(first.session()).isNull();
        assertThat(second.session()).isNull();
        assertThat(first.key()).isEqualTo(second.key());
        assertThat(first.password()).endsWith("session-aaa1");
        assertThat(second.password()).endsWith("session-bbb2");
    }

    @Test
    @DisplayName("An empty import cannot become a provider")
    void testEmptyConfig() {
        assertThatThrownBy(() -> importer.toStaticListConfig("x", 0.0, 0, List.of()))
                .isInstanceOf(ProxyConfigurationException.class);
    }
}
