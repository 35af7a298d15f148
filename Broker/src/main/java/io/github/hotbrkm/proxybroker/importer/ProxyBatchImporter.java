package io.github.hotbrkm.proxybroker.importer;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.config.ProviderType;
import io.github.hotbrkm.proxybroker.config.ProxyConfigurationException;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Imports proxy lists in mixed formats and turns them into endpoints or a {@code static_list}
 * provider descriptor.
 */
@Slf4j
public class ProxyBatchImporter {

    public static final String DEFAULT_PROVIDER_NAME = "auto-imported";

    private final ProxyLineDetector detector;

    public ProxyBatchImporter() {
        this(new ProxyLineDetector());
    }

    public ProxyBatchImporter(ProxyLineDetector detector) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
    }

    public ImportResult importLines(List<String> lines) {
        return importLines(lines, DEFAULT_PROVIDER_NAME, null);
    }

    /**
     * Imports lines, skipping blanks and {@code #} comments.
     *
     * @param lines        Raw proxy lines
     * @param providerName Provider name for lines whose vendor is not recognised
     * @param typeOverride Network class forced on every endpoint, or null to use detection
     */
    public ImportResult importLines(List<String> lines, String providerName, ProxyType typeOverride) {
        Objects.requireNonNull(lines, "lines must not be null");
        Objects.requireNonNull(providerName, "providerName must not be null");

        List<ProxyEndpoint> endpoints = new ArrayList<>();
        List<ImportResult.RejectedLine> rejected = new ArrayList<>();
        int index = 0;
        for (String raw : lines) {
            if (raw == null || raw.isBlank() || raw.trim().startsWith("#")) {
                continue;
            }
            index++;
            Optional<DetectedProxy> detected = detector.parse(raw);
            if (detected.isPresent()) {
                endpoints.add(detected.get().toEndpoint(providerName, typeOverride, index));
            } else {
                log.warn("Skipped invalid proxy line. index={}", index);
                rejected.add(new ImportResult.RejectedLine(index, raw.trim()));
            }
        }
        log.info("Imported proxies. accepted={}/{}, rejected={}", endpoints.size(), index, rejected.size());
        return new ImportResult(endpoints, rejected);
    }

    /**
     * Reads one proxy line per row from a UTF-8 file.
     *
     * @throws ProxyConfigurationException if the file cannot be read
     */
    public ImportResult importFile(Path path, String providerName, ProxyType typeOverride) {
        Objects.requireNonNull(path, "path must not be null");
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProxyConfigurationException("Failed to read proxy list: " + path, e);
        }
        log.info("Read proxy list. path={}, lines={}", path, lines.size());
        return importLines(lines, providerName, typeOverride);
    }

    public ImportResult importFile(Path path) {
        return importFile(path, DEFAULT_PROVIDER_NAME, null);
    }

    /**
     * Builds a {@code static_list} descriptor serving the given endpoints. Proxy type, IP version
     * and region come from the first endpoint.
     * <p>
     * Only the connection part of each endpoint is written, so the detected {@code session} is not
     * carried over: endpoints served from the descriptor have no session, and imported lines that
     * differ only in credentials (for example several vendor sessions on one gateway host and port)
     * share one identity for admission counting and metering.
     *
     * @throws ProxyConfigurationException if {@code endpoints} is empty
     */
    public ProviderConfig toStaticListConfig(String name, double pricePerGb, int concurrencyLimit,
                                             List<ProxyEndpoint> endpoints) {
        Objects.requireNonNull(endpoints, "endpoints must not be null");
        if (endpoints.isEmpty()) {
            throw new ProxyConfigurationException("Cannot build provider " + name + " from an empty proxy list");
        }
        ProxyEndpoint first = endpoints.get(0);
        Map<String, String> options = new LinkedHashMap<>();
        options.put("entries", endpoints.stream().map(ProxyBatchImporter::toEntry).collect(Collectors.joining("\n")));
        options.put("proxy_type", first.proxyType().value());
        options.put("ip_version", first.ipVersion().value());
        if (first.rotationType() != null) {
            options.put("rotation_type", first.rotationType().value());
        }
        if (first.region() != null) {
            options.put("region", first.region());
        }
        ProviderConfig config = new ProviderConfig(name, ProviderType.STATIC_LIST, pricePerGb, concurrencyLimit, options);
        log.info("Created provider descriptor from imported proxies. name={}, entries={}", name, endpoints.size());
        return config;
    }

    // user:pass@host:port keeps passwords with colons intact; the parser splits on the last '@'
    static String toEntry(ProxyEndpoint endpoint) {
        String host = endpoint.host().indexOf(':') >= 0 ? "[" + endpoint.host() + "]" : endpoint.host();
        StringBuilder sb = new StringBuilder(endpoint.scheme()).append("://");
        if (endpoint.username() != null) {
            sb.append(endpoint.username());
            if (endpoint.password() != null) {
                sb.append(':').append(endpoint.password());
            }
            sb.append('@');
        }
        return sb.append(host).append(':').append(endpoint.port()).toString();
    }
}
