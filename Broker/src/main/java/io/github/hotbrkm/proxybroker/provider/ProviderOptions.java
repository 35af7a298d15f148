package io.github.hotbrkm.proxybroker.provider;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.config.ProxyConfigurationException;
import io.github.hotbrkm.proxybroker.endpoint.IpVersion;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import io.github.hotbrkm.proxybroker.endpoint.RotationType;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Typed reads of provider options. Invalid values fail with {@link ProxyConfigurationException}.
 */
@UtilityClass
class ProviderOptions {

    ProxyType proxyType(ProviderConfig config, ProxyType defaultValue) {
        return parse(config, "proxy_type", defaultValue, ProxyType::of);
    }

    IpVersion ipVersion(ProviderConfig config) {
        return parse(config, "ip_version", IpVersion.IPV4, IpVersion::of);
    }

    RotationType rotationType(ProviderConfig config, RotationType defaultValue) {
        return parse(config, "rotation_type", defaultValue, RotationType::of);
    }

    int port(ProviderConfig config, String defaultValue) {
        String raw = config.option("port", defaultValue);
        if (raw == null) {
            throw new ProxyConfigurationException("Provider " + config.name() + " requires option 'port'");
        }
        try {
            int port = Integer.parseInt(raw.trim());
            if (port <= 0 || port > 65_535) {
                throw new ProxyConfigurationException("Provider " + config.name() + " has port out of range: " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new ProxyConfigurationException("Provider " + config.name() + " has invalid port: " + raw, e);
        }
    }

    String required(ProviderConfig config, String key) {
        String value = config.option(key);
        if (value == null || value.isBlank()) {
            throw new ProxyConfigurationException("Provider " + config.name() + " requires option '" + key + "'");
        }
        return value;
    }

    /**
     * Splits a comma or newline separated entry list, dropping blanks.
     */
    List<String> entries(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.replace(',', '\n').split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    private <T> T parse(ProviderConfig config, String key, T defaultValue, Function<String, T> parser) {
        String raw = config.option(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new ProxyConfigurationException("Provider " + config.name() + " has invalid " + key + ": " + raw, e);
        }
    }
}
