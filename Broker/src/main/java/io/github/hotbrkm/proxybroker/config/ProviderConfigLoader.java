package io.github.hotbrkm.proxybroker.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads provider descriptors from JSON.
 * <p>
 * Accepted shapes are a top-level array of descriptors or an object with a {@code providers} array:
 * <pre>
 * {"providers": [
 *   {"name": "static-us", "type": "static_list", "price_per_gb": 0.0,
 *    "options": {"entries": "user:pass@1.2.3.4:8000, 5.6.7.8:9000"}},
 *   {"name": "brightdata-resi", "type": "brightdata", "price_per_gb": 12.0, "concurrency_limit": 100,
 *    "options": {"username": "env:BRIGHTDATA_USERNAME", "password": "env:BRIGHTDATA_PASSWORD"}}
 * ]}
 * </pre>
 * Declaration order is preserved; it breaks price ties during provider auto-selection.
 */
@Slf4j
public class ProviderConfigLoader {

    private final ObjectMapper objectMapper;
    private final SecretResolver secretResolver;

    public ProviderConfigLoader() {
        this(new ObjectMapper(), new SecretResolver());
    }

    public ProviderConfigLoader(SecretResolver secretResolver) {
        this(new ObjectMapper(), secretResolver);
    }

    public ProviderConfigLoader(ObjectMapper objectMapper, SecretResolver secretResolver) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.secretResolver = Objects.requireNonNull(secretResolver, "secretResolver must not be null");
    }

    public List<ProviderConfig> load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try {
            return load(Files.readString(path));
        } catch (IOException e) {
            throw new ProxyConfigurationException("Failed to read provider configuration: " + path, e);
        }
    }

    public List<ProviderConfig> load(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new ProxyConfigurationException("Malformed provider configuration JSON", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ProxyConfigurationException("Provider configuration is empty");
        }

        JsonNode items = root.isArray() ? root : root.path("providers");
        if (!items.isArray()) {
            throw new ProxyConfigurationException("Provider configuration must be an array or contain a 'providers' array");
        }

        List<ProviderConfig> configs = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int index = 0;
        for (JsonNode item : items) {
            ProviderConfig config = parseDescriptor(item, index++);
            if (!names.add(config.name())) {
                throw new ProxyConfigurationException("Duplicate provider name: " + config.name());
            }
            configs.add(config);
        }
        log.info("Loaded {} proxy provider descriptors: {}", configs.size(), names);
        return List.copyOf(configs);
    }

    private ProviderConfig parseDescriptor(JsonNode item, int index) {
        if (!item.isObject()) {
            throw new ProxyConfigurationException("Provider descriptor #" + index + " must be an object");
        }
        String name = textOrNull(item.get("name"));
        if (name == null || name.isBlank()) {
            throw new ProxyConfigurationException("Provider descriptor #" + index + " has no name");
        }
        ProviderType type = ProviderType.fromTag(textOrNull(item.get("type")));

        double price = 0.0d;
        JsonNode priceNode = item.get("price_per_gb");
        if (priceNode != null && !priceNode.isNull()) {
            if (!priceNode.isNumber()) {
                throw new ProxyConfigurationException("price_per_gb must be a number for provider " + name);
            }
            price = priceNode.asDouble();
        }

        int limit = ProviderConfig.UNLIMITED;
        JsonNode limitNode = item.get("concurrency_limit");
        if (limitNode != null && !limitNode.isNull()) {
            if (!limitNode.canConvertToInt() || !limitNode.isIntegralNumber()) {
                throw new ProxyConfigurationException("concurrency_limit must be an integer for provider " + name);
            }
            limit = limitNode.asInt();
        }

        Map<String, String> options = secretResolver.resolveAll(parseOptions(name, item.get("options")));
        return new ProviderConfig(name, type, price, limit, options);
    }

    private Map<String, String> parseOptions(String name, JsonNode node) {
        Map<String, String> options = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return options;
        }
        if (!node.isObject()) {
            throw new ProxyConfigurationException("options must be an object for provider " + name);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isArray()) {
                // entry lists may be given as arrays; providers split on newlines
                options.put(field.getKey(), joinLines(name, field.getKey(), value));
            } else if (value.isObject()) {
                throw new ProxyConfigurationException("Option '" + field.getKey() + "' must not be an object for provider " + name);
            } else if (!value.isNull()) {
                options.put(field.getKey(), value.asText());
            }
        }
        return options;
    }

    private static String joinLines(String name, String key, JsonNode array) {
        List<String> lines = new ArrayList<>();
        for (JsonNode element : array) {
            if (element.isContainerNode()) {
                throw new ProxyConfigurationException("Option '" + key + "' must contain only scalars for provider " + name);
            }
            lines.add(element.asText());
        }
        return String.join("\n", lines);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
