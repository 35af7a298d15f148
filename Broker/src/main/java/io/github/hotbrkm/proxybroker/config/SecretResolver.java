package io.github.hotbrkm.proxybroker.config;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves {@code env:VAR_NAME} indirections against an environment lookup.
 * <p>
 * Resolution happens once, at load time. A missing or empty variable is a configuration error.
 */
@Slf4j
public class SecretResolver {

    static final String ENV_PREFIX = "env:";

    private final Function<String, String> environment;

    public SecretResolver() {
        this(System::getenv);
    }

    public SecretResolver(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    /**
     * Returns the value itself, or the referenced environment variable for {@code env:} values.
     *
     * @throws ProxyConfigurationException if the referenced variable is unset or empty
     */
    public String resolve(String value) {
        if (value == null || !value.startsWith(ENV_PREFIX)) {
            return value;
        }
        String variable = value.substring(ENV_PREFIX.length()).trim();
        if (variable.isEmpty()) {
            throw new ProxyConfigurationException("Empty environment variable reference: " + value);
        }
        String resolved = environment.apply(variable);
        if (resolved == null || resolved.isEmpty()) {
            throw new ProxyConfigurationException("Unresolved secret reference: environment variable " + variable + " is not set");
        }
        log.debug("Resolved secret from environment variable: {}", variable);
        return resolved;
    }

    /**
     * Resolves every value of an options map, keeping key order.
     */
    public Map<String, String> resolveAll(Map<String, String> options) {
        Map<String, String> resolved = new LinkedHashMap<>();
        if (options == null) {
            return resolved;
        }
        for (Map.Entry<String, String> entry : options.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getValue()));
        }
        return resolved;
    }
}
