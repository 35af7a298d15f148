package io.github.hotbrkm.proxybroker.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SecretResolver")
class SecretResolverTest {

    private final SecretResolver resolver = new SecretResolver(Map.of("TOKEN", "abc", "EMPTY", "")::get);

    @Test
    @DisplayName("Plain values pass through unchanged")
    void testPlainValue() {
        assertThat(resolver.resolve("literal")).isEqualTo("literal");
        assertThat(resolver.resolve(null)).isNull();
    }

    @Test
    @DisplayName("env: references resolve against the environment lookup")
    void testEnvReference() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("a", "env:TOKEN");
        options.put("b", "plain");

        assertThat(resolver.resolveAll(options)).containsExactly(Map.entry("a", "abc"), Map.entry("b", "plain"));
    }

    @Test
    @DisplayName("Empty or unset variables are configuration errors")
    void testUnresolved() {
        assertThatThrownBy(() -> resolver.resolve("env:EMPTY"))
                .isInstanceOf(ProxyConfigurationException.class)
                .hasMessageContaining("EMPTY");
        assertThatThrownBy(() -> resolver.resolve("env:NOPE"))
                .isInstanceOf(ProxyConfigurationException.class)
                .hasMessageContaining("NOPE");
    }
}
