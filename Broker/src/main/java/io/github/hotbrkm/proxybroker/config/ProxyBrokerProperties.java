package io.github.hotbrkm.proxybroker.config;

import io.github.hotbrkm.proxybroker.tester.ProxyTester;
import lombok.Data;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@ConfigurationProperties(prefix = "proxy")
@ConditionalOnProperty(prefix = "proxy", name = "enabled", havingValue = "true")
@Component
public class ProxyBrokerProperties {

    private boolean enabled;

    /**
     * JSON provider descriptor file.
     */
    private String configPath;

    private boolean meteringEnabled = true;

    private Tester tester = new Tester();

    @Data
    public static class Tester {
        private String testUrl = ProxyTester.DEFAULT_TEST_URL;
        private long timeoutMs = ProxyTester.DEFAULT_TIMEOUT.toMillis();
        private int maxWorkers = ProxyTester.DEFAULT_MAX_WORKERS;
    }
}
