package io.github.hotbrkm.proxybroker.config;

import io.github.hotbrkm.proxybroker.manager.ProxyManager;
import io.github.hotbrkm.proxybroker.meter.ProxyMeter;
import io.github.hotbrkm.proxybroker.tester.ProxyTester;
import io.github.hotbrkm.proxybroker.tester.ReactorProbeClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "proxy", name = "enabled", havingValue = "true")
public class ProxyBrokerConfig {

    @Bean
    public ProviderConfigLoader providerConfigLoader() {
        return new ProviderConfigLoader();
    }

    @Bean
    @ConditionalOnProperty(prefix = "proxy", name = "metering-enabled", havingValue = "true", matchIfMissing = true)
    public ProxyMeter proxyMeter() {
        return new ProxyMeter();
    }

    @Bean
    public ProxyManager proxyManager(ProxyBrokerProperties properties, ProviderConfigLoader loader,
                                     ObjectProvider<ProxyMeter> proxyMeter) {
        if (properties.getConfigPath() == null || properties.getConfigPath().isBlank()) {
            throw new ProxyConfigurationException("proxy.config-path must be set when proxy.enabled=true");
        }
        List<ProviderConfig> configs = loader.load(Path.of(properties.getConfigPath()));
        ProxyMeter meter = properties.isMeteringEnabled() ? proxyMeter.getIfAvailable() : null;
        log.info("Creating proxy manager. configPath={}, providers={}, metering={}",
                properties.getConfigPath(), configs.size(), meter != null);
        return new ProxyManager(configs, meter);
    }

    @Bean
    public ProxyTester proxyTester(ProxyBrokerProperties properties) {
        ProxyBrokerProperties.Tester tester = properties.getTester();
        return new ProxyTester(new ReactorProbeClient(), tester.getTestUrl(),
                Duration.ofMillis(tester.getTimeoutMs()), tester.getMaxWorkers());
    }
}
