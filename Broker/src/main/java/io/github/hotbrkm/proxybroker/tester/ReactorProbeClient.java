package io.github.hotbrkm.proxybroker.tester;

import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * {@link ProbeClient} on a reactor-netty {@link HttpClient} routed through the endpoint.
 * <p>
 * {@code socks*} schemes use a SOCKS5 proxy handler, everything else an HTTP proxy handler.
 * A fresh, unpooled connection is opened per probe so that results never leak between endpoints.
 */
public class ReactorProbeClient implements ProbeClient {

    static final String USER_AGENT = "ProxyTester/1.0";

    /**
     * Share of the probe deadline granted to the TCP connect and the proxy handshake, which both
     * run inside the overall deadline.
     */
    static final double CONNECT_SHARE = 0.5;

    @Override
    public ProbeResponse get(ProxyEndpoint endpoint, String url, Duration timeout) {
        ProxyProvider.Proxy type = endpoint.scheme().toLowerCase(Locale.ROOT).startsWith("socks")
                ? ProxyProvider.Proxy.SOCKS5
                : ProxyProvider.Proxy.HTTP;
        long connectTimeoutMs = connectTimeoutMillis(timeout);

        HttpClient client = HttpClient.newConnection()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(connectTimeoutMs, Integer.MAX_VALUE))
                .proxy(spec -> {
                    if (endpoint.hasCredentials()) {
                        spec.type(type)
                                .host(endpoint.host())
                                .port(endpoint.port())
                                .username(endpoint.username())
                                .password(user -> endpoint.password())
                                .connectTimeoutMillis(connectTimeoutMs);
                    } else {
                        spec.type(type)
                                .host(endpoint.host())
                                .port(endpoint.port())
                                .connectTimeoutMillis(connectTimeoutMs);
                    }
                })
                .responseTimeout(timeout)
                .headers(headers -> headers.set(HttpHeaderNames.USER_AGENT, USER_AGENT));

        return client.get()
                .uri(url)
                .responseSingle((response, body) -> body.asString(StandardCharsets.UTF_8)
                        .defaultIfEmpty("")
                        .map(text -> new ProbeResponse(response.status().code(), text)))
                .timeout(timeout)
                .block();
    }

    static long connectTimeoutMillis(Duration timeout) {
        return Math.max(1L, (long) (timeout.toMillis() * CONNECT_SHARE));
    }
}
