package io.github.hotbrkm.proxybroker.tester;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.proxy.ProxyConnectException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProbeFailureClassifier")
class ProbeFailureClassifierTest {

    @Test
    @DisplayName("Timeouts anywhere in the cause chain should be TIMEOUT")
    void testTimeout() {
        assertThat(ProbeFailureClassifier.classify(new TimeoutException("Did not observe any item")))
                .isEqualTo(TestErrorType.TIMEOUT);
        assertThat(ProbeFailureClassifier.classify(new IllegalStateException("wrapped", new SocketTimeoutException())))
                .isEqualTo(TestErrorType.TIMEOUT);
        assertThat(ProbeFailureClassifier.classify(new ConnectTimeoutException("connection timed out: /1.2.3.4:8000")))
                .isEqualTo(TestErrorType.TIMEOUT);
        assertThat(ProbeFailureClassifier.classify(new ProxyConnectException("http, none, /1.2.3.4:8000 => x, timeout")))
                .isEqualTo(TestErrorType.TIMEOUT);
    }

    @Test
    @DisplayName("Proxy 407 answers should be AUTH")
    void testAuth() {
        assertThat(ProbeFailureClassifier.classify(
                new ProxyConnectException("http, basic, /1.2.3.4:8000 => httpbin.org:80, status: 407 Proxy Authentication Required")))
                .isEqualTo(TestErrorType.AUTH);
        assertThat(ProbeFailureClassifier.classifyStatus(407)).isEqualTo(TestErrorType.AUTH);
        assertThat(ProbeFailureClassifier.classifyStatus(502)).isEqualTo(TestErrorType.UNKNOWN);
    }

    @Test
    @DisplayName("Refused, unreachable and unresolvable proxies should be CONNECTION")
    void testConnection() {
        assertThat(ProbeFailureClassifier.classify(new ConnectException("Connection refused")))
                .isEqualTo(TestErrorType.CONNECTION);
        assertThat(ProbeFailureClassifier.classify(new RuntimeException(new UnknownHostException("nope.invalid"))))
                .isEqualTo(TestErrorType.CONNECTION);
        assertThat(ProbeFailureClassifier.classify(new ProxyConnectException("http, none, /1.2.3.4:8407 => x, disconnected")))
                .isEqualTo(TestErrorType.CONNECTION);
    }

    @Test
    @DisplayName("Anything else should be UNKNOWN")
    void testUnknown() {
        assertThat(ProbeFailureClassifier.classify(new IOException("weird"))).isEqualTo(TestErrorType.UNKNOWN);
    }
}
