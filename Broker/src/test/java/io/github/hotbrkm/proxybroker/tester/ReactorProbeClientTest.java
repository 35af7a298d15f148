package io.github.hotbrkm.proxybroker.tester;

import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReactorProbeClient against a local proxy socket")
class ReactorProbeClientTest {

    private static final String TARGET_URL = "http://echo.test/ip";

    private final ProxyTester tester = new ProxyTester(new ReactorProbeClient());
    private LocalProxyServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    @DisplayName("A proxy that accepts but never answers should fail as TIMEOUT close to the deadline")
    void testSilentProxyTimesOut() throws IOException {
        server = LocalProxyServer.silent();

        long started = System.nanoTime();
        ProxyTestResult result = tester.testSingleProxy(endpoint(server.port()), TARGET_URL, Duration.ofSeconds(1));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo(TestErrorType.TIMEOUT);
        assertThat(elapsedMs).isLessThan(1_800);
    }

    @Test
    @DisplayName("A proxy answering 407 should fail as AUTH")
    void testProxyAuthRequired() throws IOException {
        server = LocalProxyServer.answering("HTTP/1.1 407 Proxy Authentication Required\r\n"
                + "Proxy-Authenticate: Basic realm=\"proxy\"\r\n"
                + "Content-Length: 0\r\n\r\n");

        ProxyTestResult result = tester.testSingleProxy(endpoint(server.port()), TARGET_URL, Duration.ofSeconds(2));

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo(TestErrorType.AUTH);
    }

    @Test
    @DisplayName("A closed port should fail as CONNECTION")
    void testRefusedPort() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }

        ProxyTestResult result = tester.testSingleProxy(endpoint(port), TARGET_URL, Duration.ofSeconds(2));

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo(TestErrorType.CONNECTION);
    }

    @Test
    @DisplayName("Connect timeout should take only part of the deadline")
    void testConnectTimeoutShare() {
        assertThat(ReactorProbeClient.connectTimeoutMillis(Duration.ofSeconds(1))).isEqualTo(500);
        assertThat(ReactorProbeClient.connectTimeoutMillis(Duration.ofMillis(1))).isEqualTo(1);
    }

    private static ProxyEndpoint endpoint(int port) {
        return ProxyEndpoint.builder()
                .host("127.0.0.1")
                .port(port)
                .username("user")
                .password("pass")
                .provider("local")
                .build();
    }

    /**
     * Loopback proxy stand-in that either holds connections open without a byte or answers each
     * request head with a fixed response.
     */
    private static final class LocalProxyServer implements AutoCloseable {

        private final ServerSocket serverSocket;
        private final String response;
        private final List<Socket> accepted = new CopyOnWriteArrayList<>();

        private LocalProxyServer(String response) throws IOException {
            this.serverSocket = new ServerSocket(0, 16, InetAddress.getLoopbackAddress());
            this.response = response;
            Thread acceptor = new Thread(this::acceptLoop, "local-proxy-" + serverSocket.getLocalPort());
            acceptor.setDaemon(true);
            acceptor.start();
        }

        static LocalProxyServer silent() throws IOException {
            return new LocalProxyServer(null);
        }

        static LocalProxyServer answering(String response) throws IOException {
            return new LocalProxyServer(response);
        }

        int port() {
            return serverSocket.getLocalPort();
        }

        private void acceptLoop() {
            while (!serverSocket.isClosed()) {
                try {
                    Socket socket = serverSocket.accept();
                    accepted.add(socket);
                    if (response != null) {
                        answer(socket);
                    }
                } catch (IOException e) {
                    return;
                }
            }
        }

        private void answer(Socket socket) throws IOException {
            InputStream in = socket.getInputStream();
            StringBuilder head = new StringBuilder();
            int b;
            while ((b = in.read()) != -1) {
                head.append((char) b);
                if (head.indexOf("\r\n\r\n") >= 0) {
                    break;
                }
            }
            OutputStream out = socket.getOutputStream();
            out.write(response.getBytes(StandardCharsets.US_ASCII));
            out.flush();
        }

        @Override
        public void close() {
            try {
                serverSocket.close();
                for (Socket socket : accepted) {
                    socket.close();
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed to close local proxy server", e);
            }
        }
    }
}
