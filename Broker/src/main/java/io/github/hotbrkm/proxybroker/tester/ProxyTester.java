package io.github.hotbrkm.proxybroker.tester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Exercises endpoints against a live IP-echo URL, singly or in parallel batches.
 * <p>
 * Network-level failures never propagate: every probe yields a {@link ProxyTestResult}
 * with a classified {@link TestErrorType}.
 */
@Slf4j
public class ProxyTester {

    public static final String DEFAULT_TEST_URL = "http://httpbin.org/ip";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_WORKERS = 10;

    private static final Pattern IP_LITERAL = Pattern.compile("^[0-9A-Fa-f.:]+$");
    private static final int MAX_ERROR_LENGTH = 200;

    private final ProbeClient probeClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String defaultTestUrl;
    private final Duration defaultTimeout;
    private final int defaultMaxWorkers;

    public ProxyTester() {
        this(new ReactorProbeClient());
    }

    public ProxyTester(ProbeClient probeClient) {
        this(probeClient, DEFAULT_TEST_URL, DEFAULT_TIMEOUT, DEFAULT_MAX_WORKERS);
    }

    public ProxyTester(ProbeClient probeClient, String defaultTestUrl, Duration defaultTimeout, int defaultMaxWorkers) {
        this(probeClient, new ObjectMapper(), Clock.systemUTC(), defaultTestUrl, defaultTimeout, defaultMaxWorkers);
    }

    ProxyTester(ProbeClient probeClient, ObjectMapper objectMapper, Clock clock, String defaultTestUrl,
                Duration defaultTimeout, int defaultMaxWorkers) {
        this.probeClient = Objects.requireNonNull(probeClient, "probeClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultTestUrl = Objects.requireNonNull(defaultTestUrl, "defaultTestUrl must not be null");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        if (defaultMaxWorkers <= 0) {
            throw new IllegalArgumentException("defaultMaxWorkers must be positive: " + defaultMaxWorkers);
        }
        this.defaultMaxWorkers = defaultMaxWorkers;
    }

    public ProxyTestResult testSingleProxy(ProxyEndpoint endpoint) {
        return testSingleProxy(endpoint, defaultTestUrl, defaultTimeout);
    }

    /**
     * Probes one endpoint. Never throws for network failures.
     *
     * @param endpoint Endpoint to test
     * @param testUrl  IP-echo URL, the configured default when null
     * @param timeout  Probe deadline, the configured default when null
     */
    public ProxyTestResult testSingleProxy(ProxyEndpoint endpoint, String testUrl, Duration timeout) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        String url = testUrl == null ? defaultTestUrl : testUrl;
        Duration deadline = timeout == null ? defaultTimeout : timeout;

        log.debug("Testing proxy. endpoint={}, url={}", endpoint.address(), url);
        long started = System.nanoTime();
        ProbeResponse response;
        try {
            response = probeClient.get(endpoint, url, deadline);
        } catch (Exception e) {
            TestErrorType type = ProbeFailureClassifier.classify(e);
            String detail = describe(e);
            log.warn("Proxy test failed. endpoint={}, errorType={}, error={}", endpoint.address(), type, detail);
            return ProxyTestResult.failure(endpoint, null, null, type, detail, url, clock.instant());
        }
        double elapsedMs = round2((System.nanoTime() - started) / 1_000_000.0);

        if (response == null) {
            log.warn("Proxy test returned no response. endpoint={}", endpoint.address());
            return ProxyTestResult.failure(endpoint, elapsedMs, null, TestErrorType.UNKNOWN, "Empty response", url, clock.instant());
        }
        if (response.statusCode() != 200) {
            TestErrorType type = ProbeFailureClassifier.classifyStatus(response.statusCode());
            log.warn("Proxy returned non-OK status. endpoint={}, status={}", endpoint.address(), response.statusCode());
            return ProxyTestResult.failure(endpoint, elapsedMs, response.statusCode(), type,
                    "HTTP " + response.statusCode(), url, clock.instant());
        }

        String egressIp = extractEgressIp(response.body());
        log.info("Proxy working. endpoint={}, elapsedMs={}, egressIp={}", endpoint.address(), Math.round(elapsedMs), egressIp);
        return ProxyTestResult.success(endpoint, elapsedMs, response.statusCode(), egressIp, url, clock.instant());
    }

    public List<ProxyTestResult> testBatch(List<ProxyEndpoint> endpoints) {
        return testBatch(endpoints, defaultTestUrl, defaultTimeout, defaultMaxWorkers, null);
    }

    /**
     * Probes endpoints on a bounded worker pool.
     *
     * @param endpoints        Endpoints to test
     * @param testUrl          IP-echo URL, default when null
     * @param timeout          Per-probe deadline, default when null
     * @param maxWorkers       Upper bound of concurrent probes
     * @param progressListener Optional listener, called on the calling thread after each completion
     * @return One result per endpoint, in input order
     */
    public List<ProxyTestResult> testBatch(List<ProxyEndpoint> endpoints, String testUrl, Duration timeout, int maxWorkers,
                                           ProgressListener progressListener) {
        Objects.requireNonNull(endpoints, "endpoints must not be null");
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive: " + maxWorkers);
        }
        int total = endpoints.size();
        if (total == 0) {
            return List.of();
        }
        String url = testUrl == null ? defaultTestUrl : testUrl;
        int workers = Math.min(maxWorkers, total);
        log.info("Starting batch proxy test. endpoints={}, maxWorkers={}, url={}", total, workers, url);

        ProxyTestResult[] results = new ProxyTestResult[total];
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        CompletionService<IndexedResult> completion = new ExecutorCompletionService<>(executor);
        try {
            for (int i = 0; i < total; i++) {
                int index = i;
                ProxyEndpoint endpoint = endpoints.get(i);
                completion.submit(() -> new IndexedResult(index, testGuarded(endpoint, url, timeout)));
            }
            for (int completed = 1; completed <= total; completed++) {
                IndexedResult done = awaitNext(completion);
                results[done.index()] = done.result();
                notifyProgress(progressListener, completed, total);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Batch proxy test interrupted. completed={}/{}", Arrays.stream(results).filter(Objects::nonNull).count(), total);
            fillInterrupted(results, endpoints, url);
        } finally {
            executor.shutdownNow();
        }

        List<ProxyTestResult> ordered = List.of(results);
        ProxyTestSummary summary = ProxyTestSummary.of(ordered);
        log.info("Batch proxy test complete. successful={}/{}, failed={}, avgResponseMs={}",
                summary.successful(), summary.total(), summary.failed(), Math.round(summary.avgResponseTimeMs()));
        return ordered;
    }

    private ProxyTestResult testGuarded(ProxyEndpoint endpoint, String url, Duration timeout) {
        try {
            return testSingleProxy(endpoint, url, timeout);
        } catch (RuntimeException e) {
            log.error("Unexpected error while testing proxy. endpoint={}", endpoint.address(), e);
            return ProxyTestResult.failure(endpoint, null, null, TestErrorType.UNKNOWN, describe(e), url, clock.instant());
        }
    }

    private static IndexedResult awaitNext(CompletionService<IndexedResult> completion) throws InterruptedException {
        Future<IndexedResult> future = completion.take();
        try {
            return future.get();
        } catch (ExecutionException e) {
            // testGuarded converts every exception, only errors get here
            throw new IllegalStateException("Proxy test worker failed", e.getCause());
        }
    }

    private static void notifyProgress(ProgressListener listener, int completed, int total) {
        if (listener == null) {
            return;
        }
        try {
            listener.onProgress(completed, total);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed. completed={}/{}", completed, total, e);
        }
    }

    private void fillInterrupted(ProxyTestResult[] results, List<ProxyEndpoint> endpoints, String url) {
        for (int i = 0; i < results.length; i++) {
            if (results[i] == null) {
                results[i] = ProxyTestResult.failure(endpoints.get(i), null, null, TestErrorType.UNKNOWN,
                        "Interrupted", url, clock.instant());
            }
        }
    }

    /**
     * Reads the egress address from an IP-echo body: JSON {@code origin} (httpbin) or {@code ip}
     * (ipify) fields, or a plain-text address.
     */
    String extractEgressIp(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        String trimmed = body.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode node = objectMapper.readTree(trimmed);
                JsonNode ip = node.hasNonNull("origin") ? node.get("origin") : node.get("ip");
                if (ip == null || ip.isNull()) {
                    return null;
                }
                // httpbin lists forwarding hops as "client, proxy"
                return ip.asText().split(",")[0].trim();
            } catch (IOException e) {
                log.debug("Unparsable IP echo body: {}", abbreviate(trimmed));
                return null;
            }
        }
        return IP_LITERAL.matcher(trimmed).matches() ? trimmed : null;
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger sequence = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, "proxy-tester-" + sequence.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root != e && root.getMessage() != null) {
            message = root.getMessage();
        }
        String name = root.getClass().getSimpleName();
        return abbreviate(message == null ? name : name + ": " + message);
    }

    private static String abbreviate(String value) {
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private record IndexedResult(int index, ProxyTestResult result) {
    }
}
