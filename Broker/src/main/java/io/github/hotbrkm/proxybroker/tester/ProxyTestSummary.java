package io.github.hotbrkm.proxybroker.tester;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of a set of probe results.
 *
 * @param total             Number of results
 * @param successful        Successful probes
 * @param failed            Failed probes
 * @param successRate       Percent successful (0-100)
 * @param avgResponseTimeMs Mean response time of successful probes, 0 when none
 * @param minResponseTimeMs Fastest successful probe, 0 when none
 * @param maxResponseTimeMs Slowest successful probe, 0 when none
 * @param failuresByType    Failed probe count per error class
 */
@Slf4j
public record ProxyTestSummary(int total, int successful, int failed, double successRate, double avgResponseTimeMs,
                               double minResponseTimeMs, double maxResponseTimeMs,
                               Map<TestErrorType, Integer> failuresByType) {

    public static ProxyTestSummary of(List<ProxyTestResult> results) {
        int successful = 0;
        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = 0;
        Map<TestErrorType, Integer> failures = new EnumMap<>(TestErrorType.class);

        for (ProxyTestResult result : results) {
            if (result.success()) {
                successful++;
                double time = result.responseTimeMs() == null ? 0.0 : result.responseTimeMs();
                sum += time;
                min = Math.min(min, time);
                max = Math.max(max, time);
            } else {
                TestErrorType type = result.errorType() == null ? TestErrorType.UNKNOWN : result.errorType();
                failures.merge(type, 1, Integer::sum);
            }
        }

        int total = results.size();
        double rate = total == 0 ? 0.0 : (double) successful / total * 100;
        double avg = successful == 0 ? 0.0 : sum / successful;
        return new ProxyTestSummary(total, successful, total - successful, rate, avg,
                successful == 0 ? 0.0 : min, max, Collections.unmodifiableMap(failures));
    }

    /**
     * Writes a human-readable report of the results at INFO level.
     */
    public static void logReport(List<ProxyTestResult> results) {
        ProxyTestSummary summary = of(results);
        log.info("Proxy test summary: total={}, successful={} ({}%), failed={}",
                summary.total(), summary.successful(), String.format("%.1f", summary.successRate()), summary.failed());
        if (summary.successful() > 0) {
            log.info("Response times: avg={}ms, min={}ms, max={}ms", Math.round(summary.avgResponseTimeMs()),
                    Math.round(summary.minResponseTimeMs()), Math.round(summary.maxResponseTimeMs()));
        }
        int index = 1;
        for (ProxyTestResult result : results) {
            if (result.success()) {
                log.info("  [OK]   #{} {} provider={} session={} {}ms ip={}", index, result.endpoint().address(),
                        result.endpoint().provider(), result.endpoint().session(),
                        Math.round(result.responseTimeMs() == null ? 0.0 : result.responseTimeMs()), result.egressIp());
            } else {
                log.info("  [FAIL] #{} {} provider={} {}: {}", index, result.endpoint().address(),
                        result.endpoint().provider(), result.errorType(), result.error());
            }
            index++;
        }
    }
}
