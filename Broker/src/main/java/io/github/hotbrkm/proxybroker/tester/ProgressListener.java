package io.github.hotbrkm.proxybroker.tester;

/**
 * Receives batch progress after each completed probe.
 */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(int completed, int total);
}
