package io.github.hotbrkm.proxybroker.tester;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.proxy.ProxyConnectException;
import lombok.experimental.UtilityClass;
import reactor.netty.http.client.PrematureCloseException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps probe failures to a {@link TestErrorType}.
 * <p>
 * The whole cause chain is inspected, since reactive clients wrap the original failure.
 * Priority: timeout, then authentication, then connection.
 */
@UtilityClass
public class ProbeFailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    public static TestErrorType classify(Throwable failure) {
        List<Throwable> chain = causeChain(failure);
        if (chain.stream().anyMatch(ProbeFailureClassifier::isTimeout)) {
            return TestErrorType.TIMEOUT;
        }
        if (chain.stream().anyMatch(ProbeFailureClassifier::isAuth)) {
            return TestErrorType.AUTH;
        }
        if (chain.stream().anyMatch(ProbeFailureClassifier::isConnection)) {
            return TestErrorType.CONNECTION;
        }
        return TestErrorType.UNKNOWN;
    }

    /**
     * Classifies a non-200 answer that reached the caller.
     */
    public static TestErrorType classifyStatus(int statusCode) {
        return statusCode == 407 ? TestErrorType.AUTH : TestErrorType.UNKNOWN;
    }

    private static boolean isTimeout(Throwable t) {
        if (t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof ConnectTimeoutException
                || t instanceof io.netty.handler.timeout.TimeoutException) {
            return true;
        }
        String message = message(t);
        return t instanceof ProxyConnectException && (message.contains("timeout") || message.contains("timed out"));
    }

    private static boolean isAuth(Throwable t) {
        String message = message(t);
        if (message.contains("proxy authentication required")) {
            return true;
        }
        return t instanceof ProxyConnectException && (message.contains("status: 407") || message.contains("authstatus"));
    }

    private static boolean isConnection(Throwable t) {
        return t instanceof ProxyConnectException
                || t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof UnknownHostException
                || t instanceof PrematureCloseException
                || t instanceof ClosedChannelException
                || t instanceof SocketException;
    }

    private static List<Throwable> causeChain(Throwable failure) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = failure;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    private static String message(Throwable t) {
        return t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
    }
}
