package io.github.hotbrkm.proxybroker.endpoint;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Proxy option in the shape headless-browser drivers expect.
 *
 * @param server   {@code scheme://host:port}
 * @param username Username, or null if the endpoint is unauthenticated
 * @param password Password, or null if the endpoint is unauthenticated
 */
public record BrowserProxySpec(String server, String username, String password) {

    /**
     * Returns the option as a map, omitting absent credentials.
     */
    public Map<String, String> toMap() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("server", server);
        if (username != null && !username.isEmpty()) {
            out.put("username", username);
        }
        if (password != null && !password.isEmpty()) {
            out.put("password", password);
        }
        return out;
    }
}
