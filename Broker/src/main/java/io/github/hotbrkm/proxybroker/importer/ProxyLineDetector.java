package io.github.hotbrkm.proxybroker.importer;

import io.github.hotbrkm.proxybroker.endpoint.IpVersion;
import io.github.hotbrkm.proxybroker.endpoint.ProxyAddress;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import io.github.hotbrkm.proxybroker.endpoint.RotationType;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw proxy lines and infers vendor, network class, IP version, session and region.
 */
@Slf4j
public class ProxyLineDetector {

    private static final Map<String, List<Pattern>> PROVIDER_PATTERNS = providerPatterns();

    private static final List<String> RESIDENTIAL_KEYWORDS = List.of("residential", "resi", "home", "dsl", "cable");
    private static final List<String> ISP_KEYWORDS = List.of("isp", "static-residential");
    private static final List<String> MOBILE_KEYWORDS = List.of("mobile", "4g", "5g", "cellular");

    private static final Pattern SESSION = Pattern.compile("_session-([A-Za-z0-9_-]+)");
    private static final Pattern COUNTRY = Pattern.compile("_country-([A-Za-z]{2})(?=_|$)");

    private final String defaultScheme;

    public ProxyLineDetector() {
        this("http");
    }

    public ProxyLineDetector(String defaultScheme) {
        this.defaultScheme = defaultScheme;
    }

    /**
     * @return the detected proxy, or empty if the line matches no supported format
     */
    public Optional<DetectedProxy> parse(String line) {
        ProxyAddress address;
        try {
            address = ProxyAddress.parse(line, defaultScheme);
        } catch (IllegalArgumentException e) {
            log.debug("Unparsable proxy line. reason={}", e.getMessage());
            return Optional.empty();
        }

        String provider = detectProvider(address);
        String session = find(SESSION, address.password());
        String region = find(COUNTRY, address.password());
        DetectedProxy detected = new DetectedProxy(address, provider, detectProxyType(address), detectIpVersion(address.host()),
                RotationType.STICKY, session, region == null ? null : region.toUpperCase(Locale.ROOT));
        log.debug("Detected proxy. endpoint={}:{}, provider={}, type={}, region={}, session={}", address.host(),
                address.port(), provider, detected.proxyType().value(), detected.region(), session);
        return Optional.of(detected);
    }

    static String detectProvider(ProxyAddress address) {
        String text = address.host() + " " + nullToEmpty(address.username()) + " " + nullToEmpty(address.password());
        for (Map.Entry<String, List<Pattern>> entry : PROVIDER_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(text).find()) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    // Keyword checks look at the host and password only; usernames are usually account ids.
    static ProxyType detectProxyType(ProxyAddress address) {
        String host = address.host().toLowerCase(Locale.ROOT);
        String password = nullToEmpty(address.password()).toLowerCase(Locale.ROOT);
        if (containsAny(host, password, RESIDENTIAL_KEYWORDS)) {
            return ProxyType.RESIDENTIAL;
        }
        if (containsAny(host, password, ISP_KEYWORDS)) {
            return ProxyType.ISP;
        }
        if (containsAny(host, password, MOBILE_KEYWORDS)) {
            return ProxyType.MOBILE;
        }
        return ProxyType.DATACENTER;
    }

    static IpVersion detectIpVersion(String host) {
        if (host.indexOf(':') >= 0 || host.toLowerCase(Locale.ROOT).contains("ipv6")) {
            return IpVersion.IPV6;
        }
        return IpVersion.IPV4;
    }

    private static boolean containsAny(String host, String password, List<String> keywords) {
        for (String keyword : keywords) {
            if (host.contains(keyword) || password.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String find(Pattern pattern, String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(value);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static Map<String, List<Pattern>> providerPatterns() {
        Map<String, List<Pattern>> patterns = new LinkedHashMap<>();
        patterns.put("mooproxy", compile("mooproxy\\.net", "_session-[A-Za-z0-9]+"));
        patterns.put("brightdata", compile("lum-superproxy\\.io", "zproxy\\.lum"));
        patterns.put("smartproxy", compile("smartproxy\\.com", "gate\\.smartproxy"));
        patterns.put("oxylabs", compile("oxylabs\\.io", "pr\\.oxylabs"));
        patterns.put("iproyal", compile("iproyal\\.com"));
        return patterns;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
