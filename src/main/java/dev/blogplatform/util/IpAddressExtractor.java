package dev.blogplatform.util;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts the client address used as the rate-limit key.
 * <p>
 * Proxy headers (X-Forwarded-For, X-Real-IP) are only trusted when the direct
 * peer is a known proxy; otherwise the socket address wins.
 * </p>
 */
public final class IpAddressExtractor {

    private static final Pattern IP_PATTERN = Pattern.compile("^[0-9a-fA-F.:]+$");

    private static final Set<String> TRUSTED_PROXIES = Set.of(
            "127.0.0.1", "::1", "0:0:0:0:0:0:0:1"
    );

    /** Docker bridge networks. */
    private static final String[] TRUSTED_PREFIXES = {
            "172.17.", "172.18.", "172.19.", "172.20."
    };

    private IpAddressExtractor() {
        // Utility class
    }

    private static boolean isTrustedProxy(String ip) {
        if (ip == null || ip.isBlank()) return false;
        if (TRUSTED_PROXIES.contains(ip)) return true;
        for (String prefix : TRUSTED_PREFIXES) {
            if (ip.startsWith(prefix)) return true;
        }
        return false;
    }

    /**
     * @return the client IP address, or "unknown" if it cannot be determined
     */
    public static String extractClientIp(ServerHttpRequest request) {
        String remoteIp = Optional.ofNullable(request.getRemoteAddress())
                .map(InetSocketAddress::getAddress)
                .map(InetAddress::getHostAddress)
                .orElse("unknown");

        if (!isTrustedProxy(remoteIp)) {
            return remoteIp;
        }

        // Rightmost non-proxy entry is the first hop we cannot vouch for
        String xForwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            String[] ips = xForwardedFor.split(",");
            for (int i = ips.length - 1; i >= 0; i--) {
                String ip = ips[i].trim();
                if (isValidIp(ip) && !isTrustedProxy(ip)) {
                    return ip;
                }
            }
        }

        String xRealIp = request.getHeaders().getFirst("X-Real-IP");
        if (xRealIp != null && !xRealIp.isBlank() && isValidIp(xRealIp)) {
            return xRealIp;
        }

        return remoteIp;
    }

    public static String extractClientIp(ServerWebExchange exchange) {
        return extractClientIp(exchange.getRequest());
    }

    public static boolean isValidIp(String ip) {
        return ip != null
                && !ip.isBlank()
                && ip.length() <= 45
                && IP_PATTERN.matcher(ip).matches();
    }
}
