package com.pricecheck.checker.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * Derives the rate-limit identity of a caller: the client address plus a coarse user-agent
 * signature, so clients behind one NAT with different browsers get separate budgets.
 *
 * <p>{@code X-Real-IP} and {@code X-Forwarded-For} are read only when the service sits behind
 * a trusted reverse proxy ({@code price-check.rate-limit.trust-proxy-headers}); otherwise the
 * socket address is the client address.
 */
@Component
public class ClientIdentityResolver {

    static final String REAL_IP_HEADER      = "X-Real-IP";
    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private static final int SIGNATURE_BUCKETS = 10_000;

    private final boolean trustProxyHeaders;

    public ClientIdentityResolver(@Value("${price-check.rate-limit.trust-proxy-headers:false}") boolean trustProxyHeaders) {
        this.trustProxyHeaders = trustProxyHeaders;
    }

    public String resolve(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        String userAgent = headers.getFirst(HttpHeaders.USER_AGENT);
        return clientAddress(request) + ":" + Math.floorMod(userAgent == null ? 0 : userAgent.hashCode(), SIGNATURE_BUCKETS);
    }

    String clientAddress(ServerHttpRequest request) {
        if (trustProxyHeaders) {
            HttpHeaders headers = request.getHeaders();
            String realIp = headers.getFirst(REAL_IP_HEADER);
            if (realIp != null && !realIp.isBlank()) {
                return realIp.trim();
            }
            String forwardedFor = headers.getFirst(FORWARDED_FOR_HEADER);
            if (forwardedFor != null && !forwardedFor.isBlank()) {
                return forwardedFor.split(",")[0].trim();
            }
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }
}
