package com.example.collab.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-client token buckets for the collaboration API. Clients are keyed by user id only when the gateway marked it
 * verified, else by source address. The least recently used buckets are dropped beyond the configured client count.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    private static final String API_PREFIX = "/api/collaborative";

    private final CollabSecurityProperties securityProperties;
    private final Map<String, Bucket> buckets;

    public RateLimitingFilter(CollabSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
        int maxTrackedClients = Math.max(securityProperties.getRateLimit().getMaxTrackedClients(), 1);
        this.buckets = Collections.synchronizedMap(new LinkedHashMap<>(256, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Bucket> eldest) {
                return size() > maxTrackedClients;
            }
        });
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (!securityProperties.isRateLimitingEnabled() || isAsyncDispatch(request)
                || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        boolean lockPath = isLockPath(request);
        Bucket bucket = buckets.computeIfAbsent(resolveKey(request), key -> newBucket(lockPath));
        if (bucket.tryConsume(1)) {
            filterChain.doFilter(request, response);
            return;
        }

        log.debug("Rate limit exceeded for {} {}", request.getMethod(), request.getRequestURI());
        writeRateLimitResponse(response);
    }

    private Bucket newBucket(boolean lockPath) {
        CollabSecurityProperties.RateLimit limitConfig = securityProperties.getRateLimit();
        Duration refillPeriod = limitConfig.getRefillPeriod();
        if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
            refillPeriod = Duration.ofSeconds(60);
        }

        long capacity = Math.max(lockPath ? limitConfig.getLockCapacity() : limitConfig.getCapacity(), 1);
        long refillTokens = Math.max(lockPath ? capacity : limitConfig.getRefillTokens(), 1);

        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(refillTokens, refillPeriod));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    private void writeRateLimitResponse(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Duration refillPeriod = securityProperties.getRateLimit().getRefillPeriod();
        long retryAfterSeconds = refillPeriod == null ? 60 : Math.max(refillPeriod.toSeconds(), 1);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.getWriter()
                .write("{\"error\":\"Request rate exceeded. Please retry later.\","
                        + "\"code\":\"too_many_requests\",\"category\":\"UNAVAILABLE\"}");
    }

    private boolean isLockPath(HttpServletRequest request) {
        return request.getRequestURI().endsWith("/lock");
    }

    int trackedClients() {
        return buckets.size();
    }

    private String resolveKey(HttpServletRequest request) {
        String userId = request.getHeader(securityProperties.getUserIdHeader());
        boolean verified = Boolean.parseBoolean(
                StringUtils.trimWhitespace(request.getHeader(securityProperties.getAuthenticatedHeader())));
        String client;
        if (verified && StringUtils.hasText(userId)) {
            client = "user:" + userId.trim();
        } else {
            String forwardedFor = request.getHeader("X-Forwarded-For");
            client = StringUtils.hasText(forwardedFor)
                    ? "ip:" + forwardedFor.split(",")[0].trim()
                    : "ip:" + request.getRemoteAddr();
        }
        return client + ":" + request.getMethod() + ":" + request.getRequestURI();
    }
}
