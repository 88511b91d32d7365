package com.example.collab.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "collab.security")
public class CollabSecurityProperties {

    /**
     * Header carrying the verified user id, set by the identity gateway in front of this service.
     */
    @NotBlank
    private String userIdHeader = "X-User-Id";

    /**
     * Header the gateway sets to {@code true} once the user id has been verified.
     */
    @NotBlank
    private String authenticatedHeader = "X-User-Authenticated";

    /**
     * Toggle to enable or disable the inbound HTTP rate limiter.
     */
    private boolean rateLimitingEnabled = true;

    private final RateLimit rateLimit = new RateLimit();

    /**
     * Browser origins allowed to call the REST API and open the realtime socket.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:4200", "http://localhost:4201"));

    public String getUserIdHeader() {
        return userIdHeader;
    }

    public void setUserIdHeader(String userIdHeader) {
        this.userIdHeader = userIdHeader;
    }

    public String getAuthenticatedHeader() {
        return authenticatedHeader;
    }

    public void setAuthenticatedHeader(String authenticatedHeader) {
        this.authenticatedHeader = authenticatedHeader;
    }

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Validated
    public static class RateLimit {

        /**
         * Maximum number of requests a client may send to one path per refill period.
         */
        private long capacity = 120;

        private long refillTokens = 120;

        private Duration refillPeriod = Duration.ofSeconds(60);

        /**
         * Lock acquisition is polled by waiting clients, so it gets its own, tighter bucket.
         */
        private long lockCapacity = 30;

        /**
         * Upper bound on buckets kept in memory; the least recently used client is forgotten first.
         */
        private int maxTrackedClients = 10_000;

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(long refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }

        public long getLockCapacity() {
            return lockCapacity;
        }

        public void setLockCapacity(long lockCapacity) {
            this.lockCapacity = lockCapacity;
        }

        public int getMaxTrackedClients() {
            return maxTrackedClients;
        }

        public void setMaxTrackedClients(int maxTrackedClients) {
            this.maxTrackedClients = maxTrackedClients;
        }
    }
}
