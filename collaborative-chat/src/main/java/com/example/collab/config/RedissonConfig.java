package com.example.collab.config;

import java.time.Duration;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson backs presence tracking and the cross-replica event topic. Nothing authoritative lives in Redis.
 */
@Configuration
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties, CollabProperties collabProperties) {
        Config config = new Config();
        SingleServerConfig server = config.useSingleServer()
                .setAddress(buildAddress(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setClientName(collabProperties.getNamespace())
                .setUsername(StringUtils.hasText(redisProperties.getUsername()) ? redisProperties.getUsername() : null)
                .setPassword(StringUtils.hasText(redisProperties.getPassword()) ? redisProperties.getPassword() : null);
        Duration timeout = redisProperties.getTimeout();
        if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
            server.setTimeout((int) timeout.toMillis());
        }
        return Redisson.create(config);
    }

    private String buildAddress(RedisProperties redisProperties) {
        boolean sslEnabled = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        String scheme = sslEnabled ? "rediss://" : "redis://";
        return scheme + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
