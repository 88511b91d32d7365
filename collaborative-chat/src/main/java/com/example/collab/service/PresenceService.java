package com.example.collab.service;

import com.example.collab.config.CollabProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RMapCache;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Who currently has a socket open on a chat. Entries expire on their own when a replica dies without cleaning up.
 */
@Service
@RequiredArgsConstructor
public class PresenceService {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final CollabProperties collabProperties;
    private final Clock clock;

    public void markOnline(String chatId, String userId) {
        if (!StringUtils.hasText(chatId) || !StringUtils.hasText(userId)) {
            return;
        }
        Duration ttl = collabProperties.getRedis().getPresenceTtl();
        presence(chatId).put(userId, clock.instant().toString(), ttl.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void markOffline(String chatId, String userId) {
        if (!StringUtils.hasText(chatId) || !StringUtils.hasText(userId)) {
            return;
        }
        presence(chatId).fastRemove(userId);
    }

    public Set<String> onlineUsers(String chatId) {
        if (!StringUtils.hasText(chatId)) {
            return Set.of();
        }
        return new TreeSet<>(presence(chatId).readAllKeySet());
    }

    private RMapCache<String, String> presence(String chatId) {
        return redissonClient.getMapCache(keyFactory.presenceKey(chatId));
    }
}
