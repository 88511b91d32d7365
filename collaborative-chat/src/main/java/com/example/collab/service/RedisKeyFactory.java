package com.example.collab.service;

import com.example.collab.config.CollabProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final CollabProperties collabProperties;

    public RedisKeyFactory(CollabProperties collabProperties) {
        this.collabProperties = collabProperties;
    }

    private String prefix() {
        return collabProperties.getRedis().getKeyPrefix();
    }

    public String presenceKey(String chatId) {
        return "%s:chat:%s:presence".formatted(prefix(), chatId);
    }

    public String socketSessionMapKey() {
        return "%s:socket:sessions".formatted(prefix());
    }

    public String eventTopicName() {
        return "%s:%s".formatted(prefix(), collabProperties.getRedis().getEventTopic());
    }
}
