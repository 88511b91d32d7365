package com.example.collab.event;

import com.example.collab.service.RedisKeyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.stereotype.Component;

/**
 * Receives events published by any replica and hands them to this replica's listeners.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollabEventSubscriber {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final ObjectMapper objectMapper;
    private final List<CollabEventListener> listeners;

    private RTopic eventTopic;
    private int topicListenerId;

    @PostConstruct
    public void subscribe() {
        eventTopic = redissonClient.getTopic(
                keyFactory.eventTopicName(), new TypedJsonJacksonCodec(CollabEvent.class, objectMapper));
        topicListenerId = eventTopic.addListener(CollabEvent.class, (channel, event) -> deliver(event));
    }

    @PreDestroy
    public void shutdown() {
        if (eventTopic != null) {
            eventTopic.removeListener(topicListenerId);
        }
    }

    void deliver(CollabEvent event) {
        if (event == null || event.getType() == null) {
            return;
        }
        for (CollabEventListener listener : listeners) {
            try {
                listener.onCollabEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on {} for chat {}",
                        listener.getClass().getSimpleName(), event.getType(), event.getChatId(), ex);
            }
        }
    }
}
