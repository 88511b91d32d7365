package com.example.collab.event;

import com.example.collab.config.CollabProperties;
import com.example.collab.service.RedisKeyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Best-effort fan-out of collaboration events. Delivery failures are logged and never reach the caller, because the
 * database already holds the committed truth.
 */
@Slf4j
@Component
public class CollabEventPublisher {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final KafkaTemplate<String, CollabEvent> collabEventKafkaTemplate;
    private final CollabProperties collabProperties;
    private final Clock clock;
    private final TypedJsonJacksonCodec eventCodec;

    public CollabEventPublisher(
            RedissonClient redissonClient,
            RedisKeyFactory keyFactory,
            ObjectMapper objectMapper,
            KafkaTemplate<String, CollabEvent> collabEventKafkaTemplate,
            CollabProperties collabProperties,
            Clock clock) {
        this.redissonClient = redissonClient;
        this.keyFactory = keyFactory;
        this.collabEventKafkaTemplate = collabEventKafkaTemplate;
        this.collabProperties = collabProperties;
        this.clock = clock;
        this.eventCodec = new TypedJsonJacksonCodec(CollabEvent.class, objectMapper);
    }

    public void publish(CollabEventType type, String chatId, Map<String, Object> payload) {
        publish(CollabEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .chatId(chatId)
                .occurredAt(clock.instant())
                .payload(payload == null ? Map.of() : new LinkedHashMap<>(payload))
                .build());
    }

    /**
     * Publishes immediately, or after commit when called inside a transaction.
     */
    public void publish(CollabEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(event);
                }
            });
            return;
        }
        dispatch(event);
    }

    private void dispatch(CollabEvent event) {
        try {
            RTopic topic = redissonClient.getTopic(keyFactory.eventTopicName(), eventCodec);
            topic.publish(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} for chat {} to Redis", event.getType(), event.getChatId(), ex);
        }

        if (event.getType().isEphemeral() || !collabProperties.getKafka().isEnabled()) {
            return;
        }
        try {
            collabEventKafkaTemplate
                    .send(collabProperties.getKafka().getLifecycleTopic(), event.getChatId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to mirror {} for chat {} to Kafka",
                                    event.getType(), event.getChatId(), ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.warn("Failed to mirror {} for chat {} to Kafka", event.getType(), event.getChatId(), ex);
        }
    }
}
