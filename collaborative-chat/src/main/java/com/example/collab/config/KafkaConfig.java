package com.example.collab.config;

import com.example.collab.event.CollabEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, CollabEvent> collabEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, CollabEvent> collabEventKafkaTemplate(
            ProducerFactory<String, CollabEvent> collabEventProducerFactory) {
        return new KafkaTemplate<>(collabEventProducerFactory);
    }

    /**
     * Keyed by chat id, so one chat's lifecycle stays ordered within a partition.
     */
    @Bean
    public NewTopic collabLifecycleTopic(CollabProperties collabProperties) {
        return TopicBuilder.name(collabProperties.getKafka().getLifecycleTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
