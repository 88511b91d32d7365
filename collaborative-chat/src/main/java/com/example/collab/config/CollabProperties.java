package com.example.collab.config;

import com.example.collab.store.StoreMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "collab")
public class CollabProperties {

    private String namespace = "collab";

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Lock lock = new Lock();

    @NestedConfigurationProperty
    private final Session session = new Session();

    @NestedConfigurationProperty
    private final Invite invite = new Invite();

    @NestedConfigurationProperty
    private final Housekeeping housekeeping = new Housekeeping();

    @NestedConfigurationProperty
    private final Store store = new Store();

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Lock getLock() {
        return lock;
    }

    public Session getSession() {
        return session;
    }

    public Invite getInvite() {
        return invite;
    }

    public Housekeeping getHousekeeping() {
        return housekeeping;
    }

    public Store getStore() {
        return store;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the collaboration module.
         */
        private String keyPrefix = "collab";

        /**
         * Redis key time-to-live for presence entries.
         */
        private Duration presenceTtl = Duration.ofMinutes(5);

        /**
         * Pub/sub topic used to fan events out to every replica.
         */
        private String eventTopic = "events";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getPresenceTtl() {
            return presenceTtl;
        }

        public void setPresenceTtl(Duration presenceTtl) {
            this.presenceTtl = presenceTtl;
        }

        public String getEventTopic() {
            return eventTopic;
        }

        public void setEventTopic(String eventTopic) {
            this.eventTopic = eventTopic;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic to publish collaboration lifecycle events.
         */
        private String lifecycleTopic = "collab.lifecycle";

        /**
         * Disables the Kafka mirror entirely, e.g. for local runs without a broker.
         */
        private boolean enabled = true;

        public String getLifecycleTopic() {
            return lifecycleTopic;
        }

        public void setLifecycleTopic(String lifecycleTopic) {
            this.lifecycleTopic = lifecycleTopic;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    @Validated
    public static class Lock {

        /**
         * How long a prompt lock survives without being released or refreshed.
         */
        @NotNull
        private Duration lease = Duration.ofMinutes(2);

        public Duration getLease() {
            return lease;
        }

        public void setLease(Duration lease) {
            this.lease = lease;
        }
    }

    @Validated
    public static class Session {

        /**
         * Upper bound for the number of accepted participants, owner included.
         */
        @Min(2)
        @Max(16)
        private int maxParticipantsCap = 3;

        private String defaultTitle = "Collaborative Chat";

        public int getMaxParticipantsCap() {
            return maxParticipantsCap;
        }

        public void setMaxParticipantsCap(int maxParticipantsCap) {
            this.maxParticipantsCap = maxParticipantsCap;
        }

        public String getDefaultTitle() {
            return defaultTitle;
        }

        public void setDefaultTitle(String defaultTitle) {
            this.defaultTitle = defaultTitle;
        }
    }

    @Validated
    public static class Invite {

        @Min(8)
        @Max(32)
        private int codeLength = 12;

        /**
         * Expiry applied to invites created without an explicit one. Unset means invites never expire.
         */
        private Duration defaultTtl;

        public int getCodeLength() {
            return codeLength;
        }

        public void setCodeLength(int codeLength) {
            this.codeLength = codeLength;
        }

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }
    }

    @Validated
    public static class Housekeeping {

        /**
         * Interval between automatic housekeeping cycles.
         */
        private Duration interval = Duration.ofMinutes(1);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    @Validated
    public static class Store {

        /**
         * {@code auto} probes the JDBC driver once at startup.
         */
        @NotNull
        private StoreMode mode = StoreMode.AUTO;

        public StoreMode getMode() {
            return mode;
        }

        public void setMode(StoreMode mode) {
            this.mode = mode;
        }
    }
}
