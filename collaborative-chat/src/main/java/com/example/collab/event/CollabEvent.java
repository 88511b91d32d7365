package com.example.collab.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Notification that collaboration state changed. Payloads carry ids only; clients re-query for details.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollabEvent implements Serializable {

    private String eventId;
    private CollabEventType type;
    private String chatId;
    private Instant occurredAt;
    private Map<String, Object> payload;
}
