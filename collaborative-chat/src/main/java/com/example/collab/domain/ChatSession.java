package com.example.collab.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession implements Serializable {

    private String id;
    private String ownerId;
    private boolean collaborative;
    private int maxParticipants;
    private String title;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }
}
