package com.example.collab.dto;

import com.example.collab.domain.ChatSession;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SessionResponse {
    String chatId;
    String title;
    String ownerId;
    @JsonProperty("isOwner")
    boolean owner;
    boolean collaborative;
    int maxParticipants;
    Instant createdAt;
    Instant updatedAt;

    public static SessionResponse from(ChatSession session, String callerId) {
        return SessionResponse.builder()
                .chatId(session.getId())
                .title(session.getTitle())
                .ownerId(session.getOwnerId())
                .owner(session.isOwnedBy(callerId))
                .collaborative(session.isCollaborative())
                .maxParticipants(session.getMaxParticipants())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .build();
    }
}
