package com.example.collab.dto;

import com.example.collab.domain.Invite;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InviteResponse {
    String id;
    String chatId;
    String code;
    Integer maxUses;
    int useCount;
    Integer remainingUses;
    boolean active;
    Instant expiresAt;
    Instant createdAt;

    public static InviteResponse from(Invite invite) {
        if (invite == null) {
            return null;
        }
        return InviteResponse.builder()
                .id(invite.getId())
                .chatId(invite.getChatId())
                .code(invite.getCode())
                .maxUses(invite.getMaxUses())
                .useCount(invite.getUseCount())
                .remainingUses(invite.remainingUses())
                .active(invite.isActive())
                .expiresAt(invite.getExpiresAt())
                .createdAt(invite.getCreatedAt())
                .build();
    }
}
