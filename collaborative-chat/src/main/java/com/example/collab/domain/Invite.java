package com.example.collab.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Invite implements Serializable {

    private String id;
    private String chatId;
    private String code;
    private String createdBy;
    private Integer maxUses;
    private int useCount;
    private boolean active;
    private Instant expiresAt;
    private Instant createdAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isExhausted() {
        return maxUses != null && useCount >= maxUses;
    }

    public Integer remainingUses() {
        return maxUses == null ? null : Math.max(0, maxUses - useCount);
    }
}
