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
public class ChatLock implements Serializable {

    private String chatId;
    private String lockedBy;
    private Instant lockedAt;
    private Instant expiresAt;

    /**
     * A lock whose expiry is not strictly in the future has no holder, whether or not its row still exists.
     */
    public boolean isHeldAt(Instant now) {
        return expiresAt != null && expiresAt.isAfter(now);
    }
}
