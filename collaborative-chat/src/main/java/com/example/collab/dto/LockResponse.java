package com.example.collab.dto;

import com.example.collab.service.LockManager.LockAcquisition;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LockResponse {
    String chatId;
    boolean acquired;
    String holder;
    Instant lockedAt;
    Instant expiresAt;
    long leaseSeconds;

    public static LockResponse from(LockAcquisition acquisition) {
        return LockResponse.builder()
                .chatId(acquisition.chatId())
                .acquired(acquisition.acquired())
                .holder(acquisition.holder())
                .lockedAt(acquisition.lockedAt())
                .expiresAt(acquisition.expiresAt())
                .leaseSeconds(acquisition.lease().toSeconds())
                .build();
    }
}
