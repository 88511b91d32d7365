package com.example.collab.dto;

import com.example.collab.domain.ChatLock;
import com.example.collab.service.LockManager.PromptCheck;
import com.example.collab.service.LockManager.PromptStatus;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PromptStatusResponse {
    String chatId;
    PromptStatus status;
    boolean canPrompt;
    String holder;
    Instant expiresAt;
    long leaseSeconds;

    public static PromptStatusResponse from(String chatId, PromptCheck check, Duration lease) {
        ChatLock lock = check.lock();
        return PromptStatusResponse.builder()
                .chatId(chatId)
                .status(check.status())
                .canPrompt(check.allowed())
                .holder(lock != null ? lock.getLockedBy() : null)
                .expiresAt(lock != null ? lock.getExpiresAt() : null)
                .leaseSeconds(lease.toSeconds())
                .build();
    }
}
