package com.example.collab.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

/**
 * One row per chat at most; the primary key on {@code chat_id} is what makes a competing insert fail.
 */
@Getter
@Setter
@Entity
@Table(name = "chat_locks")
public class ChatLockEntity {

    @Id
    @Column(name = "chat_id", nullable = false, updatable = false, length = 64)
    private String chatId;

    @Column(name = "locked_by", nullable = false, length = 128)
    private String lockedBy;

    @Column(name = "locked_at", nullable = false)
    private Instant lockedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
