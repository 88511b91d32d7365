package com.example.collab.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "chat_invites", indexes = @Index(name = "idx_chat_invites_chat_active", columnList = "chat_id, is_active"))
public class InviteEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "chat_id", nullable = false, updatable = false, length = 64)
    private String chatId;

    @Column(name = "invite_code", nullable = false, unique = true, updatable = false, length = 32)
    private String code;

    @Column(name = "created_by", nullable = false, length = 128)
    private String createdBy;

    @Column(name = "max_uses")
    private Integer maxUses;

    @Column(name = "use_count", nullable = false)
    private int useCount;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
