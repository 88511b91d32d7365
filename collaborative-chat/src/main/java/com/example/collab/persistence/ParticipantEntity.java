package com.example.collab.persistence;

import com.example.collab.domain.ParticipantRole;
import com.example.collab.domain.ParticipantStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "chat_participants",
        uniqueConstraints = @UniqueConstraint(name = "uk_chat_participants_chat_user", columnNames = {"chat_id", "user_id"}),
        indexes = @Index(name = "idx_chat_participants_user_status", columnList = "user_id, status"))
public class ParticipantEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "chat_id", nullable = false, updatable = false, length = 64)
    private String chatId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private ParticipantRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ParticipantStatus status;

    @Column(name = "color_index", nullable = false)
    private int colorIndex;

    @Column(name = "invited_by", length = 128)
    private String invitedBy;

    @Column(name = "joined_at", nullable = false)
    private Instant joinedAt;
}
