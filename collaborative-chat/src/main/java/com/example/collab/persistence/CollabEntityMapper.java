package com.example.collab.persistence;

import com.example.collab.domain.ChatLock;
import com.example.collab.domain.ChatSession;
import com.example.collab.domain.Invite;
import com.example.collab.domain.Participant;
import org.springframework.stereotype.Component;

@Component
public class CollabEntityMapper {

    public ChatSession toSession(ChatSessionEntity entity) {
        if (entity == null) {
            return null;
        }
        return ChatSession.builder()
                .id(entity.getId())
                .ownerId(entity.getOwnerId())
                .collaborative(entity.isCollaborative())
                .maxParticipants(entity.getMaxParticipants())
                .title(entity.getTitle())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public ChatSessionEntity toEntity(ChatSession session) {
        ChatSessionEntity entity = new ChatSessionEntity();
        entity.setId(session.getId());
        entity.setOwnerId(session.getOwnerId());
        entity.setCollaborative(session.isCollaborative());
        entity.setMaxParticipants(session.getMaxParticipants());
        entity.setTitle(session.getTitle());
        entity.setCreatedAt(session.getCreatedAt());
        entity.setUpdatedAt(session.getUpdatedAt());
        return entity;
    }

    public Participant toParticipant(ParticipantEntity entity) {
        if (entity == null) {
            return null;
        }
        return Participant.builder()
                .id(entity.getId())
                .chatId(entity.getChatId())
                .userId(entity.getUserId())
                .role(entity.getRole())
                .status(entity.getStatus())
                .colorIndex(entity.getColorIndex())
                .invitedBy(entity.getInvitedBy())
                .joinedAt(entity.getJoinedAt())
                .build();
    }

    public ParticipantEntity toEntity(Participant participant) {
        ParticipantEntity entity = new ParticipantEntity();
        entity.setId(participant.getId());
        entity.setChatId(participant.getChatId());
        entity.setUserId(participant.getUserId());
        entity.setRole(participant.getRole());
        entity.setStatus(participant.getStatus());
        entity.setColorIndex(participant.getColorIndex());
        entity.setInvitedBy(participant.getInvitedBy());
        entity.setJoinedAt(participant.getJoinedAt());
        return entity;
    }

    public ChatLock toLock(ChatLockEntity entity) {
        if (entity == null) {
            return null;
        }
        return ChatLock.builder()
                .chatId(entity.getChatId())
                .lockedBy(entity.getLockedBy())
                .lockedAt(entity.getLockedAt())
                .expiresAt(entity.getExpiresAt())
                .build();
    }

    public Invite toInvite(InviteEntity entity) {
        if (entity == null) {
            return null;
        }
        return Invite.builder()
                .id(entity.getId())
                .chatId(entity.getChatId())
                .code(entity.getCode())
                .createdBy(entity.getCreatedBy())
                .maxUses(entity.getMaxUses())
                .useCount(entity.getUseCount())
                .active(entity.isActive())
                .expiresAt(entity.getExpiresAt())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public InviteEntity toEntity(Invite invite) {
        InviteEntity entity = new InviteEntity();
        entity.setId(invite.getId());
        entity.setChatId(invite.getChatId());
        entity.setCode(invite.getCode());
        entity.setCreatedBy(invite.getCreatedBy());
        entity.setMaxUses(invite.getMaxUses());
        entity.setUseCount(invite.getUseCount());
        entity.setActive(invite.isActive());
        entity.setExpiresAt(invite.getExpiresAt());
        entity.setCreatedAt(invite.getCreatedAt());
        return entity;
    }
}
