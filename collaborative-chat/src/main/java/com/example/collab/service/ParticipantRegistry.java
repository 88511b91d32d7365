package com.example.collab.service;

import com.example.collab.domain.ChatSession;
import com.example.collab.domain.Participant;
import com.example.collab.domain.ParticipantStatus;
import com.example.collab.persistence.ChatSessionJpaRepository;
import com.example.collab.persistence.CollabEntityMapper;
import com.example.collab.persistence.ParticipantJpaRepository;
import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Authoritative read model for who belongs to a collaborative chat. Every call reads the store; nothing is cached.
 */
@Service
@RequiredArgsConstructor
public class ParticipantRegistry {

    private final ChatSessionJpaRepository sessionRepository;
    private final ParticipantJpaRepository participantRepository;
    private final CollabEntityMapper mapper;

    public Optional<ChatSession> findSession(String chatId) {
        if (!StringUtils.hasText(chatId)) {
            return Optional.empty();
        }
        return sessionRepository.findById(chatId).map(mapper::toSession);
    }

    public ChatSession requireSession(String chatId) {
        return findSession(chatId)
                .orElseThrow(() -> new ServiceException(FailureReason.CHAT_NOT_FOUND, "Chat not found"));
    }

    public ChatSession requireCollaborativeSession(String chatId) {
        ChatSession session = requireSession(chatId);
        if (!session.isCollaborative()) {
            throw new ServiceException(FailureReason.NOT_COLLABORATIVE, "Chat is not collaborative");
        }
        return session;
    }

    public Optional<Participant> findMembership(String chatId, String userId) {
        if (!StringUtils.hasText(chatId) || !StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        return participantRepository.findByChatIdAndUserId(chatId, userId).map(mapper::toParticipant);
    }

    /**
     * True for the owner or an accepted participant of a chat that is currently collaborative.
     */
    public boolean isActiveMember(String chatId, String userId) {
        Optional<ChatSession> session = findSession(chatId);
        if (session.isEmpty() || !session.get().isCollaborative()) {
            return false;
        }
        if (session.get().isOwnedBy(userId)) {
            return true;
        }
        return findMembership(chatId, userId).map(Participant::isAccepted).orElse(false);
    }

    public void requireActiveMember(String chatId, String userId) {
        if (!isActiveMember(chatId, userId)) {
            throw new ServiceException(FailureReason.NOT_A_MEMBER, "User is not a member of this chat");
        }
    }

    public List<Participant> acceptedParticipants(String chatId) {
        return participantRepository
                .findByChatIdAndStatusOrderByJoinedAtAsc(chatId, ParticipantStatus.ACCEPTED)
                .stream()
                .map(mapper::toParticipant)
                .toList();
    }

    public long acceptedCount(String chatId) {
        return participantRepository.countByChatIdAndStatus(chatId, ParticipantStatus.ACCEPTED);
    }

    public Set<Integer> usedColors(List<Participant> accepted) {
        return accepted.stream().map(Participant::getColorIndex).collect(Collectors.toSet());
    }

    public ParticipantsView listParticipants(String chatId, String callerId) {
        ChatSession session = requireSession(chatId);
        requireActiveMember(chatId, callerId);
        return new ParticipantsView(
                session.getId(),
                session.getOwnerId(),
                session.isOwnedBy(callerId),
                session.getMaxParticipants(),
                acceptedParticipants(chatId));
    }

    public List<ChatSession> collaborativeChatsFor(String userId) {
        if (!StringUtils.hasText(userId)) {
            return List.of();
        }
        return sessionRepository.findCollaborativeForMember(userId).stream()
                .map(mapper::toSession)
                .toList();
    }

    public record ParticipantsView(
            String chatId, String ownerId, boolean callerIsOwner, int maxParticipants, List<Participant> participants) {}
}
