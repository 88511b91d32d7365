package com.example.collab.service;

import com.example.collab.config.CollabProperties;
import com.example.collab.domain.ChatSession;
import com.example.collab.domain.Invite;
import com.example.collab.domain.Participant;
import com.example.collab.domain.ParticipantRole;
import com.example.collab.domain.ParticipantStatus;
import com.example.collab.event.CollabEventPublisher;
import com.example.collab.event.CollabEventType;
import com.example.collab.persistence.ChatSessionJpaRepository;
import com.example.collab.persistence.CollabEntityMapper;
import com.example.collab.persistence.ParticipantJpaRepository;
import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import com.example.collab.store.ConcurrentUpdateException;
import com.example.collab.store.StoreTransaction;
import com.example.collab.store.TransactionalStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@RequiredArgsConstructor
public class CollaborativeSessionService {

    private static final int OWNER_COLOR = 0;
    private static final int MIN_PARTICIPANTS = 2;

    private final TransactionalStore store;
    private final ParticipantRegistry participantRegistry;
    private final MembershipCoordinator membershipCoordinator;
    private final ChatSessionJpaRepository sessionRepository;
    private final ParticipantJpaRepository participantRepository;
    private final CollabEntityMapper mapper;
    private final CollabEventPublisher eventPublisher;
    private final MembershipAuditLogger auditLogger;
    private final CollabProperties collabProperties;
    private final Clock clock;

    /**
     * New collaborative chat with the caller as owner and a first invite for the remaining seats.
     */
    public SessionCreation createSession(String ownerId, String title, Integer maxParticipants) {
        requireText(ownerId, "User id");
        int capacity = resolveCapacity(maxParticipants);
        String chatId = UUID.randomUUID().toString();

        SessionCreation creation = store.execute(chatId, tx -> {
            Instant now = clock.instant();
            ChatSession session = ChatSession.builder()
                    .id(chatId)
                    .ownerId(ownerId)
                    .collaborative(true)
                    .maxParticipants(capacity)
                    .title(resolveTitle(title, null))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            try {
                sessionRepository.saveAndFlush(mapper.toEntity(session));
            } catch (DataIntegrityViolationException ex) {
                throw new ConcurrentUpdateException("session insert");
            }
            tx.compensate(() -> sessionRepository.deleteById(chatId));

            Participant owner = membershipCoordinator.insertParticipant(tx, ownerRow(chatId, ownerId, now));
            Invite invite = membershipCoordinator.issueInvite(tx, session, ownerId, capacity - 1, null);
            return new SessionCreation(session, owner, invite);
        });

        auditLogger.record("CREATE", chatId, ownerId, ownerId, Map.of("maxParticipants", capacity));
        eventPublisher.publish(CollabEventType.SESSION_CREATED, chatId, Map.of("ownerId", ownerId));
        return creation;
    }

    /**
     * Turns an existing chat collaborative, or re-enables one whose owner dissolved it earlier.
     */
    public SessionCreation convertToCollaborative(String chatId, String ownerId, String title, Integer maxParticipants) {
        requireText(chatId, "Chat id");
        requireText(ownerId, "User id");
        int capacity = resolveCapacity(maxParticipants);

        SessionCreation creation = store.execute(chatId, tx -> {
            Instant now = clock.instant();
            Optional<ChatSession> existing = participantRegistry.findSession(chatId);
            ChatSession session;
            if (existing.isPresent()) {
                ChatSession current = existing.get();
                if (current.isCollaborative()) {
                    throw new ServiceException(FailureReason.ALREADY_COLLABORATIVE, "Chat is already collaborative");
                }
                if (!current.isOwnedBy(ownerId)) {
                    throw new ServiceException(FailureReason.NOT_OWNER, "Only the chat owner can convert it");
                }
                String resolvedTitle = resolveTitle(title, current.getTitle());
                tx.requireUpdated(
                        sessionRepository.enableCollaboration(chatId, ownerId, resolvedTitle, capacity, now),
                        "collaboration enable");
                tx.compensate(() -> sessionRepository.dissolve(chatId, ownerId, now));
                session = current.toBuilder()
                        .collaborative(true)
                        .title(resolvedTitle)
                        .maxParticipants(capacity)
                        .updatedAt(now)
                        .build();
            } else {
                session = ChatSession.builder()
                        .id(chatId)
                        .ownerId(ownerId)
                        .collaborative(true)
                        .maxParticipants(capacity)
                        .title(resolveTitle(title, null))
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
                try {
                    sessionRepository.saveAndFlush(mapper.toEntity(session));
                } catch (DataIntegrityViolationException ex) {
                    throw new ConcurrentUpdateException("session insert");
                }
                tx.compensate(() -> sessionRepository.deleteById(chatId));
            }

            Participant owner = seatOwner(tx, chatId, ownerId, now);
            Invite invite = membershipCoordinator.issueInvite(tx, session, ownerId, capacity - 1, null);
            return new SessionCreation(session, owner, invite);
        });

        auditLogger.record("CONVERT", chatId, ownerId, ownerId, Map.of("maxParticipants", capacity));
        eventPublisher.publish(CollabEventType.SESSION_CONVERTED, chatId, Map.of("ownerId", ownerId));
        return creation;
    }

    public List<ChatSession> listMyChats(String userId) {
        requireText(userId, "User id");
        return participantRegistry.collaborativeChatsFor(userId);
    }

    public ParticipantRegistry.ParticipantsView listParticipants(String chatId, String callerId) {
        requireText(chatId, "Chat id");
        return participantRegistry.listParticipants(chatId, callerId);
    }

    private Participant seatOwner(StoreTransaction tx, String chatId, String ownerId, Instant now) {
        Optional<Participant> previous = participantRegistry.findMembership(chatId, ownerId);
        if (previous.isEmpty()) {
            return membershipCoordinator.insertParticipant(tx, ownerRow(chatId, ownerId, now));
        }
        Participant row = previous.get();
        if (row.getStatus() == ParticipantStatus.REMOVED) {
            tx.requireUpdated(
                    participantRepository.reactivate(chatId, ownerId, ParticipantRole.OWNER, OWNER_COLOR, ownerId),
                    "owner reactivation");
            tx.compensate(() -> participantRepository.deleteMembership(chatId, ownerId));
        } else if (!row.isOwner()) {
            tx.requireUpdated(
                    participantRepository.assignRole(
                            chatId, ownerId, ParticipantRole.PARTICIPANT, ParticipantRole.OWNER, OWNER_COLOR),
                    "owner promotion");
        }
        return row.toBuilder()
                .role(ParticipantRole.OWNER)
                .status(ParticipantStatus.ACCEPTED)
                .colorIndex(OWNER_COLOR)
                .build();
    }

    private Participant ownerRow(String chatId, String ownerId, Instant now) {
        return Participant.builder()
                .chatId(chatId)
                .userId(ownerId)
                .role(ParticipantRole.OWNER)
                .status(ParticipantStatus.ACCEPTED)
                .colorIndex(OWNER_COLOR)
                .invitedBy(ownerId)
                .joinedAt(now)
                .build();
    }

    private int resolveCapacity(Integer requested) {
        int cap = collabProperties.getSession().getMaxParticipantsCap();
        if (requested == null) {
            return cap;
        }
        if (requested < MIN_PARTICIPANTS || requested > cap) {
            throw new ServiceException(FailureReason.INVALID_REQUEST,
                    "maxParticipants must be between %d and %d".formatted(MIN_PARTICIPANTS, cap));
        }
        return requested;
    }

    private String resolveTitle(String requested, String current) {
        if (StringUtils.hasText(requested)) {
            return requested.trim();
        }
        if (StringUtils.hasText(current)) {
            return current;
        }
        return collabProperties.getSession().getDefaultTitle();
    }

    private void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new ServiceException(FailureReason.INVALID_REQUEST, name + " is required");
        }
    }

    public record SessionCreation(ChatSession session, Participant owner, Invite invite) {}
}
