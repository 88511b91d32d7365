package com.example.collab.service;

import com.example.collab.domain.ChatSession;
import com.example.collab.domain.Participant;
import com.example.collab.event.CollabEventPublisher;
import com.example.collab.event.CollabEventType;
import com.example.collab.persistence.ChatLockJpaRepository;
import com.example.collab.persistence.ChatSessionJpaRepository;
import com.example.collab.persistence.CollabEntityMapper;
import com.example.collab.persistence.InviteEntity;
import com.example.collab.persistence.InviteJpaRepository;
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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Leaving and removal. Memberships are soft-deleted so a later rejoin reuses the row; a departing user's prompt
 * lock goes with them.
 */
@Service
@RequiredArgsConstructor
public class ParticipantDepartureService {

    private final TransactionalStore store;
    private final ParticipantRegistry participantRegistry;
    private final ChatSessionJpaRepository sessionRepository;
    private final ParticipantJpaRepository participantRepository;
    private final ChatLockJpaRepository lockRepository;
    private final InviteJpaRepository inviteRepository;
    private final CollabEntityMapper mapper;
    private final CollabEventPublisher eventPublisher;
    private final MembershipAuditLogger auditLogger;
    private final Clock clock;

    /**
     * A participant leaves; the owner may only leave when alone, which dissolves the collaboration.
     */
    public DepartureResult leave(String chatId, String userId) {
        requireText(chatId, "Chat id");
        requireText(userId, "User id");

        DepartureResult result = store.execute(chatId, tx -> {
            ChatSession session = participantRegistry.requireSession(chatId);
            Participant membership = participantRegistry.findMembership(chatId, userId)
                    .filter(Participant::isAccepted)
                    .orElse(null);
            if (!session.isCollaborative() || membership == null) {
                throw new ServiceException(FailureReason.NOT_A_MEMBER, "User is not a member of this chat");
            }
            if (session.isOwnedBy(userId)) {
                return dissolve(tx, session, membership);
            }
            tx.requireUpdated(participantRepository.markRemoved(chatId, userId), "participant leave");
            tx.compensate(() -> participantRepository.restore(chatId, userId));
            boolean lockReleased = lockRepository.release(chatId, userId) > 0;
            return DepartureResult.left(userId, lockReleased);
        });

        publish(chatId, userId, result);
        return result;
    }

    public DepartureResult removeParticipant(String chatId, String callerId, String targetUserId) {
        requireText(chatId, "Chat id");
        requireText(callerId, "User id");
        requireText(targetUserId, "Target user id");

        DepartureResult result = store.execute(chatId, tx -> {
            ChatSession session = participantRegistry.requireCollaborativeSession(chatId);
            if (session.isOwnedBy(targetUserId)) {
                throw new ServiceException(FailureReason.OWNER_NOT_REMOVABLE, "The owner cannot be removed");
            }
            if (!session.isOwnedBy(callerId) && !callerId.equals(targetUserId)) {
                throw new ServiceException(FailureReason.NOT_OWNER, "Only the owner can remove other participants");
            }
            if (participantRepository.markRemoved(chatId, targetUserId) == 0) {
                throw new ServiceException(FailureReason.PARTICIPANT_NOT_FOUND, "Participant not found");
            }
            tx.compensate(() -> participantRepository.restore(chatId, targetUserId));
            boolean lockReleased = lockRepository.release(chatId, targetUserId) > 0;
            return DepartureResult.removed(targetUserId, lockReleased);
        });

        publish(chatId, callerId, result);
        return result;
    }

    private DepartureResult dissolve(StoreTransaction tx, ChatSession session, Participant ownerRow) {
        String chatId = session.getId();
        String ownerId = session.getOwnerId();
        if (participantRegistry.acceptedCount(chatId) > 1) {
            throw new ServiceException(FailureReason.OWNER_HAS_PARTICIPANTS,
                    "Transfer ownership or remove the other participants before leaving");
        }
        Instant now = clock.instant();
        tx.requireUpdated(sessionRepository.dissolve(chatId, ownerId, now), "session dissolution");
        tx.compensate(() -> sessionRepository.restoreCollaboration(chatId, ownerId, now));

        tx.requireUpdated(participantRepository.deleteMembership(chatId, ownerId), "owner removal");
        tx.compensate(() -> participantRepository.saveAndFlush(mapper.toEntity(ownerRow.toBuilder().id(null).build())));

        // Invites go before the recount so a join that claims a use afterwards sees the dissolved session.
        List<String> deactivated = inviteRepository.findByChatIdAndActiveTrueOrderByCreatedAtDesc(chatId).stream()
                .map(InviteEntity::getId)
                .toList();
        if (!deactivated.isEmpty()) {
            inviteRepository.deactivateActive(chatId);
            tx.compensate(() -> inviteRepository.reactivate(deactivated));
        }

        // Somebody may have been admitted between the count and the dissolution.
        if (participantRegistry.acceptedCount(chatId) > 0) {
            throw new ConcurrentUpdateException("owner leave");
        }
        lockRepository.clear(chatId);
        return DepartureResult.dissolved(ownerId);
    }

    private void publish(String chatId, String actorId, DepartureResult result) {
        switch (result.status()) {
            case LEFT -> {
                auditLogger.record("LEAVE", chatId, actorId, result.userId(),
                        Map.of("lockReleased", result.lockReleased()));
                eventPublisher.publish(CollabEventType.PARTICIPANT_LEFT, chatId, Map.of("userId", result.userId()));
            }
            case REMOVED -> {
                auditLogger.record("REMOVE", chatId, actorId, result.userId(),
                        Map.of("lockReleased", result.lockReleased()));
                eventPublisher.publish(CollabEventType.PARTICIPANT_REMOVED, chatId,
                        Map.of("userId", result.userId(), "removedBy", actorId));
            }
            case SESSION_DISSOLVED -> {
                auditLogger.record("DISSOLVE", chatId, actorId, result.userId());
                eventPublisher.publish(CollabEventType.SESSION_DISSOLVED, chatId, Map.of("ownerId", result.userId()));
            }
            default -> throw new IllegalStateException("Unexpected departure status " + result.status());
        }
        if (result.lockReleased()) {
            eventPublisher.publish(CollabEventType.LOCK_RELEASED, chatId, Map.of("userId", result.userId()));
        }
    }

    private void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new ServiceException(FailureReason.INVALID_REQUEST, name + " is required");
        }
    }

    public enum DepartureStatus {
        LEFT,
        REMOVED,
        SESSION_DISSOLVED
    }

    public record DepartureResult(DepartureStatus status, String userId, boolean lockReleased) {

        static DepartureResult left(String userId, boolean lockReleased) {
            return new DepartureResult(DepartureStatus.LEFT, userId, lockReleased);
        }

        static DepartureResult removed(String userId, boolean lockReleased) {
            return new DepartureResult(DepartureStatus.REMOVED, userId, lockReleased);
        }

        static DepartureResult dissolved(String ownerId) {
            return new DepartureResult(DepartureStatus.SESSION_DISSOLVED, ownerId, false);
        }
    }
}
