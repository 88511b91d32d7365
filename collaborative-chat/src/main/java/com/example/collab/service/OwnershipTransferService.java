package com.example.collab.service;

import com.example.collab.domain.ChatSession;
import com.example.collab.domain.Participant;
import com.example.collab.domain.ParticipantRole;
import com.example.collab.event.CollabEventPublisher;
import com.example.collab.event.CollabEventType;
import com.example.collab.persistence.ChatSessionJpaRepository;
import com.example.collab.persistence.ParticipantJpaRepository;
import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import com.example.collab.store.TransactionalStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Hands the owner role to another accepted participant. The session's owner id, the new owner's row (OWNER, color
 * 0) and the previous owner's row (PARTICIPANT, the vacated color) change together or not at all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OwnershipTransferService {

    private static final int OWNER_COLOR = 0;

    private final TransactionalStore store;
    private final ParticipantRegistry participantRegistry;
    private final ChatSessionJpaRepository sessionRepository;
    private final ParticipantJpaRepository participantRepository;
    private final CollabEventPublisher eventPublisher;
    private final MembershipAuditLogger auditLogger;
    private final Clock clock;

    public TransferResult transfer(String chatId, String currentOwnerId, String newOwnerId) {
        if (!StringUtils.hasText(chatId) || !StringUtils.hasText(currentOwnerId) || !StringUtils.hasText(newOwnerId)) {
            throw new ServiceException(FailureReason.INVALID_REQUEST, "Chat id and both user ids are required");
        }
        if (currentOwnerId.equals(newOwnerId)) {
            throw new ServiceException(FailureReason.SELF_TRANSFER, "Ownership cannot be transferred to yourself");
        }

        TransferResult result = store.execute(chatId, tx -> {
            ChatSession session = participantRegistry.requireCollaborativeSession(chatId);
            if (!session.isOwnedBy(currentOwnerId)) {
                return TransferResult.rejected(TransferStatus.FORBIDDEN, FailureReason.NOT_OWNER);
            }
            Optional<Participant> target = participantRegistry.findMembership(chatId, newOwnerId)
                    .filter(Participant::isAccepted);
            if (target.isEmpty()) {
                return TransferResult.rejected(TransferStatus.CONFLICT, FailureReason.NEW_OWNER_NOT_MEMBER);
            }
            int vacatedColor = target.get().getColorIndex();
            Instant now = clock.instant();

            tx.requireUpdated(
                    sessionRepository.transferOwner(chatId, currentOwnerId, newOwnerId, now), "owner reassignment");
            tx.compensate(() -> sessionRepository.transferOwner(chatId, newOwnerId, currentOwnerId, now));

            tx.requireUpdated(
                    participantRepository.assignRole(
                            chatId, newOwnerId, ParticipantRole.PARTICIPANT, ParticipantRole.OWNER, OWNER_COLOR),
                    "new owner promotion");
            tx.compensate(() -> participantRepository.assignRole(
                    chatId, newOwnerId, ParticipantRole.OWNER, ParticipantRole.PARTICIPANT, vacatedColor));

            tx.requireUpdated(
                    participantRepository.assignRole(
                            chatId, currentOwnerId, ParticipantRole.OWNER, ParticipantRole.PARTICIPANT, vacatedColor),
                    "previous owner demotion");
            return TransferResult.transferred(currentOwnerId, newOwnerId);
        });

        if (result.status() == TransferStatus.TRANSFERRED) {
            auditLogger.record("TRANSFER_OWNERSHIP", chatId, currentOwnerId, newOwnerId);
            eventPublisher.publish(CollabEventType.OWNERSHIP_TRANSFERRED, chatId,
                    Map.of("previousOwnerId", currentOwnerId, "newOwnerId", newOwnerId));
        } else {
            log.debug("Transfer of chat {} from {} to {} rejected: {}",
                    chatId, currentOwnerId, newOwnerId, result.reason());
        }
        return result;
    }

    public enum TransferStatus {
        TRANSFERRED,
        FORBIDDEN,
        CONFLICT
    }

    public record TransferResult(
            TransferStatus status, FailureReason reason, String previousOwnerId, String newOwnerId) {

        static TransferResult transferred(String previousOwnerId, String newOwnerId) {
            return new TransferResult(TransferStatus.TRANSFERRED, null, previousOwnerId, newOwnerId);
        }

        static TransferResult rejected(TransferStatus status, FailureReason reason) {
            return new TransferResult(status, reason, null, null);
        }
    }
}
