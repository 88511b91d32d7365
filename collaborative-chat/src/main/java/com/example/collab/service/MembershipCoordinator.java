package com.example.collab.service;

import com.example.collab.config.CollabProperties;
import com.example.collab.domain.ChatSession;
import com.example.collab.domain.Invite;
import com.example.collab.domain.Participant;
import com.example.collab.domain.ParticipantRole;
import com.example.collab.domain.ParticipantStatus;
import com.example.collab.event.CollabEventPublisher;
import com.example.collab.event.CollabEventType;
import com.example.collab.persistence.CollabEntityMapper;
import com.example.collab.persistence.InviteEntity;
import com.example.collab.persistence.InviteJpaRepository;
import com.example.collab.persistence.ParticipantEntity;
import com.example.collab.persistence.ParticipantJpaRepository;
import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import com.example.collab.store.ConcurrentUpdateException;
import com.example.collab.store.StoreTransaction;
import com.example.collab.store.TransactionalStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Invite lifecycle and capacity-limited admission.
 *
 * <p>The capacity cap holds because every admission consumes one invite use through a compare-and-swap on
 * {@code use_count}, a chat has at most one active invite, and (in the atomic store) all writers of a chat queue on
 * its session row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipCoordinator {

    private static final int MAX_CODE_ATTEMPTS = 5;

    private final TransactionalStore store;
    private final ParticipantRegistry participantRegistry;
    private final InviteJpaRepository inviteRepository;
    private final ParticipantJpaRepository participantRepository;
    private final CollabEntityMapper mapper;
    private final InviteCodeGenerator codeGenerator;
    private final CollabEventPublisher eventPublisher;
    private final MembershipAuditLogger auditLogger;
    private final CollabProperties collabProperties;
    private final Clock clock;

    public InviteValidation validateInvite(String code) {
        if (!StringUtils.hasText(code)) {
            return InviteValidation.invalid(FailureReason.INVITE_INVALID);
        }
        Optional<Invite> found = inviteRepository.findByCode(code.trim()).map(mapper::toInvite);
        if (found.isEmpty() || !found.get().isActive()) {
            return InviteValidation.invalid(FailureReason.INVITE_INVALID);
        }
        Invite invite = found.get();
        if (invite.isExpiredAt(clock.instant())) {
            return InviteValidation.invalid(FailureReason.INVITE_EXPIRED);
        }
        if (invite.isExhausted()) {
            return InviteValidation.invalid(FailureReason.INVITE_EXHAUSTED);
        }
        Optional<ChatSession> session = participantRegistry.findSession(invite.getChatId());
        if (session.isEmpty() || !session.get().isCollaborative()) {
            return InviteValidation.invalid(FailureReason.INVITE_INVALID);
        }
        long accepted = participantRegistry.acceptedCount(invite.getChatId());
        if (accepted >= session.get().getMaxParticipants()) {
            return InviteValidation.invalid(FailureReason.CAPACITY_REACHED);
        }
        return InviteValidation.valid(new InviteSummary(
                invite.getChatId(),
                session.get().getTitle(),
                session.get().getOwnerId(),
                accepted,
                session.get().getMaxParticipants(),
                invite.remainingUses(),
                invite.getExpiresAt()));
    }

    public JoinResult join(String chatId, String userId, String inviteCode) {
        requireText(chatId, "Chat id");
        requireText(userId, "User id");
        requireText(inviteCode, "Invite code");

        JoinResult result = store.execute(chatId, tx -> admit(tx, chatId, userId, inviteCode.trim()));
        if (result.status() == JoinStatus.JOINED) {
            Participant participant = result.participant();
            auditLogger.record("JOIN", chatId, userId, userId,
                    Map.of("colorIndex", participant.getColorIndex(), "invitedBy", participant.getInvitedBy()));
            eventPublisher.publish(CollabEventType.PARTICIPANT_JOINED, chatId,
                    Map.of("userId", userId, "colorIndex", participant.getColorIndex()));
        } else {
            log.debug("Join of {} to chat {} rejected: {}", userId, chatId, result.reason());
        }
        return result;
    }

    private JoinResult admit(StoreTransaction tx, String chatId, String userId, String inviteCode) {
        Optional<ChatSession> found = participantRegistry.findSession(chatId);
        if (found.isEmpty()) {
            return JoinResult.rejected(JoinStatus.NOT_FOUND, FailureReason.CHAT_NOT_FOUND);
        }
        ChatSession session = found.get();
        if (!session.isCollaborative()) {
            return JoinResult.rejected(JoinStatus.FORBIDDEN, FailureReason.NOT_COLLABORATIVE);
        }

        Invite invite = inviteRepository.findByCode(inviteCode).map(mapper::toInvite).orElse(null);
        if (invite == null || !invite.isActive() || !chatId.equals(invite.getChatId())) {
            return JoinResult.rejected(JoinStatus.NOT_FOUND, FailureReason.INVITE_INVALID);
        }
        Instant now = clock.instant();
        if (invite.isExpiredAt(now)) {
            return JoinResult.rejected(JoinStatus.NOT_FOUND, FailureReason.INVITE_EXPIRED);
        }
        if (invite.isExhausted()) {
            return JoinResult.rejected(JoinStatus.CONFLICT, FailureReason.INVITE_EXHAUSTED);
        }

        Optional<Participant> previous = participantRegistry.findMembership(chatId, userId);
        if (previous.isPresent() && previous.get().isAccepted()) {
            return JoinResult.rejected(JoinStatus.CONFLICT, FailureReason.ALREADY_MEMBER);
        }
        List<Participant> accepted = participantRegistry.acceptedParticipants(chatId);
        if (accepted.size() >= session.getMaxParticipants()) {
            return JoinResult.rejected(JoinStatus.CONFLICT, FailureReason.CAPACITY_REACHED);
        }

        tx.requireUpdated(inviteRepository.claimUse(invite.getId(), invite.getUseCount()), "invite claim");
        tx.compensate(() -> inviteRepository.releaseUse(invite.getId()));

        int colorIndex = chooseColor(previous, participantRegistry.usedColors(accepted), session.getMaxParticipants());
        Participant joined;
        if (previous.isPresent()) {
            tx.requireUpdated(
                    participantRepository.reactivate(
                            chatId, userId, ParticipantRole.PARTICIPANT, colorIndex, invite.getCreatedBy()),
                    "participant reactivation");
            tx.compensate(() -> participantRepository.markRemoved(chatId, userId));
            joined = previous.get().toBuilder()
                    .role(ParticipantRole.PARTICIPANT)
                    .status(ParticipantStatus.ACCEPTED)
                    .colorIndex(colorIndex)
                    .invitedBy(invite.getCreatedBy())
                    .build();
        } else {
            joined = insertParticipant(tx, Participant.builder()
                    .chatId(chatId)
                    .userId(userId)
                    .role(ParticipantRole.PARTICIPANT)
                    .status(ParticipantStatus.ACCEPTED)
                    .colorIndex(colorIndex)
                    .invitedBy(invite.getCreatedBy())
                    .joinedAt(now)
                    .build());
        }

        if (participantRegistry.acceptedCount(chatId) > session.getMaxParticipants()) {
            throw new ConcurrentUpdateException("capacity check");
        }
        // The session may have been dissolved (and possibly converted again) while this admission was writing.
        ChatSession current = participantRegistry.findSession(chatId).orElse(null);
        if (current == null || !current.isCollaborative() || !current.isOwnedBy(session.getOwnerId())) {
            throw new ConcurrentUpdateException("session check");
        }
        return JoinResult.joined(joined);
    }

    Participant insertParticipant(StoreTransaction tx, Participant participant) {
        ParticipantEntity saved;
        try {
            saved = participantRepository.saveAndFlush(mapper.toEntity(participant));
        } catch (DataIntegrityViolationException ex) {
            throw new ConcurrentUpdateException("participant insert");
        }
        tx.compensate(() -> participantRepository.deleteMembership(participant.getChatId(), participant.getUserId()));
        return mapper.toParticipant(saved);
    }

    /**
     * A returning member keeps its old color when nobody took it meanwhile; everyone else gets the lowest free one.
     * Color 0 belongs to the owner.
     */
    static int chooseColor(Optional<Participant> previous, Set<Integer> usedColors, int maxParticipants) {
        if (previous.isPresent()) {
            int old = previous.get().getColorIndex();
            if (old > 0 && old < maxParticipants && !usedColors.contains(old)) {
                return old;
            }
        }
        for (int color = 1; color < maxParticipants; color++) {
            if (!usedColors.contains(color)) {
                return color;
            }
        }
        throw new IllegalStateException("No free color below capacity " + maxParticipants);
    }

    public Invite createInvite(String chatId, String ownerId, Duration expiresIn) {
        requireText(chatId, "Chat id");
        requireText(ownerId, "User id");
        if (expiresIn != null && (expiresIn.isZero() || expiresIn.isNegative())) {
            throw new ServiceException(FailureReason.INVALID_REQUEST, "Invite expiry must be positive");
        }

        Invite invite = store.execute(chatId, tx -> {
            ChatSession session = participantRegistry.requireCollaborativeSession(chatId);
            requireOwner(session, ownerId);
            long accepted = participantRegistry.acceptedCount(chatId);
            if (accepted >= session.getMaxParticipants()) {
                throw new ServiceException(FailureReason.CAPACITY_REACHED, "Chat is full");
            }
            return issueInvite(tx, session, ownerId, (int) (session.getMaxParticipants() - accepted), expiresIn);
        });
        eventPublisher.publish(CollabEventType.INVITE_CREATED, chatId, Map.of("inviteId", invite.getId()));
        return invite;
    }

    /**
     * Replaces the chat's active invite. Runs inside the caller's unit of work.
     */
    Invite issueInvite(StoreTransaction tx, ChatSession session, String createdBy, int maxUses, Duration expiresIn) {
        String chatId = session.getId();
        List<String> replaced = inviteRepository.findByChatIdAndActiveTrueOrderByCreatedAtDesc(chatId).stream()
                .map(InviteEntity::getId)
                .toList();
        if (!replaced.isEmpty()) {
            inviteRepository.deactivateActive(chatId);
            tx.compensate(() -> inviteRepository.reactivate(replaced));
        }

        Instant now = clock.instant();
        Duration ttl = expiresIn != null ? expiresIn : collabProperties.getInvite().getDefaultTtl();
        Invite invite = Invite.builder()
                .id(UUID.randomUUID().toString())
                .chatId(chatId)
                .code(uniqueCode())
                .createdBy(createdBy)
                .maxUses(maxUses)
                .useCount(0)
                .active(true)
                .expiresAt(ttl != null ? now.plus(ttl) : null)
                .createdAt(now)
                .build();
        try {
            inviteRepository.saveAndFlush(mapper.toEntity(invite));
        } catch (DataIntegrityViolationException ex) {
            throw new ConcurrentUpdateException("invite insert");
        }
        tx.compensate(() -> inviteRepository.deleteById(invite.getId()));
        return invite;
    }

    public boolean revokeInvite(String chatId, String ownerId, String inviteId) {
        requireText(chatId, "Chat id");
        requireText(ownerId, "User id");
        requireText(inviteId, "Invite id");

        boolean revoked = store.execute(chatId, tx -> {
            ChatSession session = participantRegistry.requireSession(chatId);
            requireOwner(session, ownerId);
            if (inviteRepository.findByIdAndChatId(inviteId, chatId).isEmpty()) {
                throw new ServiceException(FailureReason.INVITE_NOT_FOUND, "Invite not found");
            }
            return inviteRepository.deactivate(inviteId, chatId) > 0;
        });
        if (revoked) {
            eventPublisher.publish(CollabEventType.INVITE_REVOKED, chatId, Map.of("inviteId", inviteId));
        }
        return revoked;
    }

    public List<Invite> listActiveInvites(String chatId, String ownerId) {
        requireText(chatId, "Chat id");
        ChatSession session = participantRegistry.requireSession(chatId);
        requireOwner(session, ownerId);
        return inviteRepository.findByChatIdAndActiveTrueOrderByCreatedAtDesc(chatId).stream()
                .map(mapper::toInvite)
                .toList();
    }

    private String uniqueCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = codeGenerator.nextCode();
            if (!inviteRepository.existsByCode(code)) {
                return code;
            }
        }
        throw new IllegalStateException("Could not generate a unique invite code");
    }

    private void requireOwner(ChatSession session, String userId) {
        if (!session.isOwnedBy(userId)) {
            throw new ServiceException(FailureReason.NOT_OWNER, "Only the chat owner can manage invites");
        }
    }

    private void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new ServiceException(FailureReason.INVALID_REQUEST, name + " is required");
        }
    }

    public enum JoinStatus {
        JOINED,
        CONFLICT,
        NOT_FOUND,
        FORBIDDEN
    }

    public record JoinResult(JoinStatus status, FailureReason reason, Participant participant) {

        static JoinResult joined(Participant participant) {
            return new JoinResult(JoinStatus.JOINED, null, participant);
        }

        static JoinResult rejected(JoinStatus status, FailureReason reason) {
            return new JoinResult(status, reason, null);
        }
    }

    public record InviteSummary(
            String chatId,
            String title,
            String ownerId,
            long participantCount,
            int maxParticipants,
            Integer remainingUses,
            Instant expiresAt) {}

    public record InviteValidation(boolean valid, FailureReason reason, InviteSummary summary) {

        static InviteValidation valid(InviteSummary summary) {
            return new InviteValidation(true, null, summary);
        }

        static InviteValidation invalid(FailureReason reason) {
            return new InviteValidation(false, reason, null);
        }
    }
}
