package com.example.collab.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.collab.domain.ChatSession;
import com.example.collab.domain.Invite;
import com.example.collab.domain.Participant;
import com.example.collab.domain.ParticipantRole;
import com.example.collab.domain.ParticipantStatus;
import com.example.collab.event.CollabEventPublisher;
import com.example.collab.persistence.ChatLockJpaRepository;
import com.example.collab.persistence.ChatSessionEntity;
import com.example.collab.persistence.ChatSessionJpaRepository;
import com.example.collab.persistence.InviteJpaRepository;
import com.example.collab.persistence.ParticipantJpaRepository;
import com.example.collab.service.CollaborativeSessionService.SessionCreation;
import com.example.collab.service.LockManager.LockAcquisition;
import com.example.collab.service.LockManager.PromptStatus;
import com.example.collab.service.MembershipCoordinator.JoinResult;
import com.example.collab.service.MembershipCoordinator.JoinStatus;
import com.example.collab.service.OwnershipTransferService.TransferResult;
import com.example.collab.service.OwnershipTransferService.TransferStatus;
import com.example.collab.service.ParticipantDepartureService.DepartureResult;
import com.example.collab.service.ParticipantDepartureService.DepartureStatus;
import com.example.collab.service.exception.ErrorCategory;
import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import com.example.collab.store.StoreMode;
import com.example.collab.store.TransactionalStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Membership, lock and ownership behavior against a real database. Concrete subclasses pin the transactional
 * store so every scenario runs once per store implementation.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import(CollabTestConfig.class)
abstract class AbstractCollaborationTest {

    private static final String OWNER = "alice";

    @Autowired protected TransactionalStore store;
    @Autowired protected CollaborativeSessionService sessionService;
    @Autowired protected MembershipCoordinator membershipCoordinator;
    @Autowired protected LockManager lockManager;
    @Autowired protected OwnershipTransferService transferService;
    @Autowired protected ParticipantDepartureService departureService;
    @Autowired protected ParticipantRegistry participantRegistry;
    @Autowired protected ChatSessionJpaRepository sessionRepository;
    @Autowired protected ParticipantJpaRepository participantRepository;
    @Autowired protected ChatLockJpaRepository lockRepository;
    @Autowired protected InviteJpaRepository inviteRepository;
    @Autowired protected MutableClock clock;

    @MockBean protected CollabEventPublisher eventPublisher;

    protected abstract StoreMode expectedMode();

    @Test
    void usesConfiguredStore() {
        assertThat(store.mode()).isEqualTo(expectedMode());
    }

    @Test
    void createSessionSeatsOwnerAndIssuesInviteForRemainingSeats() {
        SessionCreation creation = sessionService.createSession(OWNER, "  Planning  ", 3);

        ChatSession session = creation.session();
        assertThat(session.isCollaborative()).isTrue();
        assertThat(session.getOwnerId()).isEqualTo(OWNER);
        assertThat(session.getTitle()).isEqualTo("Planning");
        assertThat(creation.owner().getRole()).isEqualTo(ParticipantRole.OWNER);
        assertThat(creation.owner().getColorIndex()).isZero();
        assertThat(creation.invite().getMaxUses()).isEqualTo(2);
        assertThat(creation.invite().isActive()).isTrue();

        assertThat(participantRegistry.acceptedCount(session.getId())).isEqualTo(1);
        assertThat(sessionService.listMyChats(OWNER)).extracting(ChatSession::getId).contains(session.getId());
    }

    @Test
    void createSessionRejectsCapacityOutsideBounds() {
        assertThatThrownBy(() -> sessionService.createSession(OWNER, null, 1))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.INVALID_REQUEST);
        assertThatThrownBy(() -> sessionService.createSession(OWNER, null, 7))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.INVALID_REQUEST);
    }

    @Test
    void joinAssignsLowestFreeColors() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 4);
        String chatId = creation.session().getId();
        String code = creation.invite().getCode();

        JoinResult bob = membershipCoordinator.join(chatId, "bob", code);
        JoinResult carol = membershipCoordinator.join(chatId, "carol", code);

        assertThat(bob.status()).isEqualTo(JoinStatus.JOINED);
        assertThat(bob.participant().getColorIndex()).isEqualTo(1);
        assertThat(bob.participant().getInvitedBy()).isEqualTo(OWNER);
        assertThat(carol.participant().getColorIndex()).isEqualTo(2);
        assertThat(membershipCoordinator.join(chatId, "bob", code).reason()).isEqualTo(FailureReason.ALREADY_MEMBER);
        assertThat(inviteRepository.findByCode(code).orElseThrow().getUseCount()).isEqualTo(2);
    }

    @Test
    void joinRejectsUnknownOrForeignInvite() {
        SessionCreation first = sessionService.createSession(OWNER, null, 3);
        SessionCreation second = sessionService.createSession("dave", null, 3);

        JoinResult unknown = membershipCoordinator.join(first.session().getId(), "bob", "no-such-code");
        JoinResult foreign = membershipCoordinator.join(first.session().getId(), "bob", second.invite().getCode());

        assertThat(unknown.status()).isEqualTo(JoinStatus.NOT_FOUND);
        assertThat(unknown.reason()).isEqualTo(FailureReason.INVITE_INVALID);
        assertThat(foreign.reason()).isEqualTo(FailureReason.INVITE_INVALID);
        assertThat(membershipCoordinator.join("missing-chat", "bob", first.invite().getCode()).reason())
                .isEqualTo(FailureReason.CHAT_NOT_FOUND);
    }

    @Test
    void joinRejectsExpiredInvite() {
        String chatId = sessionService.createSession(OWNER, null, 3).session().getId();
        Invite invite = membershipCoordinator.createInvite(chatId, OWNER, Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(6));

        JoinResult result = membershipCoordinator.join(chatId, "bob", invite.getCode());

        assertThat(result.status()).isEqualTo(JoinStatus.NOT_FOUND);
        assertThat(result.reason()).isEqualTo(FailureReason.INVITE_EXPIRED);
        assertThat(membershipCoordinator.validateInvite(invite.getCode()).reason())
                .isEqualTo(FailureReason.INVITE_EXPIRED);
    }

    @Test
    void exhaustedInviteRejectsThirdJoinButStaysActive() {
        String chatId = sessionService.createSession(OWNER, null, 3).session().getId();
        Invite invite = membershipCoordinator.createInvite(chatId, OWNER, null);
        assertThat(invite.getMaxUses()).isEqualTo(2);

        assertThat(membershipCoordinator.join(chatId, "bob", invite.getCode()).status()).isEqualTo(JoinStatus.JOINED);
        assertThat(membershipCoordinator.join(chatId, "carol", invite.getCode()).status())
                .isEqualTo(JoinStatus.JOINED);
        JoinResult third = membershipCoordinator.join(chatId, "dave", invite.getCode());

        assertThat(third.status()).isEqualTo(JoinStatus.CONFLICT);
        assertThat(third.reason().getCategory()).isEqualTo(ErrorCategory.CONFLICT);
        assertThat(inviteRepository.findByCode(invite.getCode()).orElseThrow().isActive()).isTrue();
        assertThat(participantRegistry.acceptedCount(chatId)).isEqualTo(3);
    }

    @Test
    void fullChatRefusesNewInvites() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 2);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());

        assertThatThrownBy(() -> membershipCoordinator.createInvite(chatId, OWNER, null))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.CAPACITY_REACHED);
        assertThat(membershipCoordinator.validateInvite(creation.invite().getCode()).valid()).isFalse();
    }

    @Test
    void newInviteReplacesActiveOneAndOnlyOwnerMayIssue() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();

        Invite replacement = membershipCoordinator.createInvite(chatId, OWNER, null);

        assertThat(membershipCoordinator.listActiveInvites(chatId, OWNER))
                .extracting(Invite::getId)
                .containsExactly(replacement.getId());
        assertThat(membershipCoordinator.join(chatId, "bob", creation.invite().getCode()).reason())
                .isEqualTo(FailureReason.INVITE_INVALID);
        assertThatThrownBy(() -> membershipCoordinator.createInvite(chatId, "mallory", null))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.NOT_OWNER);
    }

    @Test
    void revokedInviteNoLongerAdmits() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();

        assertThat(membershipCoordinator.revokeInvite(chatId, OWNER, creation.invite().getId())).isTrue();
        assertThat(membershipCoordinator.revokeInvite(chatId, OWNER, creation.invite().getId())).isFalse();
        assertThat(membershipCoordinator.join(chatId, "bob", creation.invite().getCode()).reason())
                .isEqualTo(FailureReason.INVITE_INVALID);
        assertThatThrownBy(() -> membershipCoordinator.revokeInvite(chatId, OWNER, "missing"))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.INVITE_NOT_FOUND);
    }

    @Test
    void validateInviteSummarizesChat() {
        SessionCreation creation = sessionService.createSession(OWNER, "Design review", 3);

        MembershipCoordinator.InviteValidation validation =
                membershipCoordinator.validateInvite(creation.invite().getCode());

        assertThat(validation.valid()).isTrue();
        assertThat(validation.summary().title()).isEqualTo("Design review");
        assertThat(validation.summary().ownerId()).isEqualTo(OWNER);
        assertThat(validation.summary().participantCount()).isEqualTo(1);
        assertThat(validation.summary().remainingUses()).isEqualTo(2);
        assertThat(membershipCoordinator.validateInvite(" ").reason()).isEqualTo(FailureReason.INVITE_INVALID);
    }

    @Test
    void lockIsExclusiveUntilLeaseExpires() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());

        LockAcquisition first = lockManager.acquire(chatId, OWNER);
        LockAcquisition denied = lockManager.acquire(chatId, "bob");

        assertThat(first.acquired()).isTrue();
        assertThat(first.expiresAt()).isEqualTo(first.lockedAt().plus(Duration.ofMinutes(2)));
        assertThat(denied.acquired()).isFalse();
        assertThat(denied.holder()).isEqualTo(OWNER);
        assertThat(lockManager.canPrompt(chatId, "bob").status()).isEqualTo(PromptStatus.LOCKED);
        assertThat(lockManager.canPrompt(chatId, OWNER).allowed()).isTrue();

        clock.advance(Duration.ofMinutes(2).plusSeconds(1));

        assertThat(lockManager.canPrompt(chatId, "bob").status()).isEqualTo(PromptStatus.OK);
        LockAcquisition takeover = lockManager.acquire(chatId, "bob");
        assertThat(takeover.acquired()).isTrue();
        assertThat(takeover.holder()).isEqualTo("bob");
    }

    @Test
    void holderMayRefreshItsLease() {
        String chatId = sessionService.createSession(OWNER, null, 3).session().getId();
        LockAcquisition first = lockManager.acquire(chatId, OWNER);
        clock.advance(Duration.ofSeconds(30));

        LockAcquisition refreshed = lockManager.acquire(chatId, OWNER);

        assertThat(refreshed.acquired()).isTrue();
        assertThat(refreshed.expiresAt()).isAfter(first.expiresAt());
    }

    @Test
    void onlyHolderCanRelease() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());
        lockManager.acquire(chatId, OWNER);

        assertThat(lockManager.release(chatId, "bob")).isFalse();
        assertThat(lockManager.currentLock(chatId).orElseThrow().getLockedBy()).isEqualTo(OWNER);
        assertThat(lockManager.release(chatId, OWNER)).isTrue();
        assertThat(lockManager.currentLock(chatId)).isEmpty();
        assertThat(lockManager.release(chatId, OWNER)).isFalse();
    }

    @Test
    void nonMembersCannotTakeLock() {
        String chatId = sessionService.createSession(OWNER, null, 3).session().getId();

        assertThatThrownBy(() -> lockManager.acquire(chatId, "mallory"))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.NOT_A_MEMBER);
        assertThat(lockManager.canPrompt(chatId, "mallory").status()).isEqualTo(PromptStatus.NOT_MEMBER);
        assertThatThrownBy(() -> lockManager.acquire(chatId, " "))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.INVALID_REQUEST);
    }

    @Test
    void leavingHolderReleasesLock() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());
        lockManager.acquire(chatId, "bob");
        assertThat(lockManager.canPrompt(chatId, OWNER).status()).isEqualTo(PromptStatus.LOCKED);

        DepartureResult result = departureService.leave(chatId, "bob");

        assertThat(result.status()).isEqualTo(DepartureStatus.LEFT);
        assertThat(result.lockReleased()).isTrue();
        assertThat(lockManager.canPrompt(chatId, OWNER).status()).isEqualTo(PromptStatus.OK);
        assertThat(participantRegistry.isActiveMember(chatId, "bob")).isFalse();
        assertThat(participantRepository.findByChatIdAndUserId(chatId, "bob").orElseThrow().getStatus())
                .isEqualTo(ParticipantStatus.REMOVED);
    }

    @Test
    void rejoinKeepsColorAndOriginalJoinTime() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 4);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());
        Instant bobJoinedAt = clock.instant();
        clock.advance(Duration.ofMinutes(1));
        membershipCoordinator.join(chatId, "carol", creation.invite().getCode());
        departureService.leave(chatId, "bob");
        clock.advance(Duration.ofMinutes(1));

        Invite invite = membershipCoordinator.createInvite(chatId, OWNER, null);
        JoinResult rejoin = membershipCoordinator.join(chatId, "bob", invite.getCode());

        assertThat(rejoin.status()).isEqualTo(JoinStatus.JOINED);
        assertThat(rejoin.participant().getColorIndex()).isEqualTo(1);
        assertThat(participantRegistry.findMembership(chatId, "bob").orElseThrow().getJoinedAt())
                .isEqualTo(bobJoinedAt);
        assertThat(participantRepository.findAll())
                .filteredOn(row -> row.getChatId().equals(chatId) && row.getUserId().equals("bob"))
                .hasSize(1);
    }

    @Test
    void ownerCannotLeaveWhileOthersRemain() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());

        assertThatThrownBy(() -> departureService.leave(chatId, OWNER))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.OWNER_HAS_PARTICIPANTS);
        assertThat(sessionRepository.findById(chatId).orElseThrow().isCollaborative()).isTrue();

        departureService.leave(chatId, "bob");
        lockManager.acquire(chatId, OWNER);
        DepartureResult dissolved = departureService.leave(chatId, OWNER);

        assertThat(dissolved.status()).isEqualTo(DepartureStatus.SESSION_DISSOLVED);
        ChatSessionEntity session = sessionRepository.findById(chatId).orElseThrow();
        assertThat(session.isCollaborative()).isFalse();
        assertThat(lockRepository.findById(chatId)).isEmpty();
        assertThat(inviteRepository.findByChatIdAndActiveTrueOrderByCreatedAtDesc(chatId)).isEmpty();
        assertThat(participantRegistry.acceptedCount(chatId)).isZero();
    }

    @Test
    void dissolvedChatCanBeConvertedAgain() {
        String chatId = sessionService.createSession(OWNER, null, 3).session().getId();
        departureService.leave(chatId, OWNER);

        SessionCreation converted = sessionService.convertToCollaborative(chatId, OWNER, "Round two", 2);

        assertThat(converted.session().isCollaborative()).isTrue();
        assertThat(converted.session().getMaxParticipants()).isEqualTo(2);
        assertThat(converted.invite().getMaxUses()).isEqualTo(1);
        assertThat(participantRegistry.findMembership(chatId, OWNER).orElseThrow().isOwner()).isTrue();
        assertThatThrownBy(() -> sessionService.convertToCollaborative(chatId, OWNER, null, null))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.ALREADY_COLLABORATIVE);
    }

    @Test
    void convertUnknownChatMakesCallerOwner() {
        String chatId = "solo-" + System.nanoTime();

        SessionCreation converted = sessionService.convertToCollaborative(chatId, "erin", null, null);

        assertThat(converted.session().getOwnerId()).isEqualTo("erin");
        assertThat(converted.session().getMaxParticipants()).isEqualTo(6);
        assertThat(converted.session().getTitle()).isEqualTo("Collaborative Chat");
        assertThat(participantRegistry.isActiveMember(chatId, "erin")).isTrue();
    }

    @Test
    void ownerRemovesParticipantButNotThemselves() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());
        membershipCoordinator.join(chatId, "carol", creation.invite().getCode());
        lockManager.acquire(chatId, "carol");

        assertThatThrownBy(() -> departureService.removeParticipant(chatId, "bob", "carol"))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.NOT_OWNER);
        assertThatThrownBy(() -> departureService.removeParticipant(chatId, OWNER, OWNER))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.OWNER_NOT_REMOVABLE);
        assertThatThrownBy(() -> departureService.removeParticipant(chatId, OWNER, "zed"))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.PARTICIPANT_NOT_FOUND);

        DepartureResult removed = departureService.removeParticipant(chatId, OWNER, "carol");

        assertThat(removed.status()).isEqualTo(DepartureStatus.REMOVED);
        assertThat(removed.lockReleased()).isTrue();
        assertThat(participantRegistry.isActiveMember(chatId, "carol")).isFalse();
        assertThat(lockManager.currentLock(chatId)).isEmpty();
    }

    @Test
    void transferSwapsRolesAndColors() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());

        TransferResult result = transferService.transfer(chatId, OWNER, "bob");

        assertThat(result.status()).isEqualTo(TransferStatus.TRANSFERRED);
        assertSingleOwner(chatId, "bob");
        Participant previous = participantRegistry.findMembership(chatId, OWNER).orElseThrow();
        assertThat(previous.getRole()).isEqualTo(ParticipantRole.PARTICIPANT);
        assertThat(previous.getColorIndex()).isEqualTo(1);
        assertThat(participantRegistry.listParticipants(chatId, "bob").callerIsOwner()).isTrue();
    }

    @Test
    void rejectedTransferLeavesOwnershipUntouched() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());

        TransferResult notMember = transferService.transfer(chatId, OWNER, "mallory");
        TransferResult notOwner = transferService.transfer(chatId, "bob", "carol");

        assertThat(notMember.status()).isEqualTo(TransferStatus.CONFLICT);
        assertThat(notMember.reason()).isEqualTo(FailureReason.NEW_OWNER_NOT_MEMBER);
        assertThat(notOwner.status()).isEqualTo(TransferStatus.FORBIDDEN);
        assertThatThrownBy(() -> transferService.transfer(chatId, OWNER, OWNER))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.SELF_TRANSFER);
        assertSingleOwner(chatId, OWNER);
        assertThat(participantRegistry.findMembership(chatId, "bob").orElseThrow().getColorIndex()).isEqualTo(1);
    }

    @Test
    void participantsListedOnlyForMembers() {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());

        ParticipantRegistry.ParticipantsView view = sessionService.listParticipants(chatId, "bob");

        assertThat(view.callerIsOwner()).isFalse();
        assertThat(view.participants()).extracting(Participant::getUserId).containsExactlyInAnyOrder(OWNER, "bob");
        assertThatThrownBy(() -> sessionService.listParticipants(chatId, "mallory"))
                .isInstanceOf(ServiceException.class)
                .extracting("reason")
                .isEqualTo(FailureReason.NOT_A_MEMBER);
    }

    @Test
    void concurrentJoinsForLastSeatAdmitExactlyOne() throws Exception {
        SessionCreation creation = sessionService.createSession(OWNER, null, 3);
        String chatId = creation.session().getId();
        membershipCoordinator.join(chatId, "bob", creation.invite().getCode());
        String code = creation.invite().getCode();

        List<Object> outcomes = runConcurrently(8, i -> () -> membershipCoordinator.join(chatId, "user-" + i, code));

        assertThat(outcomes).filteredOn(this::joined).hasSize(1);
        assertThat(outcomes).filteredOn(outcome -> !joined(outcome)).allMatch(this::isConflict);
        assertThat(participantRegistry.acceptedCount(chatId)).isEqualTo(3);
    }

    @Test
    void concurrentJoinsNeverExceedInviteUses() throws Exception {
        String chatId = sessionService.createSession(OWNER, null, 6).session().getId();
        Invite invite = membershipCoordinator.createInvite(chatId, OWNER, null);
        inviteRepository.findById(invite.getId()).ifPresent(entity -> {
            entity.setMaxUses(2);
            inviteRepository.saveAndFlush(entity);
        });

        List<Object> outcomes =
                runConcurrently(6, i -> () -> membershipCoordinator.join(chatId, "user-" + i, invite.getCode()));

        long joined = outcomes.stream().filter(this::joined).count();
        assertConcurrentInviteUse(joined);
        assertThat(inviteRepository.findById(invite.getId()).orElseThrow().getUseCount()).isEqualTo((int) joined);
        assertThat(participantRegistry.acceptedCount(chatId)).isEqualTo(1 + joined);
    }

    /**
     * Serialized units admit exactly as many users as the invite allows; optimistic units may give up early.
     */
    protected abstract void assertConcurrentInviteUse(long joined);

    @Test
    void concurrentAcquiresGrantSingleHolder() throws Exception {
        SessionCreation creation = sessionService.createSession(OWNER, null, 6);
        String chatId = creation.session().getId();
        List<String> members = new ArrayList<>(List.of(OWNER));
        for (int i = 0; i < 5; i++) {
            membershipCoordinator.join(chatId, "member-" + i, creation.invite().getCode());
            members.add("member-" + i);
        }

        List<Object> outcomes = runConcurrently(members.size(), i -> () -> lockManager.acquire(chatId, members.get(i)));

        List<LockAcquisition> granted = outcomes.stream()
                .filter(LockAcquisition.class::isInstance)
                .map(LockAcquisition.class::cast)
                .filter(LockAcquisition::acquired)
                .toList();
        assertThat(granted).hasSize(1);
        assertThat(lockRepository.findById(chatId).orElseThrow().getLockedBy()).isEqualTo(granted.get(0).holder());
    }

    @Test
    void housekeepingPurgesExpiredLocksAndInvites() {
        String chatId = sessionService.createSession(OWNER, null, 3).session().getId();
        Invite invite = membershipCoordinator.createInvite(chatId, OWNER, Duration.ofMinutes(1));
        lockManager.acquire(chatId, OWNER);
        Instant later = clock.instant().plus(Duration.ofMinutes(3));
        CollabHousekeepingScheduler housekeepingScheduler =
                new CollabHousekeepingScheduler(lockRepository, inviteRepository, clock);

        assertThat(housekeepingScheduler.purgeExpiredLocks(later)).isGreaterThanOrEqualTo(1);
        assertThat(housekeepingScheduler.deactivateExpiredInvites(later)).isGreaterThanOrEqualTo(1);
        assertThat(lockRepository.findById(chatId)).isEmpty();
        assertThat(inviteRepository.findById(invite.getId()).orElseThrow().isActive()).isFalse();
    }

    private void assertSingleOwner(String chatId, String expectedOwner) {
        assertThat(sessionRepository.findById(chatId).orElseThrow().getOwnerId()).isEqualTo(expectedOwner);
        List<Participant> owners = participantRegistry.acceptedParticipants(chatId).stream()
                .filter(Participant::isOwner)
                .toList();
        assertThat(owners).extracting(Participant::getUserId).containsExactly(expectedOwner);
        assertThat(owners.get(0).getColorIndex()).isZero();
    }

    private boolean joined(Object outcome) {
        return outcome instanceof JoinResult result && result.status() == JoinStatus.JOINED;
    }

    private boolean isConflict(Object outcome) {
        if (outcome instanceof JoinResult result) {
            return result.reason().getCategory() == ErrorCategory.CONFLICT;
        }
        return outcome instanceof ServiceException ex && ex.getCategory() == ErrorCategory.CONFLICT;
    }

    /**
     * Starts all tasks behind a latch and returns each result, or the exception it threw.
     */
    private List<Object> runConcurrently(int count, TaskFactory factory) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(count);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                Callable<?> task = factory.create(i);
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        return task.call();
                    } catch (ServiceException ex) {
                        return ex;
                    }
                }));
            }
            start.countDown();
            List<Object> outcomes = new ArrayList<>();
            for (Future<Object> future : futures) {
                outcomes.add(future.get(30, TimeUnit.SECONDS));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface TaskFactory {
        Callable<?> create(int index);
    }
}
