package com.example.collab.service;

import com.example.collab.config.CollabProperties;
import com.example.collab.domain.ChatLock;
import com.example.collab.event.CollabEventPublisher;
import com.example.collab.event.CollabEventType;
import com.example.collab.persistence.ChatLockJpaRepository;
import com.example.collab.persistence.CollabEntityMapper;
import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import com.example.collab.store.StoreFailures;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Turn-taking lock: at most one member of a chat may submit a prompt at a time.
 *
 * <p>Acquisition is a conditional update followed, when no row matched, by a plain insert guarded by the primary
 * key on {@code chat_id}. The database decides every race; there is no read-then-write in this class. A holder that
 * crashes is recovered by lease expiry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LockManager {

    private final ChatLockJpaRepository lockRepository;
    private final ParticipantRegistry participantRegistry;
    private final CollabEntityMapper mapper;
    private final CollabEventPublisher eventPublisher;
    private final CollabProperties collabProperties;
    private final Clock clock;

    public LockAcquisition acquire(String chatId, String userId) {
        requireText(chatId, "Chat id");
        requireText(userId, "User id");
        return guarded(chatId, () -> tryAcquire(chatId, userId));
    }

    private LockAcquisition tryAcquire(String chatId, String userId) {
        participantRegistry.requireActiveMember(chatId, userId);

        Duration lease = lease();
        Instant now = clock.instant();
        Instant expiresAt = now.plus(lease);
        try {
            if (lockRepository.tryTakeOver(chatId, userId, now, expiresAt) == 0) {
                lockRepository.insertLock(chatId, userId, now, expiresAt);
            }
        } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
            log.debug("Lock on chat {} denied to {}: held concurrently", chatId, userId);
            return LockAcquisition.denied(chatId, currentLock(chatId, now).orElse(null), lease);
        }

        // The caller may have left between the membership check and the write.
        if (!participantRegistry.isActiveMember(chatId, userId)) {
            lockRepository.release(chatId, userId);
            throw new ServiceException(FailureReason.NOT_A_MEMBER, "User is not a member of this chat");
        }

        eventPublisher.publish(CollabEventType.LOCK_ACQUIRED, chatId,
                Map.of("userId", userId, "expiresAt", expiresAt.toString()));
        return LockAcquisition.granted(chatId, userId, now, expiresAt, lease);
    }

    /**
     * Releases the lock only if the caller holds it; anything else is a silent no-op.
     */
    public boolean release(String chatId, String userId) {
        requireText(chatId, "Chat id");
        requireText(userId, "User id");
        boolean released = guarded(chatId, () -> lockRepository.release(chatId, userId) > 0);
        if (released) {
            eventPublisher.publish(CollabEventType.LOCK_RELEASED, chatId, Map.of("userId", userId));
        }
        return released;
    }

    public PromptCheck canPrompt(String chatId, String userId) {
        requireText(chatId, "Chat id");
        requireText(userId, "User id");
        return guarded(chatId, () -> {
            if (!participantRegistry.isActiveMember(chatId, userId)) {
                return new PromptCheck(PromptStatus.NOT_MEMBER, null);
            }
            Optional<ChatLock> lock = currentLock(chatId, clock.instant());
            if (lock.isPresent() && !userId.equals(lock.get().getLockedBy())) {
                return new PromptCheck(PromptStatus.LOCKED, lock.get());
            }
            return new PromptCheck(PromptStatus.OK, lock.orElse(null));
        });
    }

    public Optional<ChatLock> currentLock(String chatId) {
        return currentLock(chatId, clock.instant());
    }

    public Duration lease() {
        return collabProperties.getLock().getLease();
    }

    private Optional<ChatLock> currentLock(String chatId, Instant now) {
        return lockRepository.findById(chatId)
                .map(mapper::toLock)
                .filter(lock -> lock.isHeldAt(now));
    }

    /**
     * Lock calls are single statements and run outside a store unit of work, so outages are mapped here.
     */
    private <T> T guarded(String chatId, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException ex) {
            if (StoreFailures.isUnavailable(ex)) {
                throw StoreFailures.unavailable(chatId, ex);
            }
            throw ex;
        }
    }

    private void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new ServiceException(FailureReason.INVALID_REQUEST, name + " is required");
        }
    }

    public enum PromptStatus {
        OK,
        LOCKED,
        NOT_MEMBER
    }

    /**
     * @param lock the live lock, if any; for {@code OK} it is the caller's own lock or {@code null}
     */
    public record PromptCheck(PromptStatus status, ChatLock lock) {

        public boolean allowed() {
            return status == PromptStatus.OK;
        }
    }

    /**
     * @param holder the current holder; {@code null} when denied and the competing lock vanished before it was read
     */
    public record LockAcquisition(
            boolean acquired, String chatId, String holder, Instant lockedAt, Instant expiresAt, Duration lease) {

        static LockAcquisition granted(String chatId, String userId, Instant now, Instant expiresAt, Duration lease) {
            return new LockAcquisition(true, chatId, userId, now, expiresAt, lease);
        }

        static LockAcquisition denied(String chatId, ChatLock current, Duration lease) {
            if (current == null) {
                return new LockAcquisition(false, chatId, null, null, null, lease);
            }
            return new LockAcquisition(
                    false, chatId, current.getLockedBy(), current.getLockedAt(), current.getExpiresAt(), lease);
        }
    }
}
