package com.example.collab.service;

import com.example.collab.persistence.ChatLockJpaRepository;
import com.example.collab.persistence.InviteJpaRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cosmetic cleanup. Expired locks and invites are already ignored on every read, so a skipped cycle changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollabHousekeepingScheduler {

    private final ChatLockJpaRepository lockRepository;
    private final InviteJpaRepository inviteRepository;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${collab.housekeeping.interval:PT1M}').toMillis()}")
    public void purgeExpired() {
        Instant now = clock.instant();
        purgeExpiredLocks(now);
        deactivateExpiredInvites(now);
    }

    int purgeExpiredLocks(Instant now) {
        try {
            int purged = lockRepository.purgeExpired(now);
            if (purged > 0) {
                log.debug("Purged {} expired prompt locks", purged);
            }
            return purged;
        } catch (DataAccessException ex) {
            log.warn("Failed to purge expired prompt locks", ex);
            return 0;
        }
    }

    int deactivateExpiredInvites(Instant now) {
        try {
            int deactivated = inviteRepository.deactivateExpired(now);
            if (deactivated > 0) {
                log.debug("Deactivated {} expired invites", deactivated);
            }
            return deactivated;
        } catch (DataAccessException ex) {
            log.warn("Failed to deactivate expired invites", ex);
            return 0;
        }
    }
}
