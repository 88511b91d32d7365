package com.example.collab.persistence;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ChatLockJpaRepository extends JpaRepository<ChatLockEntity, String> {

    /**
     * Takes over an expired row, or refreshes the lease when the caller already holds it.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ChatLockEntity l set l.lockedBy = :userId, l.lockedAt = :now, l.expiresAt = :expiresAt "
                    + "where l.chatId = :chatId and (l.expiresAt <= :now or l.lockedBy = :userId)")
    int tryTakeOver(
            @Param("chatId") String chatId,
            @Param("userId") String userId,
            @Param("now") Instant now,
            @Param("expiresAt") Instant expiresAt);

    /**
     * Plain insert; a second caller racing on the same chat fails on the primary key.
     */
    @Transactional
    @Modifying
    @Query(
            value = "insert into chat_locks (chat_id, locked_by, locked_at, expires_at) "
                    + "values (:chatId, :userId, :now, :expiresAt)",
            nativeQuery = true)
    int insertLock(
            @Param("chatId") String chatId,
            @Param("userId") String userId,
            @Param("now") Instant now,
            @Param("expiresAt") Instant expiresAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ChatLockEntity l where l.chatId = :chatId and l.lockedBy = :userId")
    int release(@Param("chatId") String chatId, @Param("userId") String userId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ChatLockEntity l where l.chatId = :chatId")
    int clear(@Param("chatId") String chatId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ChatLockEntity l where l.expiresAt <= :now")
    int purgeExpired(@Param("now") Instant now);
}
