package com.example.collab.persistence;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface InviteJpaRepository extends JpaRepository<InviteEntity, String> {

    Optional<InviteEntity> findByCode(String code);

    Optional<InviteEntity> findByIdAndChatId(String id, String chatId);

    List<InviteEntity> findByChatIdAndActiveTrueOrderByCreatedAtDesc(String chatId);

    boolean existsByCode(String code);

    /**
     * Consumes one use if nobody else did since {@code observedUseCount} was read.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update InviteEntity i set i.useCount = i.useCount + 1 "
                    + "where i.id = :id and i.useCount = :observedUseCount and i.active = true "
                    + "and (i.maxUses is null or i.useCount < i.maxUses)")
    int claimUse(@Param("id") String id, @Param("observedUseCount") int observedUseCount);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update InviteEntity i set i.useCount = i.useCount - 1 where i.id = :id and i.useCount > 0")
    int releaseUse(@Param("id") String id);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update InviteEntity i set i.active = false where i.chatId = :chatId and i.active = true")
    int deactivateActive(@Param("chatId") String chatId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update InviteEntity i set i.active = true where i.id in :ids")
    int reactivate(@Param("ids") Collection<String> ids);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update InviteEntity i set i.active = false where i.id = :id and i.chatId = :chatId and i.active = true")
    int deactivate(@Param("id") String id, @Param("chatId") String chatId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update InviteEntity i set i.active = false "
                    + "where i.active = true and i.expiresAt is not null and i.expiresAt <= :now")
    int deactivateExpired(@Param("now") Instant now);
}
