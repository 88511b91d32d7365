package com.example.collab.persistence;

import com.example.collab.domain.ParticipantRole;
import com.example.collab.domain.ParticipantStatus;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ParticipantJpaRepository extends JpaRepository<ParticipantEntity, Long> {

    Optional<ParticipantEntity> findByChatIdAndUserId(String chatId, String userId);

    List<ParticipantEntity> findByChatIdAndStatusOrderByJoinedAtAsc(String chatId, ParticipantStatus status);

    long countByChatIdAndStatus(String chatId, ParticipantStatus status);

    /**
     * Soft-deletes an accepted, non-owner membership. The owner row can never be matched here.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ParticipantEntity p set p.status = com.example.collab.domain.ParticipantStatus.REMOVED "
                    + "where p.chatId = :chatId and p.userId = :userId "
                    + "and p.status = com.example.collab.domain.ParticipantStatus.ACCEPTED "
                    + "and p.role <> com.example.collab.domain.ParticipantRole.OWNER")
    int markRemoved(@Param("chatId") String chatId, @Param("userId") String userId);

    /**
     * Undo of {@link #markRemoved(String, String)}; only used as a compensation.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ParticipantEntity p set p.status = com.example.collab.domain.ParticipantStatus.ACCEPTED "
                    + "where p.chatId = :chatId and p.userId = :userId "
                    + "and p.status = com.example.collab.domain.ParticipantStatus.REMOVED")
    int restore(@Param("chatId") String chatId, @Param("userId") String userId);

    /**
     * Brings a removed row back; {@code joinedAt} is left untouched.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ParticipantEntity p set p.status = com.example.collab.domain.ParticipantStatus.ACCEPTED, "
                    + "p.role = :role, p.colorIndex = :colorIndex, p.invitedBy = :invitedBy "
                    + "where p.chatId = :chatId and p.userId = :userId "
                    + "and p.status = com.example.collab.domain.ParticipantStatus.REMOVED")
    int reactivate(
            @Param("chatId") String chatId,
            @Param("userId") String userId,
            @Param("role") ParticipantRole role,
            @Param("colorIndex") int colorIndex,
            @Param("invitedBy") String invitedBy);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ParticipantEntity p set p.role = :newRole, p.colorIndex = :colorIndex "
                    + "where p.chatId = :chatId and p.userId = :userId and p.role = :expectedRole "
                    + "and p.status = com.example.collab.domain.ParticipantStatus.ACCEPTED")
    int assignRole(
            @Param("chatId") String chatId,
            @Param("userId") String userId,
            @Param("expectedRole") ParticipantRole expectedRole,
            @Param("newRole") ParticipantRole newRole,
            @Param("colorIndex") int colorIndex);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ParticipantEntity p where p.chatId = :chatId and p.userId = :userId")
    int deleteMembership(@Param("chatId") String chatId, @Param("userId") String userId);
}
