package com.example.collab.persistence;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ChatSessionJpaRepository extends JpaRepository<ChatSessionEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ChatSessionEntity s where s.id = :id")
    Optional<ChatSessionEntity> lockById(@Param("id") String id);

    @Query(
            "select s from ChatSessionEntity s "
                    + "where s.collaborative = true "
                    + "and exists (select p.id from ParticipantEntity p "
                    + "where p.chatId = s.id and p.userId = :userId "
                    + "and p.status = com.example.collab.domain.ParticipantStatus.ACCEPTED) "
                    + "order by s.createdAt desc")
    List<ChatSessionEntity> findCollaborativeForMember(@Param("userId") String userId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ChatSessionEntity s set s.ownerId = :newOwnerId, s.updatedAt = :now "
                    + "where s.id = :id and s.ownerId = :expectedOwnerId and s.collaborative = true")
    int transferOwner(
            @Param("id") String id,
            @Param("expectedOwnerId") String expectedOwnerId,
            @Param("newOwnerId") String newOwnerId,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ChatSessionEntity s set s.collaborative = false, s.updatedAt = :now "
                    + "where s.id = :id and s.ownerId = :ownerId and s.collaborative = true")
    int dissolve(@Param("id") String id, @Param("ownerId") String ownerId, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ChatSessionEntity s set s.collaborative = true, s.title = :title, "
                    + "s.maxParticipants = :maxParticipants, s.updatedAt = :now "
                    + "where s.id = :id and s.ownerId = :ownerId and s.collaborative = false")
    int enableCollaboration(
            @Param("id") String id,
            @Param("ownerId") String ownerId,
            @Param("title") String title,
            @Param("maxParticipants") int maxParticipants,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ChatSessionEntity s set s.collaborative = true, s.updatedAt = :now "
                    + "where s.id = :id and s.ownerId = :ownerId and s.collaborative = false")
    int restoreCollaboration(@Param("id") String id, @Param("ownerId") String ownerId, @Param("now") Instant now);
}
