package com.alari.companion.conversation;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationRepository extends JpaRepository<ConversationEntity, Long> {
    Optional<ConversationEntity> findBySessionId(String sessionId);

    /** Row lock held until the surrounding transaction ends; appends stamp messages under it. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from ConversationEntity c where c.id = :conversationId")
    Optional<ConversationEntity> lockById(@Param("conversationId") Long conversationId);

    List<ConversationEntity> findByUserIdOrderByUpdatedAtDescIdDesc(Long userId, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ConversationEntity c where c.id = :conversationId")
    int deleteByIdReturningCount(@Param("conversationId") Long conversationId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ConversationEntity c where c.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
