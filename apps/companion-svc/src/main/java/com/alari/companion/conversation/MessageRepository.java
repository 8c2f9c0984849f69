package com.alari.companion.conversation;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface MessageRepository extends JpaRepository<MessageEntity, Long> {
    List<MessageEntity> findByConversationIdOrderByCreatedAtAscIdAsc(Long conversationId);

    long countByConversationId(Long conversationId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from MessageEntity m where m.conversationId = :conversationId")
    int deleteByConversationId(@Param("conversationId") Long conversationId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from MessageEntity m where m.conversationId in "
            + "(select c.id from ConversationEntity c where c.userId = :userId)")
    int deleteByConversationOwner(@Param("userId") Long userId);
}
