package com.alari.companion.conversation;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable conversation and message storage.
 *
 * <p>Every message insert bumps the owning conversation's {@code updatedAt} inside the same
 * transaction. Message timestamps within a conversation never go backwards: a stamp that would not
 * come after the conversation's current {@code updatedAt} is moved one microsecond past it.
 */
@Component
public class ConversationStore {
    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);

    static final String SESSION_PREFIX = "conv-";

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final Clock clock;

    @Autowired
    public ConversationStore(ConversationRepository conversationRepository, MessageRepository messageRepository) {
        this(conversationRepository, messageRepository, Clock.systemUTC());
    }

    ConversationStore(ConversationRepository conversationRepository, MessageRepository messageRepository, Clock clock) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.clock = clock;
    }

    public record MessagePair(MessageEntity user, MessageEntity assistant) {}

    @Transactional
    public ConversationEntity createConversation(Long userId, String title) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        String safeTitle = title == null || title.isBlank() ? null : title.trim();
        ConversationEntity saved = conversationRepository.save(
                new ConversationEntity(userId, newSessionId(), safeTitle, now()));
        log.info("Conversation {} created for user {}", saved.getSessionId(), userId);
        return saved;
    }

    @Transactional
    public MessageEntity appendMessage(Long conversationId, MessageRole role, String content, List<String> keywords) {
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        if (content == null) {
            throw new IllegalArgumentException("content is required");
        }
        ConversationEntity conversation = requireConversation(conversationId);
        Instant stamp = nextStamp(conversation);
        MessageEntity saved = messageRepository.save(new MessageEntity(conversation.getId(), role, content, copyOf(keywords), stamp));
        conversation.touch(stamp);
        return saved;
    }

    @Transactional
    public MessageEntity appendMessage(Long conversationId, MessageRole role, String content) {
        return appendMessage(conversationId, role, content, null);
    }

    /**
     * Inserts a user utterance and its reply. Both rows commit together or not at all.
     */
    @Transactional
    public MessagePair appendMessagePair(Long conversationId, String userContent, String assistantContent) {
        if (userContent == null || assistantContent == null) {
            throw new IllegalArgumentException("both message contents are required");
        }
        ConversationEntity conversation = requireConversation(conversationId);
        Instant userStamp = nextStamp(conversation);
        MessageEntity user = messageRepository.save(
                new MessageEntity(conversation.getId(), MessageRole.USER, userContent, null, userStamp));
        conversation.touch(userStamp);
        Instant assistantStamp = nextStamp(conversation);
        MessageEntity assistant = messageRepository.save(
                new MessageEntity(conversation.getId(), MessageRole.ASSISTANT, assistantContent, null, assistantStamp));
        conversation.touch(assistantStamp);
        return new MessagePair(user, assistant);
    }

    @Transactional(readOnly = true)
    public List<MessageEntity> listMessages(Long conversationId) {
        return messageRepository.findByConversationIdOrderByCreatedAtAscIdAsc(conversationId);
    }

    @Transactional
    public void deleteConversation(Long conversationId) {
        int messages = messageRepository.deleteByConversationId(conversationId);
        int conversations = conversationRepository.deleteByIdReturningCount(conversationId);
        log.info("Conversation {} deleted ({} rows, {} messages)", conversationId, conversations, messages);
    }

    @Transactional(readOnly = true)
    public Optional<ConversationEntity> findBySessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        return conversationRepository.findBySessionId(sessionId);
    }

    @Transactional(readOnly = true)
    public List<ConversationEntity> listConversations(Long userId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return conversationRepository.findByUserIdOrderByUpdatedAtDescIdDesc(userId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public long countMessages(Long conversationId) {
        return messageRepository.countByConversationId(conversationId);
    }

    private ConversationEntity requireConversation(Long conversationId) {
        if (conversationId == null) {
            throw new IllegalArgumentException("conversationId is required");
        }
        return conversationRepository.lockById(conversationId)
                .orElseThrow(() -> new IllegalStateException("Conversation " + conversationId + " does not exist"));
    }

    private Instant nextStamp(ConversationEntity conversation) {
        Instant stamp = now();
        Instant last = conversation.getUpdatedAt();
        if (last != null && !stamp.isAfter(last)) {
            stamp = last.plus(1, ChronoUnit.MICROS);
        }
        return stamp;
    }

    // column precision is microseconds
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static List<String> copyOf(List<String> keywords) {
        return keywords == null ? null : List.copyOf(keywords);
    }

    static String newSessionId() {
        return SESSION_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }
}
