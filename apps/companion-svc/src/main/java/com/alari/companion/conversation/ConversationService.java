package com.alari.companion.conversation;

import com.alari.companion.config.AlariProperties;
import com.alari.companion.security.Identity;
import com.alari.companion.security.OwnershipGuard;
import com.alari.companion.security.ResourceNotFoundException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Conversation management for an authenticated caller. Every lookup by session handle passes
 * through {@link OwnershipGuard}.
 */
@Service
public class ConversationService {
    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    public static final int DEFAULT_LIST_LIMIT = 50;

    private final ConversationStore store;
    private final OwnershipGuard ownershipGuard;
    private final String systemPrompt;

    public ConversationService(ConversationStore store, OwnershipGuard ownershipGuard, AlariProperties properties) {
        this.store = store;
        this.ownershipGuard = ownershipGuard;
        this.systemPrompt = properties.chat().systemPrompt();
    }

    public record ConversationView(ConversationEntity conversation, long messageCount) {}

    /** Creates the conversation together with its persona message. */
    @Transactional
    public ConversationView start(Identity identity, String title) {
        ConversationEntity conversation = store.createConversation(identity.id(), title);
        store.appendMessage(conversation.getId(), MessageRole.SYSTEM, systemPrompt);
        log.info("Conversation {} started for user {}", conversation.getSessionId(), identity.id());
        return new ConversationView(conversation, 1);
    }

    @Transactional(readOnly = true)
    public List<ConversationView> list(Identity identity, Integer limit) {
        int effective = limit == null ? DEFAULT_LIST_LIMIT : limit;
        return store.listConversations(identity.id(), effective).stream()
                .map(c -> new ConversationView(c, store.countMessages(c.getId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public ConversationView get(Identity identity, String sessionId) {
        ConversationEntity conversation = authorize(identity, sessionId);
        return new ConversationView(conversation, store.countMessages(conversation.getId()));
    }

    @Transactional(readOnly = true)
    public List<MessageEntity> messages(Identity identity, String sessionId) {
        ConversationEntity conversation = authorize(identity, sessionId);
        return store.listMessages(conversation.getId());
    }

    @Transactional
    public void delete(Identity identity, String sessionId) {
        ConversationEntity conversation = authorize(identity, sessionId);
        store.deleteConversation(conversation.getId());
    }

    /**
     * Resolves a session handle the caller owns.
     *
     * @throws ResourceNotFoundException when the handle is unknown or belongs to another user
     */
    public ConversationEntity authorize(Identity identity, String sessionId) {
        return ownershipGuard.authorize(identity, store.findBySessionId(sessionId))
                .orElseThrow(ResourceNotFoundException::conversation);
    }
}
