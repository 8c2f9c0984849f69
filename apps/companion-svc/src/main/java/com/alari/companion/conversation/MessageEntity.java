package com.alari.companion.conversation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One immutable entry of a conversation. Ordered by {@code createdAt}, then by id.
 */
@Entity
@Table(name = "messages")
public class MessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false, updatable = false)
    private Long conversationId;

    @Column(name = "role", nullable = false, updatable = false, length = 50)
    private MessageRole role;

    @Column(name = "content", nullable = false, updatable = false, columnDefinition = "text")
    private String content;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "keywords", updatable = false)
    private List<String> keywords;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected MessageEntity() {}

    public MessageEntity(Long conversationId, MessageRole role, String content, List<String> keywords, Instant createdAt) {
        this.conversationId = conversationId;
        this.role = role;
        this.content = content;
        this.keywords = keywords;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public Long getConversationId() { return conversationId; }
    public MessageRole getRole() { return role; }
    public String getContent() { return content; }
    public List<String> getKeywords() { return keywords; }
    public Instant getCreatedAt() { return createdAt; }
}
