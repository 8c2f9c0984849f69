package com.alari.companion.controller.dto;

import com.alari.companion.conversation.ConversationService;
import java.time.Instant;

public record ConversationResponseDto(
        Long id,
        String sessionId,
        String title,
        Instant createdAt,
        Instant updatedAt,
        long messageCount
) {

    public static ConversationResponseDto from(ConversationService.ConversationView view) {
        var c = view.conversation();
        return new ConversationResponseDto(c.getId(), c.getSessionId(), c.getTitle(), c.getCreatedAt(), c.getUpdatedAt(), view.messageCount());
    }
}
