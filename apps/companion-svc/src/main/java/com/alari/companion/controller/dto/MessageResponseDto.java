package com.alari.companion.controller.dto;

import com.alari.companion.conversation.MessageEntity;
import java.time.Instant;

public record MessageResponseDto(Long id, String role, String content, Instant createdAt) {

    public static MessageResponseDto from(MessageEntity message) {
        return new MessageResponseDto(message.getId(), message.getRole().value(), message.getContent(), message.getCreatedAt());
    }
}
