package com.alari.companion.controller.dto;

import java.util.Map;

public record ChatResponseDto(
        String sessionId,
        MessageResponseDto userMessage,
        MessageResponseDto assistantMessage,
        Map<String, Object> usage
) {
}
