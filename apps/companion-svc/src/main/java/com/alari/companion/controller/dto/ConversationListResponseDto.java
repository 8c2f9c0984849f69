package com.alari.companion.controller.dto;

import java.util.List;

public record ConversationListResponseDto(List<ConversationResponseDto> conversations, int total) {
}
