package com.alari.companion.controller.dto;

import jakarta.validation.constraints.Size;

public record ConversationCreateRequestDto(@Size(max = 255) String title) {
}
