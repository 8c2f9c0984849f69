package com.alari.companion.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;

public record GoalCreateRequestDto(
        @NotBlank @Size(max = 255) String title,
        String description,
        Instant targetDate
) {
}
