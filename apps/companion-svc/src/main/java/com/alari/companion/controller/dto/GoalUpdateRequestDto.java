package com.alari.companion.controller.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.Instant;

public record GoalUpdateRequestDto(
        @Size(max = 255) String title,
        String description,
        Instant targetDate,
        @Pattern(regexp = "^(active|completed|abandoned)$", message = "status must be one of active, completed, abandoned") String status
) {
}
