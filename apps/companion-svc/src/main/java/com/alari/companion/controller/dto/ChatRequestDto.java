package com.alari.companion.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/** Omitted sampling values fall back to the configured defaults. */
public record ChatRequestDto(
        @NotBlank String message,
        @Min(1) @Max(4096) Integer maxTokens,
        @DecimalMin("0.0") @DecimalMax("2.0") Double temperature
) {
}
