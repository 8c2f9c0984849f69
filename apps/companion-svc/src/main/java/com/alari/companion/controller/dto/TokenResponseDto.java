package com.alari.companion.controller.dto;

public record TokenResponseDto(String accessToken, String tokenType, Long userId) {

    public static TokenResponseDto bearer(String accessToken, Long userId) {
        return new TokenResponseDto(accessToken, "bearer", userId);
    }
}
