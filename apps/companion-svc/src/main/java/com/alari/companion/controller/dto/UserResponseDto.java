package com.alari.companion.controller.dto;

import com.alari.companion.user.UserEntity;
import java.time.Instant;

public record UserResponseDto(Long id, String email, String userName, Instant createdAt) {

    public static UserResponseDto from(UserEntity user) {
        return new UserResponseDto(user.getId(), user.getEmail(), user.getUserName(), user.getCreatedAt());
    }
}
