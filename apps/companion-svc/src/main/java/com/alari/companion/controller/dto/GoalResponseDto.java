package com.alari.companion.controller.dto;

import com.alari.companion.goal.GoalEntity;
import java.time.Instant;

public record GoalResponseDto(
        Long id,
        Long userId,
        String title,
        String description,
        Instant targetDate,
        String status,
        int streakCount,
        Instant createdAt,
        Instant updatedAt
) {

    public static GoalResponseDto from(GoalEntity goal) {
        return new GoalResponseDto(
                goal.getId(),
                goal.getUserId(),
                goal.getTitle(),
                goal.getDescription(),
                goal.getTargetDate(),
                goal.getStatus().value(),
                goal.getStreakCount(),
                goal.getCreatedAt(),
                goal.getUpdatedAt()
        );
    }
}
