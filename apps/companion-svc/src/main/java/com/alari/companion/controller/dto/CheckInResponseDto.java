package com.alari.companion.controller.dto;

import com.alari.companion.goal.GoalCheckInEntity;
import java.time.Instant;

public record CheckInResponseDto(Long id, Long goalId, Instant checkInDate, String progressNote, boolean completed) {

    public static CheckInResponseDto from(GoalCheckInEntity checkIn) {
        return new CheckInResponseDto(checkIn.getId(), checkIn.getGoalId(), checkIn.getCheckInDate(),
                checkIn.getProgressNote(), checkIn.isCompleted());
    }
}
