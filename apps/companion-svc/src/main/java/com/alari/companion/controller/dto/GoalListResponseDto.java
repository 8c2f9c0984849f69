package com.alari.companion.controller.dto;

import java.util.List;

public record GoalListResponseDto(List<GoalResponseDto> goals, int total) {
}
