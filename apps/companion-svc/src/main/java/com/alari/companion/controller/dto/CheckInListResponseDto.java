package com.alari.companion.controller.dto;

import java.util.List;

public record CheckInListResponseDto(List<CheckInResponseDto> checkIns, int total) {
}
