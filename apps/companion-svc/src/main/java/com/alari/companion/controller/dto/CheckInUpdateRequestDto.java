package com.alari.companion.controller.dto;

public record CheckInUpdateRequestDto(String progressNote, Boolean completed) {
}
