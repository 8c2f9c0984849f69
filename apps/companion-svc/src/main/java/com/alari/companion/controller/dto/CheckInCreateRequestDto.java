package com.alari.companion.controller.dto;

public record CheckInCreateRequestDto(String progressNote, Boolean completed) {

    public boolean completedOrDefault() {
        return Boolean.TRUE.equals(completed);
    }
}
