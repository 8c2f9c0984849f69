package com.alari.companion.inference;

public record InferenceMessage(String role, String content) {}
