package com.alari.companion.chat;

/**
 * Per-turn sampling parameters forwarded to the inference service.
 */
public record GenerationOptions(int maxTokens, double temperature) {

    public static final int MAX_TOKENS_LIMIT = 4096;
    public static final double MAX_TEMPERATURE = 2.0;

    public GenerationOptions {
        if (maxTokens < 1 || maxTokens > MAX_TOKENS_LIMIT) {
            throw new IllegalArgumentException("max_tokens must be between 1 and " + MAX_TOKENS_LIMIT);
        }
        if (Double.isNaN(temperature) || temperature < 0.0 || temperature > MAX_TEMPERATURE) {
            throw new IllegalArgumentException("temperature must be between 0.0 and " + MAX_TEMPERATURE);
        }
    }

    /** Fills in whichever of the two values the caller left out. */
    public static GenerationOptions of(Integer maxTokens, Double temperature, GenerationOptions defaults) {
        return new GenerationOptions(
                maxTokens != null ? maxTokens : defaults.maxTokens(),
                temperature != null ? temperature : defaults.temperature());
    }
}
