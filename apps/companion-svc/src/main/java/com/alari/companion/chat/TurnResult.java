package com.alari.companion.chat;

import com.alari.companion.conversation.MessageEntity;
import java.util.Map;

public record TurnResult(String sessionId, MessageEntity userMessage, MessageEntity assistantMessage, Map<String, Object> usage) {}
