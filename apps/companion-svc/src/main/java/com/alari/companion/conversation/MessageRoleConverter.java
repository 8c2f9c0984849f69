package com.alari.companion.conversation;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class MessageRoleConverter implements AttributeConverter<MessageRole, String> {

    @Override
    public String convertToDatabaseColumn(MessageRole role) {
        return role == null ? null : role.value();
    }

    @Override
    public MessageRole convertToEntityAttribute(String value) {
        return value == null ? null : MessageRole.fromValue(value);
    }
}
