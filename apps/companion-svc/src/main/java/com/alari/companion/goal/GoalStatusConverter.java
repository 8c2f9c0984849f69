package com.alari.companion.goal;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class GoalStatusConverter implements AttributeConverter<GoalStatus, String> {

    @Override
    public String convertToDatabaseColumn(GoalStatus status) {
        return status == null ? null : status.value();
    }

    @Override
    public GoalStatus convertToEntityAttribute(String value) {
        return value == null ? null : GoalStatus.fromValue(value);
    }
}
