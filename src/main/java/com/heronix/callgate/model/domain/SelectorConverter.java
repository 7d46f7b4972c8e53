package com.heronix.callgate.model.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SelectorConverter implements AttributeConverter<Selector, String> {

    @Override
    public String convertToDatabaseColumn(Selector attribute) {
        return attribute != null ? attribute.value() : null;
    }

    @Override
    public Selector convertToEntityAttribute(String dbData) {
        return dbData != null ? Selector.parse(dbData) : null;
    }
}
