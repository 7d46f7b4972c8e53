package com.heronix.callgate.model.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link Address} columns as their hex string.
 */
@Converter(autoApply = true)
public class AddressConverter implements AttributeConverter<Address, String> {

    @Override
    public String convertToDatabaseColumn(Address attribute) {
        return attribute != null ? attribute.value() : null;
    }

    @Override
    public Address convertToEntityAttribute(String dbData) {
        return dbData != null ? Address.of(dbData) : null;
    }
}
