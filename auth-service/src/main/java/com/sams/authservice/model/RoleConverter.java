package com.sams.authservice.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class RoleConverter implements AttributeConverter<Role, String> {

    @Override
    public String convertToDatabaseColumn(Role role) {
        return role != null ? role.getValue() : null;
    }

    @Override
    public Role convertToEntityAttribute(String value) {
        return value != null ? Role.fromValue(value) : null;
    }
}
