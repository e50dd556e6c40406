package com.propgate.backend.modules.auth.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class DataAccessControlConverter implements AttributeConverter<DataAccessControl, String> {

    @Override
    public String convertToDatabaseColumn(DataAccessControl attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public DataAccessControl convertToEntityAttribute(String dbData) {
        return DataAccessControl.fromCode(dbData);
    }
}
