package com.mockinterview.platform.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ResumeDataConverter implements AttributeConverter<ResumeData, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String convertToDatabaseColumn(ResumeData resume) {
        if (resume == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(resume);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Resume data cannot be serialized", e);
        }
    }

    @Override
    public ResumeData convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(column, ResumeData.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored resume data is not valid JSON", e);
        }
    }
}
