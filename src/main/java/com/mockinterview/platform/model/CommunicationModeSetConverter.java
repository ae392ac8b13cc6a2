package com.mockinterview.platform.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

@Converter
public class CommunicationModeSetConverter implements AttributeConverter<Set<CommunicationMode>, String> {

    @Override
    public String convertToDatabaseColumn(Set<CommunicationMode> modes) {
        if (modes == null || modes.isEmpty()) {
            return "";
        }
        return modes.stream().map(CommunicationMode::value).collect(Collectors.joining(","));
    }

    @Override
    public Set<CommunicationMode> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return new LinkedHashSet<>();
        }
        return Arrays.stream(column.split(","))
                .map(CommunicationMode::fromValue)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
