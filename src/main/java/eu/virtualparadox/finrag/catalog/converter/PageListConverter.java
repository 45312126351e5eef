package eu.virtualparadox.finrag.catalog.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.List;

/**
 * Stores a list of page numbers as a comma separated column, e.g. {@code "2,5,7"}.
 */
@Converter
public class PageListConverter implements AttributeConverter<List<Integer>, String> {

    @Override
    public String convertToDatabaseColumn(final List<Integer> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "";
        }
        return String.join(",", attribute.stream().map(String::valueOf).toList());
    }

    @Override
    public List<Integer> convertToEntityAttribute(final String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return List.of();
        }
        return Arrays.stream(dbData.split(","))
                .map(String::trim)
                .map(Integer::valueOf)
                .toList();
    }
}
