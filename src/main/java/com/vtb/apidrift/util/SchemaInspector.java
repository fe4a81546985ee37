package com.vtb.apidrift.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.swagger.v3.oas.models.media.Schema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Единый доступ к атрибутам Schema для OpenAPI 3.0 и 3.1
 *
 * В 3.0 тип задается строкой type и флагом nullable,
 * в 3.1 - множеством types, где nullable выражается через "null".
 * Все методы null-safe и ничего не меняют в переданных схемах.
 */
@Slf4j
public final class SchemaInspector {
    
    private static final String NULL_TYPE = "null";

    // swagger приводит enum с format: date-time к OffsetDateTime, date - к LocalDate
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    
    private SchemaInspector() {
    }
    
    /**
     * Отсортированный набор типов без "null"
     */
    public static Set<String> typeSet(Schema<?> schema) {
        Set<String> types = new TreeSet<>();
        if (schema == null) {
            return types;
        }
        if (schema.getType() != null) {
            types.add(schema.getType());
        }
        if (schema.getTypes() != null) {
            for (String type : schema.getTypes()) {
                if (type != null) {
                    types.add(type);
                }
            }
        }
        types.remove(NULL_TYPE);
        return types;
    }
    
    public static boolean isNullable(Schema<?> schema) {
        if (schema == null) {
            return false;
        }
        if (Boolean.TRUE.equals(schema.getNullable())) {
            return true;
        }
        if (NULL_TYPE.equals(schema.getType())) {
            return true;
        }
        return schema.getTypes() != null && schema.getTypes().contains(NULL_TYPE);
    }
    
    public static boolean isArray(Schema<?> schema) {
        return typeSet(schema).contains("array");
    }
    
    /**
     * Свойства в порядке объявления (пустая карта, если их нет)
     */
    public static Map<String, Schema<?>> properties(Schema<?> schema) {
        if (schema == null || schema.getProperties() == null) {
            return Collections.emptyMap();
        }
        Map<String, Schema<?>> properties = new LinkedHashMap<>();
        schema.getProperties().forEach((name, property) -> {
            if (name != null && property != null) {
                properties.put(name, property);
            }
        });
        return properties;
    }
    
    public static Set<String> requiredNames(Schema<?> schema) {
        if (schema == null || schema.getRequired() == null) {
            return Collections.emptySet();
        }
        Set<String> required = new LinkedHashSet<>();
        for (String name : schema.getRequired()) {
            if (name != null) {
                required.add(name);
            }
        }
        return required;
    }
    
    /**
     * Значения enum, нормализованные в JSON деревья (в порядке объявления, без повторов)
     */
    public static Set<JsonNode> enumValues(Schema<?> schema) {
        Set<JsonNode> values = new LinkedHashSet<>();
        if (schema == null || schema.getEnum() == null) {
            return values;
        }
        for (Object value : schema.getEnum()) {
            values.add(toJson(value));
        }
        return values;
    }
    
    /**
     * JSON литералы для описаний и отчетов
     */
    public static List<String> render(Iterable<JsonNode> values) {
        List<String> rendered = new ArrayList<>();
        for (JsonNode value : values) {
            rendered.add(value.toString());
        }
        return rendered;
    }
    
    private static JsonNode toJson(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            log.debug("Значение enum {} ({}) сравнивается как строка: {}",
                value, value.getClass().getSimpleName(), e.getMessage());
            return TextNode.valueOf(String.valueOf(value));
        }
    }
}
