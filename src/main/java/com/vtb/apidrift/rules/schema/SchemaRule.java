package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.rules.Rule;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Общая часть правил уровня схемы: имя схемы и путь свойства
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class SchemaRule implements Rule {
    
    /** Значение для отсутствующих строковых атрибутов в описаниях */
    protected static final String NONE = "(none)";
    
    private final String schemaName;
    private final String propertyPath;
    
    protected SchemaRule(String schemaName, String propertyPath) {
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName не может быть null");
        this.propertyPath = propertyPath == null ? "" : propertyPath;
    }
    
    @Override
    public String getContext() {
        if (propertyPath.isEmpty()) {
            return "schema: " + schemaName;
        }
        return "schema: " + schemaName + ", property: " + propertyPath;
    }
    
    /**
     * Последний сегмент пути (имя свойства)
     */
    protected String getPropertyName() {
        int dot = propertyPath.lastIndexOf('.');
        return dot < 0 ? propertyPath : propertyPath.substring(dot + 1);
    }
    
    protected static String orNone(String value) {
        return value == null ? NONE : value;
    }
}
