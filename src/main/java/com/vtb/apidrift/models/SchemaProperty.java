package com.vtb.apidrift.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Свойство схемы текущей версии вместе с привязанными к нему изменениями
 */
@Data
@Builder
public class SchemaProperty {
    private String name;
    private String propertyType;
    private String format;
    private String description;
    private boolean required;
    private boolean nullable;
    
    @Builder.Default
    private List<String> enumValues = new ArrayList<>();
    
    @Builder.Default
    private List<ViolationInfo> violations = new ArrayList<>();
}
