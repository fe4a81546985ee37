package com.vtb.apidrift.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Полное описание измененной схемы для рендеринга
 *
 * Свойства берутся из текущей версии, нарушения раскладываются по свойствам.
 * Нарушения без свойства (или по удаленным свойствам) попадают в schemaLevelViolations.
 */
@Data
@Builder
public class FullSchemaInfo {
    private String name;
    private String description;
    private ChangeLevel changeLevel;
    
    @Builder.Default
    private List<SchemaProperty> properties = new ArrayList<>();
    
    @Builder.Default
    private List<ViolationInfo> schemaLevelViolations = new ArrayList<>();
}
