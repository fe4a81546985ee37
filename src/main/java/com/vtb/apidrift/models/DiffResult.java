package com.vtb.apidrift.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Итог сравнения двух версий API
 */
@Data
@Builder
public class DiffResult {
    private String baseApiName;
    private String baseApiVersion;
    private String currentApiName;
    private String currentApiVersion;
    private LocalDateTime comparisonTimestamp;
    
    @Builder.Default
    private List<MatchResult> schemaResults = new ArrayList<>();
    
    @Builder.Default
    private List<FullSchemaInfo> fullSchemas = new ArrayList<>();
    
    private DiffStatistics statistics;
    
    /**
     * Количество схем с указанным агрегированным уровнем
     * (схемы без изменений не считаются)
     */
    public int getSchemaCountByChangeLevel(ChangeLevel level) {
        return (int) schemaResults.stream()
            .filter(MatchResult::hasViolations)
            .filter(r -> r.getChangeLevel() == level)
            .count();
    }
    
    /**
     * Есть ли ломающие изменения
     */
    @JsonIgnore
    public boolean hasBreakingChanges() {
        return schemaResults.stream()
            .anyMatch(r -> r.getChangeLevel() == ChangeLevel.BREAKING);
    }
    
    /**
     * Есть ли предупреждения (без учета ломающих)
     */
    @JsonIgnore
    public boolean hasWarnings() {
        return schemaResults.stream()
            .anyMatch(r -> r.getChangeLevel() == ChangeLevel.WARNING);
    }
}
