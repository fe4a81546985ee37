package com.vtb.apidrift.models;

import lombok.Builder;
import lombok.Data;

/**
 * Статистика сравнения
 */
@Data
@Builder
public class DiffStatistics {
    private int baseSchemas;
    private int currentSchemas;
    private int comparedSchemas;
    private int changedSchemas;
    
    // Схемы по агрегированному уровню
    private int breakingSchemas;
    private int warningSchemas;
    
    // Отдельные нарушения по уровню
    private int totalViolations;
    private int breakingViolations;
    private int warningViolations;
    private int changeViolations;
    
    private long comparisonDurationMs;
}
