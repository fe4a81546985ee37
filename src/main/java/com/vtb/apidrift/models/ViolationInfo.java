package com.vtb.apidrift.models;

import lombok.Builder;
import lombok.Data;

/**
 * Облегченное представление нарушения для отчетов
 */
@Data
@Builder
public class ViolationInfo {
    private String ruleName;
    private String description;
    private ChangeLevel changeLevel;
    private String context;
    private String propertyPath;
    
    public static ViolationInfo from(RuleViolation violation) {
        return ViolationInfo.builder()
            .ruleName(violation.getName())
            .description(violation.getDescription())
            .changeLevel(violation.getChangeLevel())
            .context(violation.getContext())
            .propertyPath(violation.getPropertyPath())
            .build();
    }
}
