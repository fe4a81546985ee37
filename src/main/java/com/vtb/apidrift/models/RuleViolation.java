package com.vtb.apidrift.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vtb.apidrift.rules.Rule;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;

/**
 * Обнаруженное различие между версиями
 *
 * Оборачивает ровно одно правило и делегирует ему все свойства.
 * Нарушения никогда не объединяются и не дедуплицируются.
 */
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"name", "changeLevel", "category", "context", "propertyPath", "description"})
public final class RuleViolation {
    
    private final Rule rule;
    
    public RuleViolation(Rule rule) {
        this.rule = Objects.requireNonNull(rule, "rule не может быть null");
    }
    
    @JsonIgnore
    public Rule getRule() {
        return rule;
    }
    
    public String getName() {
        return rule.getName();
    }
    
    public String getDescription() {
        return rule.getDescription();
    }
    
    public ChangeLevel getChangeLevel() {
        return rule.getChangeLevel();
    }
    
    public RuleCategory getCategory() {
        return rule.getCategory();
    }
    
    public String getContext() {
        return rule.getContext();
    }
    
    public String getPropertyPath() {
        return rule.getPropertyPath();
    }
}
