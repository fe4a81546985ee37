package com.vtb.apidrift.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vtb.apidrift.core.ChangeLevelAggregator;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Результат сравнения одной схемы (или, в будущем, маршрута)
 *
 * Неизменяемый: имя, упорядоченный список нарушений и агрегированный уровень.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"name", "changeLevel", "violations"})
public final class MatchResult {
    
    private final String name;
    private final List<RuleViolation> violations;
    private final ChangeLevel changeLevel;
    
    public MatchResult(String name, List<RuleViolation> violations) {
        this.name = Objects.requireNonNull(name, "name не может быть null");
        this.violations = violations == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(violations));
        this.changeLevel = ChangeLevelAggregator.aggregate(this.violations);
    }
    
    /**
     * Есть ли хоть одно различие
     */
    @JsonIgnore
    public boolean hasViolations() {
        return !violations.isEmpty();
    }
    
    /**
     * Количество нарушений указанного уровня
     */
    public long countByChangeLevel(ChangeLevel level) {
        return violations.stream()
            .filter(v -> v.getChangeLevel() == level)
            .count();
    }
}
