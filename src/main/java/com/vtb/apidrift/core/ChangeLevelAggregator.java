package com.vtb.apidrift.core;

import com.vtb.apidrift.models.ChangeLevel;
import com.vtb.apidrift.models.RuleViolation;

import java.util.Collection;

/**
 * Сведение списка нарушений к одному уровню
 */
public final class ChangeLevelAggregator {
    
    private ChangeLevelAggregator() {
    }
    
    /**
     * BREAKING, если есть хоть одно ломающее; иначе WARNING, если есть предупреждение;
     * иначе CHANGE (в том числе для пустого списка - "без изменений")
     */
    public static ChangeLevel aggregate(Collection<RuleViolation> violations) {
        ChangeLevel result = ChangeLevel.CHANGE;
        if (violations == null) {
            return result;
        }
        for (RuleViolation violation : violations) {
            if (violation == null) {
                continue;
            }
            result = ChangeLevel.max(result, violation.getChangeLevel());
            if (result == ChangeLevel.BREAKING) {
                break;
            }
        }
        return result;
    }
}
