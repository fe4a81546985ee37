package com.vtb.apidrift.rules;

import com.vtb.apidrift.models.ChangeLevel;
import com.vtb.apidrift.models.RuleCategory;

/**
 * Базовый контракт для всех правил сравнения
 *
 * Правило описывает один вид различия между версиями API и само знает,
 * как себя назвать, описать и какой у него уровень. Матчер решает только,
 * когда правило создать, поэтому новые виды различий добавляются новыми
 * реализациями без изменения матчера.
 */
public interface Rule {
    
    /**
     * Стабильное имя правила (например, "SchemaRemoved", "TypeChanged")
     */
    String getName();
    
    /**
     * Человекочитаемое описание найденного различия
     */
    String getDescription();
    
    /**
     * Уровень изменения (собственный для вида правила)
     */
    ChangeLevel getChangeLevel();
    
    /**
     * Где в графе схем найдено различие
     */
    String getContext();
    
    default RuleCategory getCategory() {
        return RuleCategory.SCHEMA;
    }
    
    /**
     * Путь свойства внутри схемы ("" для корня)
     */
    default String getPropertyPath() {
        return "";
    }
}
