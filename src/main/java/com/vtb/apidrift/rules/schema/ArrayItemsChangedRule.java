package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * У массива появилось или пропало описание элементов (items)
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ArrayItemsChangedRule extends SchemaRule {
    
    private final boolean itemsInBase;
    private final boolean itemsInCurrent;
    
    public ArrayItemsChangedRule(String schemaName, String propertyPath, boolean itemsInBase, boolean itemsInCurrent) {
        super(schemaName, propertyPath);
        this.itemsInBase = itemsInBase;
        this.itemsInCurrent = itemsInCurrent;
    }
    
    @Override
    public String getName() {
        return "ArrayItemsChanged";
    }
    
    @Override
    public String getDescription() {
        if (itemsInBase && !itemsInCurrent) {
            return "Описание элементов массива (items) удалено";
        }
        if (!itemsInBase && itemsInCurrent) {
            return "Описание элементов массива (items) добавлено";
        }
        return "Описание элементов массива (items) изменено";
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.WARNING;
    }
}
