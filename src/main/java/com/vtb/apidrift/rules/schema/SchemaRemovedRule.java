package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Схема есть только в базовой версии
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SchemaRemovedRule extends SchemaRule {
    
    public SchemaRemovedRule(String schemaName) {
        super(schemaName, "");
    }
    
    @Override
    public String getName() {
        return "SchemaRemoved";
    }
    
    @Override
    public String getDescription() {
        return String.format("Схема '%s' удалена", getSchemaName());
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.BREAKING;
    }
}
