package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Схема появилась только в новой версии
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SchemaAddedRule extends SchemaRule {
    
    public SchemaAddedRule(String schemaName) {
        super(schemaName, "");
    }
    
    @Override
    public String getName() {
        return "SchemaAdded";
    }
    
    @Override
    public String getDescription() {
        return String.format("Схема '%s' добавлена", getSchemaName());
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.CHANGE;
    }
}
