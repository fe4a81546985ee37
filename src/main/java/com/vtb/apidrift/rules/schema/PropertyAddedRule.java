package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Новое необязательное свойство
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PropertyAddedRule extends SchemaRule {
    
    public PropertyAddedRule(String schemaName, String propertyPath) {
        super(schemaName, propertyPath);
    }
    
    @Override
    public String getName() {
        return "PropertyAdded";
    }
    
    @Override
    public String getDescription() {
        return String.format("Свойство '%s' добавлено", getPropertyName());
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.CHANGE;
    }
}
