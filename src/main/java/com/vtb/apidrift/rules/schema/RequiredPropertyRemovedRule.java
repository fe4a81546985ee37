package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Свойство осталось, но больше не обязательно
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RequiredPropertyRemovedRule extends SchemaRule {
    
    public RequiredPropertyRemovedRule(String schemaName, String propertyPath) {
        super(schemaName, propertyPath);
    }
    
    @Override
    public String getName() {
        return "RequiredPropertyRemoved";
    }
    
    @Override
    public String getDescription() {
        return String.format("Свойство '%s' больше не обязательно", getPropertyName());
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.CHANGE;
    }
}
