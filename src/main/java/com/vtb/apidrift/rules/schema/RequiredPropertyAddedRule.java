package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Свойство стало обязательным: либо добавлено сразу обязательным,
 * либо существующее свойство попало в required
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RequiredPropertyAddedRule extends SchemaRule {
    
    private final boolean newProperty;
    
    public RequiredPropertyAddedRule(String schemaName, String propertyPath, boolean newProperty) {
        super(schemaName, propertyPath);
        this.newProperty = newProperty;
    }
    
    @Override
    public String getName() {
        return "RequiredPropertyAdded";
    }
    
    @Override
    public String getDescription() {
        if (newProperty) {
            return String.format("Добавлено обязательное свойство '%s'", getPropertyName());
        }
        return String.format("Свойство '%s' стало обязательным", getPropertyName());
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.BREAKING;
    }
}
