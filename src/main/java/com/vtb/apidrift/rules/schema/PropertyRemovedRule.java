package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Свойство удалено
 *
 * Удаление обязательного свойства тоже сообщается одним этим правилом,
 * RequiredPropertyRemovedRule используется только когда свойство осталось.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PropertyRemovedRule extends SchemaRule {
    
    private final boolean wasRequired;
    
    public PropertyRemovedRule(String schemaName, String propertyPath, boolean wasRequired) {
        super(schemaName, propertyPath);
        this.wasRequired = wasRequired;
    }
    
    @Override
    public String getName() {
        return "PropertyRemoved";
    }
    
    @Override
    public String getDescription() {
        if (wasRequired) {
            return String.format("Обязательное свойство '%s' удалено", getPropertyName());
        }
        return String.format("Свойство '%s' удалено", getPropertyName());
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.BREAKING;
    }
}
