package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Изменилось описание. Чисто информационное изменение.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DescriptionChangedRule extends SchemaRule {
    
    private final String oldDescription;
    private final String newDescription;
    
    public DescriptionChangedRule(String schemaName, String propertyPath, String oldDescription, String newDescription) {
        super(schemaName, propertyPath);
        this.oldDescription = oldDescription;
        this.newDescription = newDescription;
    }
    
    @Override
    public String getName() {
        return "DescriptionChanged";
    }
    
    @Override
    public String getDescription() {
        return String.format("Описание изменено с '%s' на '%s'", orNone(oldDescription), orNone(newDescription));
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.CHANGE;
    }
}
