package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Изменилось ограничение format (в том числе появилось или исчезло)
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class FormatChangedRule extends SchemaRule {
    
    private final String oldFormat;
    private final String newFormat;
    
    public FormatChangedRule(String schemaName, String propertyPath, String oldFormat, String newFormat) {
        super(schemaName, propertyPath);
        this.oldFormat = oldFormat;
        this.newFormat = newFormat;
    }
    
    @Override
    public String getName() {
        return "FormatChanged";
    }
    
    @Override
    public String getDescription() {
        return String.format("Формат изменен с '%s' на '%s'", orNone(oldFormat), orNone(newFormat));
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.WARNING;
    }
}
