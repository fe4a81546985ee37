package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Изменился флаг nullable
 *
 * Уровень зависит от направления:
 * nullable -> не nullable = BREAKING (поле, ранее допускавшее null, теперь обязано иметь значение),
 * не nullable -> nullable = WARNING (потребители могут начать получать null).
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class NullableChangedRule extends SchemaRule {
    
    private final boolean oldNullable;
    private final boolean newNullable;
    
    public NullableChangedRule(String schemaName, String propertyPath, boolean oldNullable, boolean newNullable) {
        super(schemaName, propertyPath);
        this.oldNullable = oldNullable;
        this.newNullable = newNullable;
    }
    
    @Override
    public String getName() {
        return "NullableChanged";
    }
    
    @Override
    public String getDescription() {
        return String.format("Nullable изменен с %s на %s", oldNullable, newNullable);
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        if (oldNullable && !newNullable) {
            return ChangeLevel.BREAKING;
        }
        if (!oldNullable && newNullable) {
            return ChangeLevel.WARNING;
        }
        return ChangeLevel.CHANGE;
    }
}
