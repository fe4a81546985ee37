package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Из enum удалены значения: ранее валидные данные могут быть отклонены
 *
 * Значения хранятся уже отрендеренными JSON литералами.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class EnumValuesRemovedRule extends SchemaRule {
    
    private final List<String> values;
    
    public EnumValuesRemovedRule(String schemaName, String propertyPath, List<String> values) {
        super(schemaName, propertyPath);
        this.values = values == null ? Collections.emptyList() : List.copyOf(values);
    }
    
    @Override
    public String getName() {
        return "EnumValuesRemoved";
    }
    
    @Override
    public String getDescription() {
        return String.format("Удалены значения enum: [%s]", String.join(", ", values));
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.BREAKING;
    }
}
