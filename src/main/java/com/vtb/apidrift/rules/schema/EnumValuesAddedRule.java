package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * В enum появились новые значения
 *
 * Значения хранятся уже отрендеренными JSON литералами.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class EnumValuesAddedRule extends SchemaRule {
    
    private final List<String> values;
    
    public EnumValuesAddedRule(String schemaName, String propertyPath, List<String> values) {
        super(schemaName, propertyPath);
        this.values = values == null ? Collections.emptyList() : List.copyOf(values);
    }
    
    @Override
    public String getName() {
        return "EnumValuesAdded";
    }
    
    @Override
    public String getDescription() {
        return String.format("Добавлены значения enum: [%s]", String.join(", ", values));
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.CHANGE;
    }
}
