package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Изменился набор типов узла
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TypeChangedRule extends SchemaRule {
    
    private final Set<String> oldTypes;
    private final Set<String> newTypes;
    
    public TypeChangedRule(String schemaName, String propertyPath, Set<String> oldTypes, Set<String> newTypes) {
        super(schemaName, propertyPath);
        this.oldTypes = Collections.unmodifiableSet(new TreeSet<>(oldTypes));
        this.newTypes = Collections.unmodifiableSet(new TreeSet<>(newTypes));
    }
    
    @Override
    public String getName() {
        return "TypeChanged";
    }
    
    @Override
    public String getDescription() {
        return String.format("Тип изменен с '%s' на '%s'", render(oldTypes), render(newTypes));
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.BREAKING;
    }
    
    private static String render(Set<String> types) {
        return types.isEmpty() ? NONE : String.join(" | ", types);
    }
}
