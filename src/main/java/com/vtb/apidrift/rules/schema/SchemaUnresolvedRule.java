package com.vtb.apidrift.rules.schema;

import com.vtb.apidrift.models.ChangeLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * $ref ссылка не разрешается внутри документа, сравнение ветки остановлено
 *
 * Диагностическое правило: не ошибка, а пометка, что дальше сравнить нельзя.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SchemaUnresolvedRule extends SchemaRule {
    
    private final String pointer;
    
    public SchemaUnresolvedRule(String schemaName, String propertyPath, String pointer) {
        super(schemaName, propertyPath);
        this.pointer = pointer;
    }
    
    @Override
    public String getName() {
        return "SchemaUnresolved";
    }
    
    @Override
    public String getDescription() {
        return String.format("Не удалось разрешить ссылку '%s', сравнение остановлено", orNone(pointer));
    }
    
    @Override
    public ChangeLevel getChangeLevel() {
        return ChangeLevel.CHANGE;
    }
}
