package com.vtb.apidrift.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.apidrift.core.SchemaReferenceResolver.Resolution;
import com.vtb.apidrift.models.MatchResult;
import com.vtb.apidrift.models.RuleViolation;
import com.vtb.apidrift.rules.Rule;
import com.vtb.apidrift.rules.schema.ArrayItemsChangedRule;
import com.vtb.apidrift.rules.schema.DescriptionChangedRule;
import com.vtb.apidrift.rules.schema.EnumValuesAddedRule;
import com.vtb.apidrift.rules.schema.EnumValuesRemovedRule;
import com.vtb.apidrift.rules.schema.FormatChangedRule;
import com.vtb.apidrift.rules.schema.NullableChangedRule;
import com.vtb.apidrift.rules.schema.PropertyAddedRule;
import com.vtb.apidrift.rules.schema.PropertyRemovedRule;
import com.vtb.apidrift.rules.schema.RequiredPropertyAddedRule;
import com.vtb.apidrift.rules.schema.RequiredPropertyRemovedRule;
import com.vtb.apidrift.rules.schema.SchemaAddedRule;
import com.vtb.apidrift.rules.schema.SchemaRemovedRule;
import com.vtb.apidrift.rules.schema.SchemaUnresolvedRule;
import com.vtb.apidrift.rules.schema.TypeChangedRule;
import com.vtb.apidrift.util.SchemaInspector;
import io.swagger.v3.oas.models.media.Schema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Сравнение именованных схем двух версий OpenAPI документа
 *
 * Для каждого имени из объединения таблиц (в лексикографическом порядке)
 * выдает ровно один MatchResult. Таблицы не изменяются, состояние между
 * вызовами не хранится.
 *
 * Порядок нарушений внутри схемы: тип, свойства (по имени, рекурсивно в глубину),
 * элементы массива, enum, format, nullable, description.
 */
@Slf4j
public class SchemaMatcher implements ApiMatcher {

    /**
     * Максимальная глубина вложенности сравнения (корень схемы - уровень 0)
     *
     * Дополнительная защита от патологических входных данных поверх проверки циклов.
     * Поддерево глубже просто не сравнивается, нарушения для него не создаются.
     */
    public static final int MAX_DEPTH = 10;

    private final Map<String, Schema<?>> baseSchemas;
    private final Map<String, Schema<?>> currentSchemas;
    private final SchemaReferenceResolver baseResolver;
    private final SchemaReferenceResolver currentResolver;

    public SchemaMatcher(Map<String, Schema<?>> baseSchemas, Map<String, Schema<?>> currentSchemas) {
        this.baseSchemas = baseSchemas == null ? Collections.emptyMap() : baseSchemas;
        this.currentSchemas = currentSchemas == null ? Collections.emptyMap() : currentSchemas;
        this.baseResolver = new SchemaReferenceResolver(this.baseSchemas);
        this.currentResolver = new SchemaReferenceResolver(this.currentSchemas);
    }

    /**
     * Сравнить все схемы обеих версий
     */
    @Override
    public List<MatchResult> match() {
        SortedSet<String> names = new TreeSet<>();
        collectNames(baseSchemas, names);
        collectNames(currentSchemas, names);

        log.info("Сравнение схем: базовая версия {}, текущая {}, всего имен {}",
            baseSchemas.size(), currentSchemas.size(), names.size());

        List<MatchResult> results = new ArrayList<>(names.size());
        for (String name : names) {
            MatchResult result = new MatchResult(name, compareSchema(name));
            if (result.hasViolations()) {
                log.debug("Схема '{}': {} изменений, уровень {}",
                    name, result.getViolations().size(), result.getChangeLevel());
            }
            results.add(result);
        }
        return results;
    }

    private static void collectNames(Map<String, Schema<?>> schemas, Set<String> target) {
        for (Map.Entry<String, Schema<?>> entry : schemas.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                target.add(entry.getKey());
            }
        }
    }

    /**
     * Сравнить одну схему по имени
     */
    List<RuleViolation> compareSchema(String schemaName) {
        List<RuleViolation> violations = new ArrayList<>();
        Schema<?> base = baseSchemas.get(schemaName);
        Schema<?> current = currentSchemas.get(schemaName);

        if (current == null) {
            violations.add(new RuleViolation(new SchemaRemovedRule(schemaName)));
            return violations;
        }
        if (base == null) {
            violations.add(new RuleViolation(new SchemaAddedRule(schemaName)));
            return violations;
        }

        Set<String> root = Collections.singleton(schemaName);
        Resolution baseResolution = baseResolver.resolve(base, root);
        Resolution currentResolution = currentResolver.resolve(current, root);

        if (baseResolution.isUnresolved() || currentResolution.isUnresolved()) {
            String pointer = baseResolution.isUnresolved()
                ? baseResolution.getPointer()
                : currentResolution.getPointer();
            log.debug("Схема '{}' ссылается на неразрешимую схему {}", schemaName, pointer);
            violations.add(new RuleViolation(new SchemaUnresolvedRule(schemaName, "", pointer)));
            return violations;
        }
        if (baseResolution.isCycle() || currentResolution.isCycle()) {
            log.debug("Схема '{}' является циклом ссылок, сравнение пропущено", schemaName);
            return violations;
        }

        CallContext context = new CallContext(schemaName, violations);
        compareNodes(context, "",
            baseResolution.getSchema(), currentResolution.getSchema(),
            baseResolution.getVisited(), currentResolution.getVisited(), 0);
        return violations;
    }

    /**
     * Сравнить два разрешенных узла на одном пути
     */
    private void compareNodes(CallContext context, String path,
                              Schema<?> base, Schema<?> current,
                              Set<String> baseVisited, Set<String> currentVisited,
                              int depth) {
        Set<String> baseTypes = SchemaInspector.typeSet(base);
        Set<String> currentTypes = SchemaInspector.typeSet(current);
        if (!baseTypes.equals(currentTypes)) {
            context.report(new TypeChangedRule(context.schemaName, path, baseTypes, currentTypes));
        }

        compareProperties(context, path, base, current, baseVisited, currentVisited, depth);
        compareArrayItems(context, path, base, current, baseVisited, currentVisited, depth);
        compareEnums(context, path, base, current);

        if (!Objects.equals(base.getFormat(), current.getFormat())) {
            context.report(new FormatChangedRule(context.schemaName, path, base.getFormat(), current.getFormat()));
        }

        boolean baseNullable = SchemaInspector.isNullable(base);
        boolean currentNullable = SchemaInspector.isNullable(current);
        if (baseNullable != currentNullable) {
            context.report(new NullableChangedRule(context.schemaName, path, baseNullable, currentNullable));
        }

        if (!Objects.equals(base.getDescription(), current.getDescription())) {
            context.report(new DescriptionChangedRule(context.schemaName, path,
                base.getDescription(), current.getDescription()));
        }
    }

    /**
     * Свойства и required.
     *
     * Удаление свойства и снятие обязательности - разные события: удаленное
     * обязательное свойство дает только PropertyRemoved.
     */
    private void compareProperties(CallContext context, String path,
                                   Schema<?> base, Schema<?> current,
                                   Set<String> baseVisited, Set<String> currentVisited,
                                   int depth) {
        Map<String, Schema<?>> baseProperties = SchemaInspector.properties(base);
        Map<String, Schema<?>> currentProperties = SchemaInspector.properties(current);
        Set<String> baseRequired = SchemaInspector.requiredNames(base);
        Set<String> currentRequired = SchemaInspector.requiredNames(current);

        SortedSet<String> names = new TreeSet<>();
        names.addAll(baseProperties.keySet());
        names.addAll(currentProperties.keySet());
        names.addAll(baseRequired);
        names.addAll(currentRequired);

        for (String name : names) {
            String propertyPath = path.isEmpty() ? name : path + "." + name;
            Schema<?> baseProperty = baseProperties.get(name);
            Schema<?> currentProperty = currentProperties.get(name);
            boolean requiredInBase = baseRequired.contains(name);
            boolean requiredInCurrent = currentRequired.contains(name);

            if (baseProperty != null && currentProperty == null) {
                context.report(new PropertyRemovedRule(context.schemaName, propertyPath, requiredInBase));
                continue;
            }
            if (baseProperty == null && currentProperty != null) {
                if (requiredInCurrent) {
                    context.report(new RequiredPropertyAddedRule(context.schemaName, propertyPath, true));
                } else {
                    context.report(new PropertyAddedRule(context.schemaName, propertyPath));
                }
                continue;
            }

            // Свойство есть в обеих версиях (или только в списках required)
            if (requiredInBase && !requiredInCurrent) {
                context.report(new RequiredPropertyRemovedRule(context.schemaName, propertyPath));
            } else if (!requiredInBase && requiredInCurrent) {
                context.report(new RequiredPropertyAddedRule(context.schemaName, propertyPath, false));
            }

            if (baseProperty != null) {
                compareChild(context, propertyPath, baseProperty, currentProperty,
                    baseVisited, currentVisited, depth + 1);
            }
        }
    }

    private void compareArrayItems(CallContext context, String path,
                                   Schema<?> base, Schema<?> current,
                                   Set<String> baseVisited, Set<String> currentVisited,
                                   int depth) {
        if (!SchemaInspector.isArray(base) || !SchemaInspector.isArray(current)) {
            return;
        }
        Schema<?> baseItems = base.getItems();
        Schema<?> currentItems = current.getItems();
        if (baseItems == null && currentItems == null) {
            return;
        }
        if (baseItems == null || currentItems == null) {
            context.report(new ArrayItemsChangedRule(context.schemaName, path,
                baseItems != null, currentItems != null));
            return;
        }
        compareChild(context, path + "[]", baseItems, currentItems, baseVisited, currentVisited, depth + 1);
    }

    private void compareEnums(CallContext context, String path, Schema<?> base, Schema<?> current) {
        Set<JsonNode> baseValues = SchemaInspector.enumValues(base);
        Set<JsonNode> currentValues = SchemaInspector.enumValues(current);

        Set<JsonNode> removed = new LinkedHashSet<>(baseValues);
        removed.removeAll(currentValues);
        Set<JsonNode> added = new LinkedHashSet<>(currentValues);
        added.removeAll(baseValues);

        if (!removed.isEmpty()) {
            context.report(new EnumValuesRemovedRule(context.schemaName, path, SchemaInspector.render(removed)));
        }
        if (!added.isEmpty()) {
            context.report(new EnumValuesAddedRule(context.schemaName, path, SchemaInspector.render(added)));
        }
    }

    /**
     * Спуск во вложенный узел (свойство или items) с разрешением ссылок
     */
    private void compareChild(CallContext context, String path,
                              Schema<?> base, Schema<?> current,
                              Set<String> baseVisited, Set<String> currentVisited,
                              int depth) {
        if (depth >= MAX_DEPTH) {
            log.debug("Достигнута максимальная глубина {} в схеме '{}' (путь: {})",
                MAX_DEPTH, context.schemaName, path);
            return;
        }

        Resolution baseResolution = baseResolver.resolve(base, baseVisited);
        Resolution currentResolution = currentResolver.resolve(current, currentVisited);

        if (baseResolution.isUnresolved() || currentResolution.isUnresolved()) {
            String pointer = baseResolution.isUnresolved()
                ? baseResolution.getPointer()
                : currentResolution.getPointer();
            context.report(new SchemaUnresolvedRule(context.schemaName, path, pointer));
            return;
        }
        if (baseResolution.isCycle() || currentResolution.isCycle()) {
            return;
        }

        compareNodes(context, path,
            baseResolution.getSchema(), currentResolution.getSchema(),
            baseResolution.getVisited(), currentResolution.getVisited(), depth);
    }

    /**
     * Состояние сравнения одной схемы: имя и накопленные нарушения
     */
    private static final class CallContext {
        final String schemaName;
        final List<RuleViolation> violations;

        private CallContext(String schemaName, List<RuleViolation> violations) {
            this.schemaName = schemaName;
            this.violations = violations;
        }

        void report(Rule rule) {
            violations.add(new RuleViolation(rule));
        }
    }
}
