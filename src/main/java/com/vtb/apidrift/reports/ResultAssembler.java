package com.vtb.apidrift.reports;

import com.vtb.apidrift.core.SchemaReferenceResolver;
import com.vtb.apidrift.core.SchemaReferenceResolver.Resolution;
import com.vtb.apidrift.models.ChangeLevel;
import com.vtb.apidrift.models.DiffResult;
import com.vtb.apidrift.models.DiffStatistics;
import com.vtb.apidrift.models.FullSchemaInfo;
import com.vtb.apidrift.models.MatchResult;
import com.vtb.apidrift.models.RuleViolation;
import com.vtb.apidrift.models.SchemaProperty;
import com.vtb.apidrift.models.ViolationInfo;
import com.vtb.apidrift.util.SchemaInspector;
import io.swagger.v3.oas.models.media.Schema;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Упаковка результатов сравнения для рендереров
 *
 * Рендерерам не нужно повторно разрешать ссылки: все, что им нужно,
 * собирается здесь один раз.
 */
@Slf4j
public class ResultAssembler {

    private final Map<String, Schema<?>> currentSchemas;
    private final SchemaReferenceResolver currentResolver;

    public ResultAssembler(Map<String, Schema<?>> currentSchemas) {
        this.currentSchemas = currentSchemas == null ? Collections.emptyMap() : currentSchemas;
        this.currentResolver = new SchemaReferenceResolver(this.currentSchemas);
    }

    /**
     * Собрать итоговый DiffResult
     */
    public DiffResult assemble(String baseApiName, String baseApiVersion,
                               String currentApiName, String currentApiVersion,
                               int baseSchemaCount, List<MatchResult> results,
                               long durationMs) {
        List<MatchResult> ordered = order(results);
        DiffStatistics statistics = buildStatistics(baseSchemaCount, ordered, durationMs);

        log.info("Схем с изменениями: {} из {} (ломающих: {}, предупреждений: {})",
            statistics.getChangedSchemas(), statistics.getComparedSchemas(),
            statistics.getBreakingSchemas(), statistics.getWarningSchemas());

        return DiffResult.builder()
            .baseApiName(baseApiName)
            .baseApiVersion(baseApiVersion)
            .currentApiName(currentApiName)
            .currentApiVersion(currentApiVersion)
            .comparisonTimestamp(LocalDateTime.now())
            .schemaResults(ordered)
            .fullSchemas(buildFullSchemaInfos(ordered))
            .statistics(statistics)
            .build();
    }

    /**
     * Порядок по имени схемы, как у матчера
     */
    public static List<MatchResult> order(List<MatchResult> results) {
        if (results == null) {
            return new ArrayList<>();
        }
        return results.stream()
            .sorted(Comparator.comparing(MatchResult::getName))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Группировка по уровню: сначала ломающие, потом предупреждения, потом прочие.
     * Внутри группы сохраняется исходный порядок.
     */
    public static Map<ChangeLevel, List<MatchResult>> groupByChangeLevel(List<MatchResult> results) {
        Map<ChangeLevel, List<MatchResult>> groups = new LinkedHashMap<>();
        for (ChangeLevel level : ChangeLevel.values()) {
            groups.put(level, new ArrayList<>());
        }
        if (results != null) {
            for (MatchResult result : results) {
                groups.get(result.getChangeLevel()).add(result);
            }
        }
        return groups;
    }

    /**
     * Фильтр для отчета: уровень не ниже minLevel, схемы без изменений - по флагу.
     * Результаты матчера при этом не меняются.
     */
    public static List<MatchResult> filter(List<MatchResult> results, ChangeLevel minLevel, boolean includeUnchanged) {
        if (results == null) {
            return new ArrayList<>();
        }
        return results.stream()
            .filter(r -> includeUnchanged || r.hasViolations())
            .filter(r -> !r.hasViolations() || r.getChangeLevel().isAtLeast(minLevel))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    private DiffStatistics buildStatistics(int baseSchemaCount, List<MatchResult> results, long durationMs) {
        List<RuleViolation> violations = results.stream()
            .flatMap(r -> r.getViolations().stream())
            .collect(Collectors.toList());
        List<MatchResult> changed = results.stream()
            .filter(MatchResult::hasViolations)
            .collect(Collectors.toList());

        return DiffStatistics.builder()
            .baseSchemas(baseSchemaCount)
            .currentSchemas(currentSchemas.size())
            .comparedSchemas(results.size())
            .changedSchemas(changed.size())
            .breakingSchemas(countSchemas(changed, ChangeLevel.BREAKING))
            .warningSchemas(countSchemas(changed, ChangeLevel.WARNING))
            .totalViolations(violations.size())
            .breakingViolations(countViolations(violations, ChangeLevel.BREAKING))
            .warningViolations(countViolations(violations, ChangeLevel.WARNING))
            .changeViolations(countViolations(violations, ChangeLevel.CHANGE))
            .comparisonDurationMs(durationMs)
            .build();
    }

    private static int countSchemas(List<MatchResult> results, ChangeLevel level) {
        return (int) results.stream().filter(r -> r.getChangeLevel() == level).count();
    }

    private static int countViolations(List<RuleViolation> violations, ChangeLevel level) {
        return (int) violations.stream().filter(v -> v.getChangeLevel() == level).count();
    }

    /**
     * Полная информация по каждой измененной схеме, существующей в текущей версии
     */
    public List<FullSchemaInfo> buildFullSchemaInfos(List<MatchResult> results) {
        List<FullSchemaInfo> infos = new ArrayList<>();
        if (results == null) {
            return infos;
        }
        for (MatchResult result : results) {
            if (!result.hasViolations()) {
                continue;
            }
            Schema<?> current = currentSchemas.get(result.getName());
            if (current == null) {
                continue;
            }
            Resolution resolution = currentResolver.resolve(current, Collections.singleton(result.getName()));
            if (!resolution.isResolved()) {
                log.debug("Схема '{}' не разрешается, полная информация не строится", result.getName());
                continue;
            }
            infos.add(buildFullSchemaInfo(result, resolution.getSchema()));
        }
        return infos;
    }

    private FullSchemaInfo buildFullSchemaInfo(MatchResult result, Schema<?> schema) {
        Map<String, Schema<?>> properties = SchemaInspector.properties(schema);
        Set<String> required = SchemaInspector.requiredNames(schema);

        // Раскладываем нарушения по первому сегменту пути
        Map<String, List<ViolationInfo>> byProperty = new LinkedHashMap<>();
        List<ViolationInfo> schemaLevel = new ArrayList<>();
        for (RuleViolation violation : result.getViolations()) {
            String owner = topLevelProperty(violation.getPropertyPath());
            ViolationInfo info = ViolationInfo.from(violation);
            if (owner.isEmpty() || !properties.containsKey(owner)) {
                schemaLevel.add(info);
            } else {
                byProperty.computeIfAbsent(owner, k -> new ArrayList<>()).add(info);
            }
        }

        List<SchemaProperty> schemaProperties = new ArrayList<>();
        for (Map.Entry<String, Schema<?>> entry : properties.entrySet()) {
            String name = entry.getKey();
            Resolution resolution = currentResolver.resolve(entry.getValue(), Collections.singleton(result.getName()));
            Schema<?> property = resolution.isResolved() ? resolution.getSchema() : entry.getValue();
            Set<String> types = SchemaInspector.typeSet(property);

            schemaProperties.add(SchemaProperty.builder()
                .name(name)
                .propertyType(types.isEmpty() ? null : String.join(" | ", types))
                .format(property.getFormat())
                .description(property.getDescription())
                .required(required.contains(name))
                .nullable(SchemaInspector.isNullable(property))
                .enumValues(SchemaInspector.render(SchemaInspector.enumValues(property)))
                .violations(byProperty.getOrDefault(name, new ArrayList<>()))
                .build());
        }

        // Сначала обязательные, потом по имени
        schemaProperties.sort(Comparator
            .comparing((SchemaProperty p) -> !p.isRequired())
            .thenComparing(SchemaProperty::getName));

        return FullSchemaInfo.builder()
            .name(result.getName())
            .description(schema.getDescription())
            .changeLevel(result.getChangeLevel())
            .properties(schemaProperties)
            .schemaLevelViolations(schemaLevel)
            .build();
    }

    static String topLevelProperty(String propertyPath) {
        if (propertyPath == null || propertyPath.isEmpty()) {
            return "";
        }
        int end = propertyPath.length();
        int dot = propertyPath.indexOf('.');
        if (dot >= 0) {
            end = dot;
        }
        int bracket = propertyPath.indexOf("[]");
        if (bracket >= 0 && bracket < end) {
            end = bracket;
        }
        return propertyPath.substring(0, end);
    }
}
