package com.vtb.apidrift.core;

import com.vtb.apidrift.models.DiffResult;
import com.vtb.apidrift.models.MatchResult;
import com.vtb.apidrift.reports.ResultAssembler;
import io.swagger.v3.oas.models.media.Schema;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Главный движок сравнения двух версий API
 * Координирует загрузчики, матчер схем и сборку результата
 */
@Slf4j
public class ApiDiffer {

    private final OpenAPIParser baseParser;
    private final OpenAPIParser currentParser;

    public ApiDiffer(OpenAPIParser baseParser, OpenAPIParser currentParser) {
        this.baseParser = baseParser;
        this.currentParser = currentParser;
    }

    /**
     * Запустить полное сравнение
     */
    public DiffResult diff() {
        log.info("=== Начало сравнения версий API ===");

        // КРИТИЧНО: Проверка загрузчиков на null
        if (baseParser == null || currentParser == null) {
            throw new IllegalStateException("Parser не инициализирован");
        }
        if (baseParser.getOpenAPI() == null || currentParser.getOpenAPI() == null) {
            throw new IllegalStateException("OpenAPI спецификация не загружена");
        }

        log.info("Базовая версия: {} v{}", baseParser.getApiTitle(), baseParser.getApiVersion());
        log.info("Текущая версия: {} v{}", currentParser.getApiTitle(), currentParser.getApiVersion());

        long startTime = System.currentTimeMillis();

        Map<String, Schema<?>> baseSchemas = baseParser.getSchemaTable();
        Map<String, Schema<?>> currentSchemas = currentParser.getSchemaTable();

        ApiMatcher matcher = new SchemaMatcher(baseSchemas, currentSchemas);
        List<MatchResult> results = matcher.match();

        long duration = System.currentTimeMillis() - startTime;

        DiffResult result = new ResultAssembler(currentSchemas).assemble(
            baseParser.getApiTitle(), baseParser.getApiVersion(),
            currentParser.getApiTitle(), currentParser.getApiVersion(),
            baseSchemas.size(), results, duration);

        log.info("=== Сравнение завершено за {} мс ===", duration);
        return result;
    }
}
