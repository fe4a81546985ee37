package com.vtb.apidrift.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.apidrift.models.ChangeLevel;
import com.vtb.apidrift.models.DiffResult;
import com.vtb.apidrift.models.FullSchemaInfo;
import com.vtb.apidrift.models.MatchResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;
    private final ChangeLevel minChangeLevel;
    private final boolean includeUnchanged;

    public JsonReportGenerator() {
        this(ChangeLevel.CHANGE, true);
    }

    public JsonReportGenerator(ChangeLevel minChangeLevel, boolean includeUnchanged) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.minChangeLevel = minChangeLevel == null ? ChangeLevel.CHANGE : minChangeLevel;
        this.includeUnchanged = includeUnchanged;
    }

    @Override
    public void generate(DiffResult result, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        // КРИТИЧНО: Защита от NPE
        if (result == null) {
            throw new IllegalArgumentException("DiffResult не может быть null");
        }

        String json = objectMapper.writeValueAsString(forReport(result));
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, json);

        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    /**
     * Копия результата с учетом фильтров отчета. Статистика остается полной.
     */
    DiffResult forReport(DiffResult result) {
        List<MatchResult> schemaResults = ResultAssembler.filter(
            result.getSchemaResults(), minChangeLevel, includeUnchanged);
        Set<String> kept = schemaResults.stream()
            .map(MatchResult::getName)
            .collect(Collectors.toSet());

        List<FullSchemaInfo> fullSchemas = new ArrayList<>();
        if (result.getFullSchemas() != null) {
            for (FullSchemaInfo info : result.getFullSchemas()) {
                if (info != null && kept.contains(info.getName())) {
                    fullSchemas.add(info);
                }
            }
        }

        return DiffResult.builder()
            .baseApiName(result.getBaseApiName())
            .baseApiVersion(result.getBaseApiVersion())
            .currentApiName(result.getCurrentApiName())
            .currentApiVersion(result.getCurrentApiVersion())
            .comparisonTimestamp(result.getComparisonTimestamp())
            .schemaResults(schemaResults)
            .fullSchemas(fullSchemas)
            .statistics(result.getStatistics())
            .build();
    }
}
