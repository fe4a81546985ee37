package com.vtb.apidrift.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.apidrift.core.ApiDiffer;
import com.vtb.apidrift.core.OpenAPIParser;
import com.vtb.apidrift.models.ChangeLevel;
import com.vtb.apidrift.models.DiffResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для JsonReportGenerator
 */
class JsonReportGeneratorTest {

    @TempDir
    Path tempDir;

    private DiffResult result;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        OpenAPIParser base = new OpenAPIParser();
        base.parseFromFile("src/test/resources/specs/base-api.yaml");
        OpenAPIParser current = new OpenAPIParser();
        current.parseFromFile("src/test/resources/specs/current-api.yaml");
        result = new ApiDiffer(base, current).diff();
    }

    private static List<String> names(JsonNode array) {
        List<String> names = new ArrayList<>();
        array.forEach(node -> names.add(node.get("name").asText()));
        return names;
    }

    @Test
    void testGenerateFullReport() throws Exception {
        Path output = tempDir.resolve("report.json");

        new JsonReportGenerator().generate(result, output);

        assertTrue(Files.exists(output), "Файл отчета должен быть создан");
        JsonNode root = mapper.readTree(output.toFile());
        assertEquals("Accounts API", root.get("baseApiName").asText());
        assertEquals("2.0.0", root.get("currentApiVersion").asText());
        assertTrue(root.get("comparisonTimestamp").isTextual(), "Дата в формате ISO");
        assertEquals(7, root.get("schemaResults").size());
        assertEquals(7, root.get("statistics").get("totalViolations").asInt());
        assertEquals(4, root.get("fullSchemas").size());
    }

    @Test
    void testViolationFields() throws Exception {
        Path output = tempDir.resolve("report.json");
        new JsonReportGenerator().generate(result, output);

        JsonNode status = null;
        for (JsonNode node : mapper.readTree(output.toFile()).get("schemaResults")) {
            if ("Status".equals(node.get("name").asText())) {
                status = node;
            }
        }
        assertNotNull(status);
        assertEquals("BREAKING", status.get("changeLevel").asText());

        JsonNode violation = status.get("violations").get(0);
        assertEquals("EnumValuesRemoved", violation.get("name").asText());
        assertEquals("BREAKING", violation.get("changeLevel").asText());
        assertEquals("SCHEMA", violation.get("category").asText());
        assertEquals("schema: Status", violation.get("context").asText());
        assertEquals("", violation.get("propertyPath").asText());
        assertTrue(violation.get("description").asText().contains("INACTIVE"));
        assertFalse(violation.has("rule"), "Внутреннее правило не сериализуется");
    }

    @Test
    void testFiltersApplyToReportOnly() throws Exception {
        Path output = tempDir.resolve("breaking.json");

        new JsonReportGenerator(ChangeLevel.BREAKING, false).generate(result, output);

        JsonNode root = mapper.readTree(output.toFile());
        assertEquals(List.of("Legacy", "Status", "User"), names(root.get("schemaResults")));
        assertEquals(List.of("Status", "User"), names(root.get("fullSchemas")));
        assertEquals(7, root.get("statistics").get("comparedSchemas").asInt(), "Статистика остается полной");
        assertEquals(7, result.getSchemaResults().size(), "Исходный результат не изменяется");
    }

    @Test
    void testCreatesParentDirectories() throws Exception {
        Path output = tempDir.resolve("nested/dir/report.json");

        new JsonReportGenerator().generate(result, output);

        assertTrue(Files.exists(output));
    }

    @Test
    void testNullResultIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new JsonReportGenerator().generate(null, tempDir.resolve("x.json")));
        assertEquals("json", new JsonReportGenerator().getFileExtension());
    }

    @Test
    void testResolveOutputPath() {
        ReportGenerator generator = new JsonReportGenerator();

        assertEquals(tempDir.resolve("drift.json"), generator.resolveOutputPath(tempDir.resolve("drift")));
        assertEquals(tempDir.resolve("drift.txt"), generator.resolveOutputPath(tempDir.resolve("drift.txt")),
            "Явно заданное расширение не меняется");
    }
}
