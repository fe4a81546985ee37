package com.vtb.apidrift.core;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.media.Schema;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для OpenAPIParser
 */
class OpenAPIParserTest {

    private static final String BASE_SPEC = "src/test/resources/specs/base-api.yaml";

    @Test
    void testParseValidYaml() {
        OpenAPIParser parser = new OpenAPIParser();
        parser.parseFromFile(BASE_SPEC);

        OpenAPI openAPI = parser.getOpenAPI();
        assertNotNull(openAPI, "OpenAPI объект должен быть создан");
        assertEquals("Accounts API", parser.getApiTitle());
        assertEquals("1.0.0", parser.getApiVersion());
        assertTrue(parser.getSpecificationSource().endsWith("base-api.yaml"));
    }

    @Test
    void testSchemaTableKeepsReferences() {
        OpenAPIParser parser = new OpenAPIParser();
        parser.parseFromFile(BASE_SPEC);

        Map<String, Schema<?>> schemas = parser.getSchemaTable();
        assertEquals(6, schemas.size(), "Должны быть загружены все схемы components");
        Schema<?> address = (Schema<?>) schemas.get("User").getProperties().get("address");
        assertEquals("#/components/schemas/Address", address.get$ref(),
            "Внутренние $ref должны остаться нетронутыми");
    }

    @Test
    void testParseFromContent() {
        OpenAPIParser parser = new OpenAPIParser();
        parser.parseFromContent("""
            openapi: 3.0.3
            info:
              title: Inline
              version: 0.1.0
            paths: {}
            components:
              schemas:
                Id:
                  type: string
            """);

        assertEquals("Inline", parser.getApiTitle());
        assertEquals(1, parser.getSchemaTable().size());
        assertEquals("inline", parser.getSpecificationSource());
    }

    @Test
    void testDocumentWithoutComponentsHasEmptyTable() {
        OpenAPIParser parser = new OpenAPIParser();
        parser.parseFromContent("""
            openapi: 3.0.3
            info:
              title: Empty
              version: 1.0.0
            paths: {}
            """);

        assertTrue(parser.getSchemaTable().isEmpty());
    }

    @Test
    void testParseInvalidFile() {
        OpenAPIParser parser = new OpenAPIParser();

        assertThrows(IllegalArgumentException.class, () -> {
            parser.parseFromFile("nonexistent.yaml");
        }, "Должна быть ошибка при несуществующем файле");
    }

    @Test
    void testParseBlankPath() {
        assertThrows(IllegalArgumentException.class, () -> new OpenAPIParser().parseFromFile("  "));
    }

    @Test
    void testParseBrokenDocument() {
        OpenAPIParser parser = new OpenAPIParser();

        assertThrows(IllegalStateException.class, () -> {
            parser.parseFromFile("src/test/resources/specs/broken.yaml");
        }, "Невалидный документ не должен загружаться");
    }

    @Test
    void testDefaultsWithoutDocument() {
        OpenAPIParser parser = new OpenAPIParser();

        assertEquals("Unknown API", parser.getApiTitle());
        assertEquals("Unknown", parser.getApiVersion());
        assertTrue(parser.getSchemaTable().isEmpty());
    }
}
