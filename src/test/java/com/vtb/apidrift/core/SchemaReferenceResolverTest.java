package com.vtb.apidrift.core;

import com.vtb.apidrift.core.SchemaReferenceResolver.Resolution;
import io.swagger.v3.oas.models.media.Schema;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для SchemaReferenceResolver
 */
@SuppressWarnings({"rawtypes", "unchecked"})
class SchemaReferenceResolverTest {

    private static Schema<?> typed(String type) {
        Schema schema = new Schema<>();
        schema.setType(type);
        return schema;
    }

    private static Schema<?> ref(String pointer) {
        Schema schema = new Schema<>();
        schema.set$ref(pointer);
        return schema;
    }

    private static SchemaReferenceResolver resolver(Object... nameAndSchema) {
        Map<String, Schema<?>> table = new LinkedHashMap<>();
        for (int i = 0; i < nameAndSchema.length; i += 2) {
            table.put((String) nameAndSchema[i], (Schema) nameAndSchema[i + 1]);
        }
        return new SchemaReferenceResolver(table);
    }

    @Test
    void testPlainNodeIsResolvedAsIs() {
        Schema<?> node = typed("string");

        Resolution resolution = resolver().resolve(node, Collections.emptySet());

        assertTrue(resolution.isResolved());
        assertSame(node, resolution.getSchema());
        assertNull(resolution.getPointer());
    }

    @Test
    void testComponentsReferenceIsResolved() {
        Schema<?> address = typed("object");

        Resolution resolution = resolver("Address", address)
            .resolve(ref("#/components/schemas/Address"), Set.of("User"));

        assertTrue(resolution.isResolved());
        assertSame(address, resolution.getSchema());
        assertEquals(List.of("User", "Address"), List.copyOf(resolution.getVisited()),
            "Разрешенное имя добавляется в путь");
    }

    @Test
    void testDefinitionsReferenceIsResolved() {
        Schema<?> pet = typed("object");

        Resolution resolution = resolver("Pet", pet).resolve("#/definitions/Pet", Collections.emptySet());

        assertTrue(resolution.isResolved());
        assertSame(pet, resolution.getSchema());
    }

    @Test
    void testMissingTargetIsUnresolved() {
        Resolution resolution = resolver().resolve("#/components/schemas/Missing", Collections.emptySet());

        assertTrue(resolution.isUnresolved());
        assertNull(resolution.getSchema());
        assertEquals("#/components/schemas/Missing", resolution.getPointer());
    }

    @Test
    void testExternalReferenceIsUnresolved() {
        Resolution resolution = resolver("Money", typed("object"))
            .resolve("common.yaml#/components/schemas/Money", Collections.emptySet());

        assertTrue(resolution.isUnresolved(), "Внешние ссылки не поддерживаются");
    }

    @Test
    void testNameOnCurrentPathIsCycle() {
        Resolution resolution = resolver("Node", typed("object"))
            .resolve("#/components/schemas/Node", Set.of("Node"));

        assertTrue(resolution.isCycle());
        assertNull(resolution.getSchema());
    }

    @Test
    void testReferenceChainIsFollowed() {
        Schema<?> target = typed("string");

        Resolution resolution = resolver(
            "Alias", ref("#/components/schemas/Target"),
            "Target", target)
            .resolve("#/components/schemas/Alias", Collections.emptySet());

        assertTrue(resolution.isResolved());
        assertSame(target, resolution.getSchema());
        assertEquals(Set.of("Alias", "Target"), resolution.getVisited());
    }

    @Test
    void testReferenceLoopIsCycle() {
        Resolution resolution = resolver(
            "A", ref("#/components/schemas/B"),
            "B", ref("#/components/schemas/A"))
            .resolve("#/components/schemas/A", Collections.emptySet());

        assertTrue(resolution.isCycle(), "Цепочка A -> B -> A должна быть распознана как цикл");
    }

    @Test
    void testVisitedSetIsNotMutated() {
        Set<String> visited = new java.util.LinkedHashSet<>(List.of("User"));

        resolver("Address", typed("object")).resolve("#/components/schemas/Address", visited);

        assertEquals(Set.of("User"), visited);
    }

    @Test
    void testSchemaNameDecodesJsonPointerEscapes() {
        assertEquals("a/b", SchemaReferenceResolver.schemaName("#/components/schemas/a~1b"));
        assertEquals("a~b", SchemaReferenceResolver.schemaName("#/components/schemas/a~0b"));
        assertNull(SchemaReferenceResolver.schemaName("#/components/schemas/a/b"));
        assertNull(SchemaReferenceResolver.schemaName("#/components/responses/Error"));
        assertNull(SchemaReferenceResolver.schemaName(null));
    }

    @Test
    void testNullNodeIsUnresolved() {
        assertTrue(resolver().resolve((Schema<?>) null, Collections.emptySet()).isUnresolved());
    }
}
