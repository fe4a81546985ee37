package com.vtb.apidrift.core;

import io.swagger.v3.oas.models.media.Schema;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Разрешение $ref ссылок внутри одной таблицы схем
 *
 * Поддерживаются только внутренние указатели:
 * #/components/schemas/Name и #/definitions/Name.
 * Внешние ссылки считаются неразрешенными.
 *
 * КРИТИЧНО: Защита от циклических ссылок через набор имен текущего пути.
 * Переданный набор никогда не изменяется, Resolution несет новый.
 */
@Slf4j
public class SchemaReferenceResolver {

    public static final String COMPONENTS_PREFIX = "#/components/schemas/";
    public static final String DEFINITIONS_PREFIX = "#/definitions/";

    private final Map<String, Schema<?>> schemas;

    public SchemaReferenceResolver(Map<String, Schema<?>> schemas) {
        this.schemas = schemas == null ? Collections.emptyMap() : schemas;
    }

    /**
     * Разрешить узел: обычная схема возвращается как есть, $ref разрешается по таблице
     */
    public Resolution resolve(Schema<?> node, Set<String> visited) {
        if (node == null) {
            return Resolution.unresolved(null, visited);
        }
        String ref = node.get$ref();
        if (ref == null) {
            return Resolution.resolved(node, null, visited);
        }
        return resolve(ref, visited);
    }

    /**
     * Разрешить указатель вида #/components/schemas/Name
     */
    public Resolution resolve(String pointer, Set<String> visited) {
        Set<String> path = new LinkedHashSet<>(visited == null ? Collections.emptySet() : visited);
        String current = pointer;

        // Цепочка ссылок: запись таблицы сама может быть $ref
        while (true) {
            String name = schemaName(current);
            if (name == null) {
                log.debug("Внешняя или неподдерживаемая ссылка: {}", current);
                return Resolution.unresolved(pointer, path);
            }
            if (path.contains(name)) {
                log.debug("Обнаружена циклическая ссылка: {}, ветка не сравнивается", current);
                return Resolution.cycle(pointer, path);
            }
            Schema<?> target = schemas.get(name);
            if (target == null) {
                log.debug("Схема '{}' не найдена для ссылки {}", name, current);
                return Resolution.unresolved(pointer, path);
            }
            path.add(name);
            if (target.get$ref() == null) {
                return Resolution.resolved(target, pointer, path);
            }
            current = target.get$ref();
        }
    }

    /**
     * Имя схемы из внутреннего указателя или null для прочих ссылок
     */
    public static String schemaName(String pointer) {
        if (pointer == null) {
            return null;
        }
        String name;
        if (pointer.startsWith(COMPONENTS_PREFIX)) {
            name = pointer.substring(COMPONENTS_PREFIX.length());
        } else if (pointer.startsWith(DEFINITIONS_PREFIX)) {
            name = pointer.substring(DEFINITIONS_PREFIX.length());
        } else {
            return null;
        }
        if (name.isEmpty() || name.contains("/")) {
            return null;
        }
        // JSON Pointer: ~1 -> /, ~0 -> ~
        return name.replace("~1", "/").replace("~0", "~");
    }

    /**
     * Результат разрешения ссылки
     */
    public static final class Resolution {

        public enum Status {
            RESOLVED,
            UNRESOLVED,
            CYCLE
        }

        private final Status status;
        private final Schema<?> schema;
        private final String pointer;
        private final Set<String> visited;

        private Resolution(Status status, Schema<?> schema, String pointer, Set<String> visited) {
            this.status = status;
            this.schema = schema;
            this.pointer = pointer;
            this.visited = Collections.unmodifiableSet(
                new LinkedHashSet<>(visited == null ? Collections.emptySet() : visited));
        }

        static Resolution resolved(Schema<?> schema, String pointer, Set<String> visited) {
            return new Resolution(Status.RESOLVED, schema, pointer, visited);
        }

        static Resolution unresolved(String pointer, Set<String> visited) {
            return new Resolution(Status.UNRESOLVED, null, pointer, visited);
        }

        static Resolution cycle(String pointer, Set<String> visited) {
            return new Resolution(Status.CYCLE, null, pointer, visited);
        }

        public Status getStatus() {
            return status;
        }

        public boolean isResolved() {
            return status == Status.RESOLVED;
        }

        public boolean isUnresolved() {
            return status == Status.UNRESOLVED;
        }

        public boolean isCycle() {
            return status == Status.CYCLE;
        }

        /**
         * Разрешенная схема (null, если не RESOLVED)
         */
        public Schema<?> getSchema() {
            return schema;
        }

        /**
         * Исходный указатель (null для узла без $ref)
         */
        public String getPointer() {
            return pointer;
        }

        /**
         * Имена схем текущего пути, включая только что разрешенные
         */
        public Set<String> getVisited() {
            return visited;
        }
    }
}
