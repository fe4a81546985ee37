package com.vtb.apidrift.core;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Загрузка OpenAPI спецификаций (YAML/JSON) в модель swagger
 *
 * Сам движок сравнения работает с уже готовой таблицей схем,
 * этот класс только превращает документ в такую таблицу.
 */
@Slf4j
public class OpenAPIParser {

    // Лимит размера файла, можно изменить: -Dapidrift.max.file.size.mb=500
    private static final long MAX_FILE_SIZE_MB = Long.parseLong(
        System.getProperty("apidrift.max.file.size.mb", "200"));

    private OpenAPI openAPI;
    private String specificationSource;

    /**
     * Установить OpenAPI объект напрямую (для тестов!)
     */
    public void setOpenAPI(OpenAPI openAPI) {
        this.openAPI = openAPI;
        this.specificationSource = "test-synthetic";
    }

    /**
     * Загрузить спецификацию из файла
     */
    public void parseFromFile(String filePath) {
        log.info("Загрузка спецификации из файла: {}", filePath);

        if (filePath == null || filePath.trim().isEmpty()) {
            throw new IllegalArgumentException("Путь к файлу не указан");
        }
        File file = new File(filePath.trim());
        if (!file.exists() || !file.isFile()) {
            throw new IllegalArgumentException("Файл не найден: " + filePath);
        }

        long fileSizeMB = file.length() / (1024 * 1024);
        if (fileSizeMB > MAX_FILE_SIZE_MB) {
            throw new IllegalArgumentException(
                String.format("Файл слишком большой: %d MB (максимум: %d MB). " +
                    "Увеличьте лимит через -Dapidrift.max.file.size.mb=<размер>",
                    fileSizeMB, MAX_FILE_SIZE_MB));
        }

        Path path = Paths.get(file.getAbsolutePath());
        SwaggerParseResult result;
        try {
            result = new OpenAPIV3Parser().readLocation(path.toString(), null, parseOptions());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Ошибка чтения спецификации " + path + ": " + e.getMessage(), e);
        }
        accept(result, path.toString());
    }

    /**
     * Загрузить спецификацию из строки (YAML или JSON)
     */
    public void parseFromContent(String content) {
        if (content == null || content.trim().isEmpty()) {
            throw new IllegalArgumentException("Содержимое спецификации пустое");
        }
        SwaggerParseResult result;
        try {
            result = new OpenAPIV3Parser().readContents(content, null, parseOptions());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Ошибка чтения спецификации: " + e.getMessage(), e);
        }
        accept(result, "inline");
    }

    /**
     * Внутренние $ref не разрешаем: движок сравнения делает это сам
     * и должен видеть исходные указатели
     */
    private ParseOptions parseOptions() {
        ParseOptions options = new ParseOptions();
        options.setResolve(false);
        options.setResolveFully(false);
        return options;
    }

    private void accept(SwaggerParseResult result, String source) {
        if (result == null) {
            throw new IllegalStateException("Парсер не вернул результат для " + source);
        }
        List<String> messages = result.getMessages();
        if (messages != null) {
            for (String message : messages) {
                log.warn("Предупреждение при парсинге: {}", message);
            }
        }
        if (result.getOpenAPI() == null) {
            throw new IllegalStateException(
                "Не удалось распарсить спецификацию OpenAPI: " + source +
                ". Проверьте, что файл является валидным YAML/JSON документом OpenAPI 3.x");
        }
        this.openAPI = result.getOpenAPI();
        this.specificationSource = source;
        log.info("Спецификация успешно загружена: {} (версия {}), схем: {}",
            getApiTitle(), getApiVersion(), getSchemaTable().size());
    }

    /**
     * Таблица именованных схем (components.schemas) в порядке объявления
     */
    public Map<String, Schema<?>> getSchemaTable() {
        if (openAPI == null || openAPI.getComponents() == null
            || openAPI.getComponents().getSchemas() == null) {
            return Collections.emptyMap();
        }
        Map<String, Schema<?>> table = new LinkedHashMap<>();
        openAPI.getComponents().getSchemas().forEach(table::put);
        return Collections.unmodifiableMap(table);
    }

    /**
     * Получить информацию об API
     */
    public String getApiTitle() {
        return openAPI != null && openAPI.getInfo() != null
            ? openAPI.getInfo().getTitle()
            : "Unknown API";
    }

    public String getApiVersion() {
        return openAPI != null && openAPI.getInfo() != null
            ? openAPI.getInfo().getVersion()
            : "Unknown";
    }

    public OpenAPI getOpenAPI() {
        return openAPI;
    }

    public String getSpecificationSource() {
        return specificationSource;
    }
}
