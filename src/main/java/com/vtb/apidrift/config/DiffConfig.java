package com.vtb.apidrift.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.apidrift.models.ChangeLevel;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;

/**
 * Конфигурация сравнения из YAML файла
 * Настройки отчета и поведения в CI
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiffConfig {

    public static final String RESOURCE_NAME = "apidrift-config.yaml";

    private Report report;
    private Ci ci;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Report {
        private Boolean includeUnchanged = Boolean.TRUE;
        private String outputFile = "apidrift-report.json";
        private ChangeLevel minChangeLevel = ChangeLevel.CHANGE;

        void ensureDefaults() {
            if (includeUnchanged == null) {
                includeUnchanged = Boolean.TRUE;
            }
            if (outputFile == null || outputFile.isBlank()) {
                outputFile = "apidrift-report.json";
            }
            if (minChangeLevel == null) {
                minChangeLevel = ChangeLevel.CHANGE;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Ci {
        private Boolean failOnBreaking = Boolean.TRUE;
        private Boolean failOnWarning = Boolean.FALSE;

        void ensureDefaults() {
            if (failOnBreaking == null) {
                failOnBreaking = Boolean.TRUE;
            }
            if (failOnWarning == null) {
                failOnWarning = Boolean.FALSE;
            }
        }
    }

    private static DiffConfig instance;

    /**
     * Загрузить конфигурацию из classpath
     */
    public static synchronized DiffConfig load() {
        if (instance == null) {
            try (InputStream is = DiffConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (is == null) {
                    throw new IllegalStateException(RESOURCE_NAME + " не найден в classpath");
                }
                instance = fromYaml(is);
            } catch (IOException e) {
                throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Прочитать конфигурацию из произвольного YAML потока
     */
    public static DiffConfig fromYaml(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        DiffConfig config = mapper.readValue(is, DiffConfig.class);
        if (config == null) {
            config = new DiffConfig();
        }
        config.ensureDefaults();
        return config;
    }

    void ensureDefaults() {
        if (report == null) {
            report = new Report();
        }
        report.ensureDefaults();
        if (ci == null) {
            ci = new Ci();
        }
        ci.ensureDefaults();
    }
}
