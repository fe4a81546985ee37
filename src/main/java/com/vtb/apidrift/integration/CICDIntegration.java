package com.vtb.apidrift.integration;

import com.vtb.apidrift.models.ChangeLevel;
import com.vtb.apidrift.models.DiffResult;
import com.vtb.apidrift.models.DiffStatistics;
import com.vtb.apidrift.models.MatchResult;
import com.vtb.apidrift.models.RuleViolation;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;

/**
 * Интеграция с CI/CD системами
 * GitHub Actions, GitLab CI и т.д.
 */
@Slf4j
public class CICDIntegration {

    /**
     * Определить exit code на основе результатов сравнения
     *
     * @param result результат сравнения
     * @param failOnBreaking прерывать ли сборку при ломающих изменениях
     * @param failOnWarning прерывать ли сборку при предупреждениях
     * @return exit code (0 = успех, 1 = провал)
     */
    public static int getExitCode(DiffResult result, boolean failOnBreaking, boolean failOnWarning) {
        // КРИТИЧНО: Защита от NPE
        if (result == null) {
            log.warn("Результат сравнения null, возвращаем код успеха");
            return 0;
        }

        if (failOnBreaking && result.hasBreakingChanges()) {
            log.error("Обнаружены ломающие изменения API. Сборка провалена.");
            return 1;
        }

        if (failOnWarning && result.hasWarnings()) {
            log.error("Обнаружены изменения уровня WARNING. Сборка провалена.");
            return 1;
        }

        log.info("Блокирующих изменений не обнаружено");
        return 0;
    }

    /**
     * Вывести краткую сводку для CI/CD
     */
    public static void printCISummary(DiffResult result) {
        printCISummary(result, System.out);
    }

    public static void printCISummary(DiffResult result, PrintStream out) {
        // КРИТИЧНО: Защита от NPE
        if (result == null) {
            log.warn("Результат сравнения null, пропускаем вывод");
            return;
        }

        DiffStatistics stats = result.getStatistics();

        out.println("\n=== API Drift Summary ===");
        out.println("Base:    " + orUnknown(result.getBaseApiName()) + " v" + orUnknown(result.getBaseApiVersion()));
        out.println("Current: " + orUnknown(result.getCurrentApiName()) + " v" + orUnknown(result.getCurrentApiVersion()));
        out.println("Date: " + (result.getComparisonTimestamp() != null ? result.getComparisonTimestamp() : "N/A"));
        out.println("\nChanged schemas:");
        out.println("  BREAKING: " + result.getSchemaCountByChangeLevel(ChangeLevel.BREAKING));
        out.println("  WARNING:  " + result.getSchemaCountByChangeLevel(ChangeLevel.WARNING));
        out.println("  CHANGE:   " + result.getSchemaCountByChangeLevel(ChangeLevel.CHANGE));
        out.println("\nTotal: " + (stats != null ? stats.getTotalViolations() : 0) + " differences");
        out.println("Duration: " + (stats != null ? stats.getComparisonDurationMs() : 0) + " ms");
        out.println("=========================\n");
    }

    /**
     * Создать аннотации для GitHub Actions
     */
    public static void printGitHubAnnotations(DiffResult result, PrintStream out) {
        // КРИТИЧНО: Защита от NPE
        if (result == null || result.getSchemaResults() == null) {
            return;
        }

        for (MatchResult schema : result.getSchemaResults()) {
            for (RuleViolation violation : schema.getViolations()) {
                String level = switch (violation.getChangeLevel()) {
                    case BREAKING -> "error";
                    case WARNING -> "warning";
                    case CHANGE -> "notice";
                };
                out.printf("::%s title=%s::%s - %s%n",
                    level, violation.getName(), violation.getContext(), violation.getDescription());
            }
        }
    }

    private static String orUnknown(String value) {
        return value != null ? value : "Unknown";
    }
}
