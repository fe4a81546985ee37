package com.vtb.apidrift.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.vtb.apidrift.config.DiffConfig;
import com.vtb.apidrift.core.ApiDiffer;
import com.vtb.apidrift.core.OpenAPIParser;
import com.vtb.apidrift.integration.CICDIntegration;
import com.vtb.apidrift.models.ChangeLevel;
import com.vtb.apidrift.models.DiffResult;
import com.vtb.apidrift.models.MatchResult;
import com.vtb.apidrift.models.RuleViolation;
import com.vtb.apidrift.reports.JsonReportGenerator;
import com.vtb.apidrift.reports.ReportGenerator;
import com.vtb.apidrift.reports.ResultAssembler;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда для сравнения версий API
 */
@Slf4j
@Command(
    name = "apidrift",
    mixinStandardHelpOptions = true,
    version = "VTB API Drift 1.0.0",
    description = """

        VTB API Drift

        Сравнение двух версий OpenAPI спецификации и классификация изменений

        Возможности:
          • Сравнение схем components.schemas с учетом $ref
          • Уровни изменений: BREAKING, WARNING, CHANGE
          • JSON отчет
          • Интеграция с CI/CD

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_BLOCKED = 1;
    static final int EXIT_LOAD_FAILURE = 2;

    @Parameters(
        index = "0",
        description = "Базовая (предыдущая) версия спецификации (YAML/JSON)"
    )
    private String baseSpecPath;

    @Parameters(
        index = "1",
        description = "Текущая (новая) версия спецификации (YAML/JSON)"
    )
    private String currentSpecPath;

    @Option(
        names = {"-o", "--output"},
        description = "Файл JSON отчета (по умолчанию из apidrift-config.yaml)"
    )
    private String outputFile;

    @Option(
        names = {"--min-level"},
        description = "Минимальный уровень изменений в отчете: ${COMPLETION-CANDIDATES}"
    )
    private ChangeLevel minLevel;

    @Option(
        names = {"--only-changed"},
        description = "Не включать в отчет схемы без изменений"
    )
    private boolean onlyChanged = false;

    @Option(
        names = {"--fail-on-warning"},
        description = "Прервать с ошибкой при изменениях уровня WARNING (для CI/CD)"
    )
    private boolean failOnWarning = false;

    @Option(
        names = {"--no-fail-on-breaking"},
        description = "Не прерывать с ошибкой при ломающих изменениях"
    )
    private boolean noFailOnBreaking = false;

    @Option(
        names = {"--ci"},
        description = "Режим CI/CD (краткий вывод + exit codes)"
    )
    private boolean ciMode = false;

    @Option(
        names = {"-v", "--verbose"},
        description = "Подробный лог (DEBUG)"
    )
    private boolean verbose = false;

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new MainCommand())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        if (verbose) {
            Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
        printBanner();

        DiffConfig config = DiffConfig.load();
        ChangeLevel reportLevel = minLevel != null ? minLevel : config.getReport().getMinChangeLevel();
        boolean includeUnchanged = !onlyChanged && config.getReport().getIncludeUnchanged();
        boolean failOnBreaking = !noFailOnBreaking && config.getCi().getFailOnBreaking();
        boolean failOnWarn = failOnWarning || config.getCi().getFailOnWarning();
        ReportGenerator reportGenerator = new JsonReportGenerator(reportLevel, includeUnchanged);
        Path reportPath = reportGenerator.resolveOutputPath(
            Paths.get(outputFile != null ? outputFile : config.getReport().getOutputFile()));

        // 1. Загружаем обе версии
        OpenAPIParser baseParser = new OpenAPIParser();
        OpenAPIParser currentParser = new OpenAPIParser();
        try {
            baseParser.parseFromFile(baseSpecPath);
            currentParser.parseFromFile(currentSpecPath);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Ошибка загрузки спецификации: {}", e.getMessage());
            return EXIT_LOAD_FAILURE;
        }

        // 2. Сравнение
        DiffResult result = new ApiDiffer(baseParser, currentParser).diff();

        // 3. Отчет
        try {
            reportGenerator.generate(result, reportPath);
        } catch (IOException e) {
            log.error("Не удалось записать отчет {}: {}", reportPath, e.getMessage(), e);
            return EXIT_LOAD_FAILURE;
        }

        // 4. Вывод результатов
        if (ciMode) {
            CICDIntegration.printCISummary(result);
        } else {
            printDetailedResults(result, reportLevel, reportPath);
        }

        int exitCode = CICDIntegration.getExitCode(result, failOnBreaking, failOnWarn);
        if (exitCode == EXIT_OK) {
            log.info("Сравнение завершено успешно");
        }
        return exitCode == EXIT_OK ? EXIT_OK : EXIT_BLOCKED;
    }

    /**
     * Вывести детальные результаты
     */
    private void printDetailedResults(DiffResult result, ChangeLevel reportLevel, Path reportPath) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("VTB API DRIFT REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.println("Базовая версия: " + result.getBaseApiName() + " v" + result.getBaseApiVersion());
        System.out.println("Текущая версия: " + result.getCurrentApiName() + " v" + result.getCurrentApiVersion());
        System.out.println("Дата: " + result.getComparisonTimestamp());
        System.out.println("Время сравнения: " + result.getStatistics().getComparisonDurationMs() + " мс");
        System.out.println();

        System.out.println("СТАТИСТИКА:");
        System.out.println("   Схем сравнено: " + result.getStatistics().getComparedSchemas());
        System.out.println("   Схем с изменениями: " + result.getStatistics().getChangedSchemas());
        System.out.println("   Всего различий: " + result.getStatistics().getTotalViolations());
        System.out.println();

        List<MatchResult> changed = ResultAssembler.filter(result.getSchemaResults(), reportLevel, false);
        Map<ChangeLevel, List<MatchResult>> groups = ResultAssembler.groupByChangeLevel(changed);
        for (Map.Entry<ChangeLevel, List<MatchResult>> group : groups.entrySet()) {
            if (group.getValue().isEmpty()) {
                continue;
            }
            System.out.println(group.getKey() + " (" + group.getKey().getRussianName() + "):");
            for (MatchResult schema : group.getValue()) {
                System.out.println("   " + schema.getName());
                for (RuleViolation violation : schema.getViolations()) {
                    System.out.printf("      [%s] %s%n", violation.getChangeLevel(), violation.getDescription());
                    if (!violation.getPropertyPath().isEmpty()) {
                        System.out.printf("         → %s%n", violation.getPropertyPath());
                    }
                }
            }
            System.out.println();
        }

        System.out.println("Отчет сохранен в: " + reportPath);
        System.out.println("=".repeat(80));
        System.out.println();
    }

    /**
     * Вывести баннер
     */
    private void printBanner() {
        if (ciMode) return;  // Не показываем в CI режиме

        System.out.println("""

            ╔═══════════════════════════════════════════════════════════╗
            ║                                                           ║
            ║     VTB API Drift v1.0.0                                  ║
            ║                                                           ║
            ║     Сравнение версий OpenAPI спецификаций                 ║
            ║                                                           ║
            ╚═══════════════════════════════════════════════════════════╝

            """);
    }
}
