package com.vtb.apidrift.integration;

import com.vtb.apidrift.models.DiffResult;
import com.vtb.apidrift.models.DiffStatistics;
import com.vtb.apidrift.models.MatchResult;
import com.vtb.apidrift.models.RuleViolation;
import com.vtb.apidrift.rules.schema.DescriptionChangedRule;
import com.vtb.apidrift.rules.schema.FormatChangedRule;
import com.vtb.apidrift.rules.schema.SchemaRemovedRule;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для CICDIntegration
 */
class CICDIntegrationTest {

    private static MatchResult schema(String name, RuleViolation... violations) {
        return new MatchResult(name, List.of(violations));
    }

    private static DiffResult resultOf(MatchResult... results) {
        return DiffResult.builder()
            .baseApiName("API")
            .baseApiVersion("1")
            .currentApiName("API")
            .currentApiVersion("2")
            .schemaResults(List.of(results))
            .statistics(DiffStatistics.builder().totalViolations(results.length).build())
            .build();
    }

    private final MatchResult breaking = schema("Legacy", new RuleViolation(new SchemaRemovedRule("Legacy")));
    private final MatchResult warning = schema("When",
        new RuleViolation(new FormatChangedRule("When", "", "date", "date-time")));
    private final MatchResult change = schema("Note",
        new RuleViolation(new DescriptionChangedRule("Note", "", "a", "b")));
    private final MatchResult unchanged = schema("Same");

    @Test
    void testBreakingFailsBuildByDefault() {
        assertEquals(1, CICDIntegration.getExitCode(resultOf(breaking, change), true, false));
    }

    @Test
    void testBreakingIgnoredWhenDisabled() {
        assertEquals(0, CICDIntegration.getExitCode(resultOf(breaking, change), false, false));
    }

    @Test
    void testWarningFailsOnlyWhenEnabled() {
        assertEquals(0, CICDIntegration.getExitCode(resultOf(warning), true, false));
        assertEquals(1, CICDIntegration.getExitCode(resultOf(warning), true, true));
    }

    @Test
    void testChangesNeverFail() {
        assertEquals(0, CICDIntegration.getExitCode(resultOf(change, unchanged), true, true));
    }

    @Test
    void testNullResultIsSuccess() {
        assertEquals(0, CICDIntegration.getExitCode(null, true, true));
    }

    @Test
    void testSummaryCountsSchemasByLevel() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        CICDIntegration.printCISummary(resultOf(breaking, warning, change, unchanged),
            new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String summary = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(summary.contains("BREAKING: 1"), summary);
        assertTrue(summary.contains("WARNING:  1"), summary);
        assertTrue(summary.contains("CHANGE:   1"), "Схема без изменений не считается: " + summary);
    }

    @Test
    void testGitHubAnnotations() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        CICDIntegration.printGitHubAnnotations(resultOf(breaking, warning, change),
            new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(3, lines.length);
        assertTrue(lines[0].startsWith("::error title=SchemaRemoved::schema: Legacy"), lines[0]);
        assertTrue(lines[1].startsWith("::warning title=FormatChanged::"), lines[1]);
        assertTrue(lines[2].startsWith("::notice title=DescriptionChanged::"), lines[2]);
    }
}
