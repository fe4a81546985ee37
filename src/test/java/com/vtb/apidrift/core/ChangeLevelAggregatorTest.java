package com.vtb.apidrift.core;

import com.vtb.apidrift.models.ChangeLevel;
import com.vtb.apidrift.models.RuleViolation;
import com.vtb.apidrift.rules.schema.DescriptionChangedRule;
import com.vtb.apidrift.rules.schema.FormatChangedRule;
import com.vtb.apidrift.rules.schema.SchemaRemovedRule;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для ChangeLevelAggregator
 */
class ChangeLevelAggregatorTest {

    private final RuleViolation change = new RuleViolation(new DescriptionChangedRule("S", "", "a", "b"));
    private final RuleViolation warning = new RuleViolation(new FormatChangedRule("S", "", "date", "date-time"));
    private final RuleViolation breaking = new RuleViolation(new SchemaRemovedRule("S"));

    @Test
    void testEmptyIsChange() {
        assertEquals(ChangeLevel.CHANGE, ChangeLevelAggregator.aggregate(Collections.emptyList()));
        assertEquals(ChangeLevel.CHANGE, ChangeLevelAggregator.aggregate(null));
    }

    @Test
    void testOnlyChangesIsChange() {
        assertEquals(ChangeLevel.CHANGE, ChangeLevelAggregator.aggregate(List.of(change, change)));
    }

    @Test
    void testWarningWinsOverChange() {
        assertEquals(ChangeLevel.WARNING, ChangeLevelAggregator.aggregate(List.of(change, warning)));
    }

    @Test
    void testBreakingWinsRegardlessOfOrder() {
        assertEquals(ChangeLevel.BREAKING, ChangeLevelAggregator.aggregate(List.of(breaking, warning, change)));
        assertEquals(ChangeLevel.BREAKING, ChangeLevelAggregator.aggregate(List.of(change, warning, breaking)));
    }
}
