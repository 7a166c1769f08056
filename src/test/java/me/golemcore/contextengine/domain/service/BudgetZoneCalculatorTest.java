package me.golemcore.contextengine.domain.service;

import me.golemcore.contextengine.domain.model.BudgetZone;
import me.golemcore.contextengine.domain.model.ZoneBoundaries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetZoneCalculatorTest {

    private final BudgetZoneCalculator calculator = new BudgetZoneCalculator();

    @ParameterizedTest
    @CsvSource({
            "0.0, NORMAL",
            "0.5, NORMAL",
            "0.5999, NORMAL",
            "0.60, SOFT_WARNING",
            "0.7499, SOFT_WARNING",
            "0.75, CONSERVATIVE",
            "0.8499, CONSERVATIVE",
            "0.85, WRAPUP",
            "0.9499, WRAPUP",
            "0.95, EMERGENCY",
            "0.97, EMERGENCY",
            "1.0, EMERGENCY"
    })
    void shouldResolveDefaultBands(double usage, BudgetZone expected) {
        assertEquals(expected, calculator.resolve(usage));
    }

    @Test
    void shouldCoverUnitIntervalContiguouslyAndMonotonically() {
        BudgetZone previous = BudgetZone.NORMAL;
        int transitions = 0;
        for (int i = 0; i <= 10_000; i++) {
            double usage = i / 10_000.0;
            BudgetZone zone = calculator.resolve(usage);
            assertTrue(zone.ordinal() >= previous.ordinal(), "zones must not go backwards at " + usage);
            assertTrue(zone.ordinal() - previous.ordinal() <= 1, "zones must not skip a band at " + usage);
            if (zone != previous) {
                transitions++;
            }
            previous = zone;
        }
        assertEquals(BudgetZone.EMERGENCY, previous);
        assertEquals(4, transitions);
    }

    @Test
    void shouldBePure() {
        for (int i = 0; i < 100; i++) {
            double usage = i / 100.0;
            assertEquals(calculator.resolve(usage), calculator.resolve(usage));
        }
    }

    @Test
    void shouldTreatNanAndNegativeAsNormal() {
        assertEquals(BudgetZone.NORMAL, calculator.resolve(Double.NaN));
        assertEquals(BudgetZone.NORMAL, calculator.resolve(-0.2));
    }

    @Test
    void shouldTreatOverflowAsEmergency() {
        assertEquals(BudgetZone.EMERGENCY, calculator.resolve(1.7));
        assertEquals(BudgetZone.EMERGENCY, calculator.resolve(Double.POSITIVE_INFINITY));
    }

    @Test
    void shouldHonourCustomBoundaries() {
        ZoneBoundaries custom = new ZoneBoundaries(0.5, 0.7, 0.8, 0.9);

        assertEquals(BudgetZone.SOFT_WARNING, calculator.resolve(0.55, custom));
        assertEquals(BudgetZone.EMERGENCY, calculator.resolve(0.9, custom));
    }

    @Test
    void shouldFallBackToDefaultsForInvalidBoundaries() {
        ZoneBoundaries overlapping = new ZoneBoundaries(0.8, 0.7, 0.9, 0.95);

        assertEquals(BudgetZone.NORMAL, calculator.resolve(0.59, overlapping));
        assertEquals(BudgetZone.SOFT_WARNING, calculator.resolve(0.6, overlapping));
    }

    @Test
    void shouldExposeZoneBehaviour() {
        assertTrue(BudgetZone.NORMAL.allowsFullBodies());
        assertTrue(BudgetZone.CONSERVATIVE.requiresHighPriority());
        assertTrue(!BudgetZone.WRAPUP.allowsNewItems());
        assertTrue(BudgetZone.EMERGENCY.requiresCheckpoint());
    }
}
