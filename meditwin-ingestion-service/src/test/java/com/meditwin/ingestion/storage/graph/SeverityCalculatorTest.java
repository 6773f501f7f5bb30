package com.meditwin.ingestion.storage.graph;

import com.meditwin.ingestion.model.SeverityLevel;
import com.meditwin.ingestion.storage.graph.SeverityCalculator.EventSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SeverityCalculator: rule order, confidence weighting and the empty case.
 */
class SeverityCalculatorTest {

    private final SeverityCalculator calculator = new SeverityCalculator();

    private static EventSeverity event(SeverityLevel severity, double confidence) {
        return new EventSeverity(severity, confidence);
    }

    @Test
    @DisplayName("Should return critical as soon as one critical event exists")
    void calculate_shouldPreferCritical() {
        assertEquals(SeverityLevel.CRITICAL, calculator.calculate(List.of(
                event(SeverityLevel.NORMAL, 1.0), event(SeverityLevel.NORMAL, 1.0), event(SeverityLevel.CRITICAL, 0.1))));
    }

    @Test
    @DisplayName("Should return severe for any severe event")
    void calculate_shouldReturnSevere() {
        assertEquals(SeverityLevel.SEVERE, calculator.calculate(List.of(
                event(SeverityLevel.MILD, 0.9), event(SeverityLevel.SEVERE, 0.9))));
    }

    @Test
    @DisplayName("Should return moderate for two moderate events even when the average is lower")
    void calculate_shouldCountModerateEvents() {
        assertEquals(SeverityLevel.MODERATE, calculator.calculate(List.of(
                event(SeverityLevel.MODERATE, 0.9), event(SeverityLevel.MODERATE, 0.9),
                event(SeverityLevel.NORMAL, 0.9))));
    }

    @Test
    @DisplayName("Should weight a single moderate event by its confidence")
    void calculate_shouldApplyConfidence() {
        assertEquals(SeverityLevel.MODERATE, calculator.calculate(List.of(event(SeverityLevel.MODERATE, 1.0))));
        assertEquals(SeverityLevel.MILD, calculator.calculate(List.of(event(SeverityLevel.MODERATE, 0.5))));
    }

    @Test
    @DisplayName("Should floor confidence at 0.5")
    void calculate_shouldFloorConfidence() {
        // mild weight 2 x floored 0.5 = 1, below the mild threshold
        assertEquals(SeverityLevel.NORMAL, calculator.calculate(List.of(event(SeverityLevel.MILD, 0.1))));
        assertEquals(SeverityLevel.MILD, calculator.calculate(List.of(event(SeverityLevel.MODERATE, 0.0))));
    }

    @Test
    @DisplayName("Should return mild for more than three low-weight events")
    void calculate_shouldReturnMildForManyEvents() {
        assertEquals(SeverityLevel.MILD, calculator.calculate(Collections.nCopies(4, event(SeverityLevel.NORMAL, 1.0))));
        assertEquals(SeverityLevel.NORMAL, calculator.calculate(Collections.nCopies(3, event(SeverityLevel.NORMAL, 1.0))));
    }

    @Test
    @DisplayName("Should return NA when there are no events")
    void calculate_shouldReturnNaForNoEvents() {
        assertEquals(SeverityLevel.NA, calculator.calculate(List.of()));
        assertEquals(SeverityLevel.NA, calculator.calculate(null));
    }
}
