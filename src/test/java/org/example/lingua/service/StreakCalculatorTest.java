package org.example.lingua.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StreakCalculatorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    private final StreakCalculator calculator = new StreakCalculator();

    @Test
    void calculateStreak_countsConsecutiveDaysEndingToday() {
        List<LocalDate> dates = List.of(TODAY, TODAY.minusDays(1), TODAY.minusDays(2), TODAY.minusDays(4));

        assertEquals(3, calculator.calculateStreak(dates, TODAY));
    }

    @Test
    void calculateStreak_acceptsStreakEndingYesterday() {
        List<LocalDate> dates = List.of(TODAY.minusDays(1), TODAY.minusDays(2));

        assertEquals(2, calculator.calculateStreak(dates, TODAY));
    }

    @Test
    void calculateStreak_isZeroWhenLastActivityIsOlder() {
        assertEquals(0, calculator.calculateStreak(List.of(TODAY.minusDays(2), TODAY.minusDays(3)), TODAY));
        assertEquals(0, calculator.calculateStreak(List.of(), TODAY));
        assertEquals(0, calculator.calculateStreak(null, TODAY));
    }

    @Test
    void calculateStreak_ignoresDuplicateDays() {
        List<LocalDate> dates = List.of(TODAY, TODAY, TODAY.minusDays(1), TODAY.minusDays(1), TODAY.minusDays(2));

        assertEquals(3, calculator.calculateStreak(dates, TODAY));
    }

    @Test
    void calculateStreak_singleDayToday() {
        assertEquals(1, calculator.calculateStreak(List.of(TODAY), TODAY));
    }
}
