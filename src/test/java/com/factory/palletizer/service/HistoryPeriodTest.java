package com.factory.palletizer.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class HistoryPeriodTest {

    private final LocalDate today = LocalDate.of(2024, 2, 14);

    @Test
    void all_ShouldBeUnbounded() {
        assertNull(HistoryPeriod.ALL.start(today, null, null));
        assertNull(HistoryPeriod.ALL.end(today, null, null));
    }

    @Test
    void today_ShouldCoverWholeDay() {
        assertEquals(LocalDateTime.of(2024, 2, 14, 0, 0), HistoryPeriod.TODAY.start(today, null, null));
        assertEquals(LocalDate.of(2024, 2, 14).atTime(LocalTime.MAX), HistoryPeriod.TODAY.end(today, null, null));
    }

    @Test
    void currentMonth_ShouldEndOnLeapDay() {
        assertEquals(LocalDateTime.of(2024, 2, 1, 0, 0), HistoryPeriod.CURRENT_MONTH.start(today, null, null));
        assertEquals(LocalDate.of(2024, 2, 29).atTime(LocalTime.MAX),
                HistoryPeriod.CURRENT_MONTH.end(today, null, null));
    }

    @Test
    void currentYear_ShouldCoverJanuaryToDecember() {
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), HistoryPeriod.CURRENT_YEAR.start(today, null, null));
        assertEquals(LocalDate.of(2024, 12, 31).atTime(LocalTime.MAX),
                HistoryPeriod.CURRENT_YEAR.end(today, null, null));
    }

    @Test
    void interval_ShouldIncludeBothBounds() {
        LocalDate from = LocalDate.of(2023, 11, 3);
        LocalDate to = LocalDate.of(2023, 11, 5);

        assertEquals(from.atStartOfDay(), HistoryPeriod.INTERVAL.start(today, from, to));
        assertEquals(to.atTime(LocalTime.MAX), HistoryPeriod.INTERVAL.end(today, from, to));
    }

    @Test
    void interval_ShouldBeUnbounded_IfABoundIsMissing() {
        assertNull(HistoryPeriod.INTERVAL.start(today, LocalDate.of(2023, 11, 3), null));
        assertNull(HistoryPeriod.INTERVAL.end(today, null, LocalDate.of(2023, 11, 5)));
    }
}
