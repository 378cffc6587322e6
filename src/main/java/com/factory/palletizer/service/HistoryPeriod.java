package com.factory.palletizer.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Date filters offered on the admin history screen.
 */
public enum HistoryPeriod {
    ALL,
    TODAY,
    CURRENT_MONTH,
    CURRENT_YEAR,
    INTERVAL;

    /**
     * Inclusive start of the period, or {@code null} when unbounded.
     */
    public LocalDateTime start(LocalDate today, LocalDate from, LocalDate to) {
        switch (this) {
            case TODAY:
                return today.atStartOfDay();
            case CURRENT_MONTH:
                return today.withDayOfMonth(1).atStartOfDay();
            case CURRENT_YEAR:
                return today.withDayOfYear(1).atStartOfDay();
            case INTERVAL:
                return from != null && to != null ? from.atStartOfDay() : null;
            default:
                return null;
        }
    }

    /**
     * Inclusive end of the period, or {@code null} when unbounded.
     */
    public LocalDateTime end(LocalDate today, LocalDate from, LocalDate to) {
        switch (this) {
            case TODAY:
                return today.atTime(LocalTime.MAX);
            case CURRENT_MONTH:
                return today.withDayOfMonth(today.lengthOfMonth()).atTime(LocalTime.MAX);
            case CURRENT_YEAR:
                return today.withDayOfYear(today.lengthOfYear()).atTime(LocalTime.MAX);
            case INTERVAL:
                return from != null && to != null ? to.atTime(LocalTime.MAX) : null;
            default:
                return null;
        }
    }
}
