package com.team.issuemetrics.model.sprint;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/**
 * 衝刺期間。startDate 當天 00:00 起，到 endDate 當天 23:59:59.999 止，兩端皆包含。
 */
public record SprintPeriod(LocalDate startDate, LocalDate endDate) {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    public SprintPeriod {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not be before startDate: " + startDate + " > " + endDate);
        }
    }

    public int durationDays() {
        return (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean contains(Instant instant, ZoneId zoneId) {
        return !instant.isBefore(startInstant(zoneId)) && !instant.isAfter(endInstant(zoneId));
    }

    public Instant startInstant(ZoneId zoneId) {
        return startDate.atStartOfDay(zoneId).toInstant();
    }

    public Instant endInstant(ZoneId zoneId) {
        return endDate.atTime(END_OF_DAY).atZone(zoneId).toInstant();
    }

    /**
     * 例如 "1/6(Sat) - 1/12(Fri)"
     */
    public String format() {
        return format(Locale.ENGLISH);
    }

    public String format(Locale locale) {
        return formatDate(startDate, locale) + " - " + formatDate(endDate, locale);
    }

    private static String formatDate(LocalDate date, Locale locale) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        return date.getMonthValue() + "/" + date.getDayOfMonth()
                + "(" + dayOfWeek.getDisplayName(TextStyle.SHORT, locale) + ")";
    }
}
