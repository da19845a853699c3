package com.team.issuemetrics.model.sprint;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * 衝刺設定。建構時即驗證，不合法的設定直接拒絕。
 *
 * @param startDayOfWeek 開始星期（0=日, 1=一, ..., 6=六）
 * @param durationWeeks  衝刺長度（週），1 或 2
 * @param baseDate       衝刺 1 所在的日期（計算時會往回對齊到開始星期）
 * @param zoneId         換算時間戳 → 日曆日期所用的時區
 */
public record SprintConfig(int startDayOfWeek, int durationWeeks, LocalDate baseDate, ZoneId zoneId) {

    public static final int DEFAULT_START_DAY_OF_WEEK = 6;
    public static final int DEFAULT_DURATION_WEEKS = 1;

    public SprintConfig {
        if (startDayOfWeek < 0 || startDayOfWeek > 6) {
            throw new IllegalArgumentException("startDayOfWeek must be within 0-6: " + startDayOfWeek);
        }
        if (durationWeeks != 1 && durationWeeks != 2) {
            throw new IllegalArgumentException("durationWeeks must be 1 or 2: " + durationWeeks);
        }
        Objects.requireNonNull(baseDate, "baseDate");
        if (zoneId == null) {
            zoneId = ZoneOffset.UTC;
        }
    }

    public SprintConfig(int startDayOfWeek, int durationWeeks, LocalDate baseDate) {
        this(startDayOfWeek, durationWeeks, baseDate, ZoneOffset.UTC);
    }

    public DayOfWeek startDay() {
        return toDayOfWeek(startDayOfWeek);
    }

    public int durationDays() {
        return durationWeeks * 7;
    }

    /**
     * 0=日 … 6=六 → java.time.DayOfWeek
     */
    public static DayOfWeek toDayOfWeek(int dayIndex) {
        return DayOfWeek.of(dayIndex == 0 ? 7 : dayIndex);
    }
}
