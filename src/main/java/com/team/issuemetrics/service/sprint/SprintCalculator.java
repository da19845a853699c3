package com.team.issuemetrics.service.sprint;

import com.team.issuemetrics.model.sprint.Sprint;
import com.team.issuemetrics.model.sprint.SprintConfig;
import com.team.issuemetrics.model.sprint.SprintNumber;
import com.team.issuemetrics.model.sprint.SprintPeriod;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * 衝刺編號與期間的計算。純函式、不可變，可在任意執行緒共用。
 *
 * 儀表板、歷史報表、同步都必須透過這裡取得衝刺邊界，結果才會一致。
 */
public class SprintCalculator {

    private final SprintConfig config;
    private final LocalDate baseSprintStart;

    public SprintCalculator(SprintConfig config) {
        this.config = config;
        this.baseSprintStart = alignToSprintStartDay(config.baseDate());
    }

    public SprintConfig getConfig() {
        return config;
    }

    /**
     * 衝刺 1 的開始日（baseDate 往回對齊到開始星期）。
     */
    public LocalDate getBaseSprintStart() {
        return baseSprintStart;
    }

    public SprintNumber sprintNumber(Instant instant) {
        return sprintNumber(instant.atZone(config.zoneId()).toLocalDate());
    }

    /**
     * 日期所屬的衝刺編號。baseDate 之前的日期會得到 0 以下（floor 除法，不是往零截斷）。
     */
    public SprintNumber sprintNumber(LocalDate date) {
        LocalDate weekStart = alignToSprintStartDay(date);
        long days = ChronoUnit.DAYS.between(baseSprintStart, weekStart);
        long number = Math.floorDiv(days, config.durationDays()) + 1;
        return SprintNumber.allowingZeroOrNegative(Math.toIntExact(number));
    }

    public SprintPeriod periodFor(SprintNumber sprintNumber) {
        long daysFromBase = (long) (sprintNumber.value() - 1) * config.durationDays();
        LocalDate start = baseSprintStart.plusDays(daysFromBase);
        LocalDate end = start.plusDays(config.durationDays() - 1L);
        return new SprintPeriod(start, end);
    }

    public Sprint currentSprint(Instant now) {
        SprintNumber number = sprintNumber(now);
        return new Sprint(number, periodFor(number), true);
    }

    /**
     * @param offset 0=目前, -1=上一個, 1=下一個
     */
    public Sprint sprintWithOffset(Instant now, int offset) {
        SprintNumber number = sprintNumber(now).plus(offset);
        return new Sprint(number, periodFor(number), offset == 0);
    }

    public String format(SprintPeriod period) {
        return period.format();
    }

    private LocalDate alignToSprintStartDay(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(config.startDay()));
    }
}
