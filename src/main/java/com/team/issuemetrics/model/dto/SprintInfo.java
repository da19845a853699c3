package com.team.issuemetrics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SprintInfo {

    private int number;
    private LocalDate startDate;
    private LocalDate endDate;
    /** startDate 00:00（衝刺設定的時區） */
    private Instant startAt;
    /** endDate 23:59:59.999 */
    private Instant endAt;
    /** 例：1/6(Sat) - 1/12(Fri) */
    private String period;
    private boolean current;
    private int offset;
    private String startDayName;
    private int durationWeeks;
}
