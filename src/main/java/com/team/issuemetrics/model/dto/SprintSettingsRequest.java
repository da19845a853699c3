package com.team.issuemetrics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SprintSettingsRequest {

    private Integer sprintStartDayOfWeek;
    private Integer sprintDurationWeeks;
    private LocalDate trackingStartDate;
}
