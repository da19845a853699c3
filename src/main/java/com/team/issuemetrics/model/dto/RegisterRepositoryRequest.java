package com.team.issuemetrics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRepositoryRequest {

    private String ownerName;
    private String repoName;
    /** 未指定時為今天 */
    private LocalDate trackingStartDate;
    /** 0=日 … 6=六，未指定時為 6 */
    private Integer sprintStartDayOfWeek;
    /** 1 或 2，未指定時為 1 */
    private Integer sprintDurationWeeks;
}
