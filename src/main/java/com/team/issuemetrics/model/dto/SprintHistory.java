package com.team.issuemetrics.model.dto;

import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.model.evaluation.Grade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 最近 N 個衝刺的推移（舊到新，最後一筆為目前衝刺）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SprintHistory {

    private Long repositoryId;
    private List<SprintEntry> sprints;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SprintEntry {
        private SprintInfo sprint;
        private UserSprintStats team;
        private List<UserSprintStats> users;
        /** 各評估軸的 A–E 分布 */
        private Map<EvaluationAxis, Map<Grade, Integer>> gradeDistribution;
    }
}
