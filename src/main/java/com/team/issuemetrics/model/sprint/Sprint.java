package com.team.issuemetrics.model.sprint;

/**
 * 衝刺資訊：編號、期間、是否為目前衝刺。
 */
public record Sprint(SprintNumber number, SprintPeriod period, boolean isCurrent) {
}
