package com.team.issuemetrics.service.sync;

import com.team.issuemetrics.config.EvaluationConfig;
import com.team.issuemetrics.config.SyncConfig;
import com.team.issuemetrics.model.dto.BatchEvaluationResult;
import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import com.team.issuemetrics.service.evaluation.BatchEvaluationOrchestrator;
import com.team.issuemetrics.service.evaluation.SpeedEvaluationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定時同步所有 repository，之後補跑評估。
 * 品質 / 一致性各最多跑 autoEvaluateMaxRounds 輪，remaining 為 0、遇到 rate limit 或一輪全部失敗就停。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncScheduler {

    private final SyncConfig syncConfig;
    private final EvaluationConfig evaluationConfig;
    private final RepositoryProfileRepository repositoryRepo;
    private final IssueSyncService issueSyncService;
    private final SpeedEvaluationService speedEvaluationService;
    private final BatchEvaluationOrchestrator batchEvaluationOrchestrator;

    @Scheduled(cron = "${workflow.sync.cron:0 0 * * * *}")
    public void syncAll() {
        if (!syncConfig.isAutoSyncEnabled()) {
            log.debug("排程同步未啟用，跳過");
            return;
        }

        log.info("開始排程同步...");
        for (RepositoryProfile repository : repositoryRepo.findAll()) {
            try {
                syncAndEvaluate(repository);
            } catch (Exception e) {
                // 一個 repository 失敗不影響其他 repository
                log.error("排程同步 {} 失敗：{}", repository.fullName(), e.getMessage(), e);
            }
        }
        log.info("排程同步結束");
    }

    void syncAndEvaluate(RepositoryProfile repository) {
        issueSyncService.runSync(repository.getId(), false);
        speedEvaluationService.evaluateSpeed(repository.getId());
        evaluateRounds(repository, EvaluationAxis.QUALITY);
        evaluateRounds(repository, EvaluationAxis.CONSISTENCY);
    }

    private void evaluateRounds(RepositoryProfile repository, EvaluationAxis axis) {
        for (int round = 1; round <= syncConfig.getAutoEvaluateMaxRounds(); round++) {
            BatchEvaluationResult result = batchEvaluationOrchestrator.runBatchEvaluation(
                    repository.getId(), axis, evaluationConfig.getDefaultBatchSize());

            if (result.isRateLimited()) {
                log.warn("{} {} 評估遇到 rate limit，第 {} 輪後停止", repository.fullName(), axis, round);
                return;
            }
            if (result.getRemaining() == 0) {
                log.info("{} {} 評估已完成（{} 輪）", repository.fullName(), axis, round);
                return;
            }
            if (result.getEvaluated() == 0 && result.getSkipped() == 0) {
                log.warn("{} {} 第 {} 輪沒有進展（剩餘 {} 筆皆失敗），留待下次排程",
                        repository.fullName(), axis, round, result.getRemaining());
                return;
            }
        }
        log.info("{} {} 評估達到輪數上限，剩餘留待下次排程", repository.fullName(), axis);
    }
}
