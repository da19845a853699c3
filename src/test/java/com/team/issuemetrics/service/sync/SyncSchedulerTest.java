package com.team.issuemetrics.service.sync;

import com.team.issuemetrics.config.EvaluationConfig;
import com.team.issuemetrics.config.SyncConfig;
import com.team.issuemetrics.exception.IssueTrackerException;
import com.team.issuemetrics.model.dto.BatchEvaluationResult;
import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import com.team.issuemetrics.service.evaluation.BatchEvaluationOrchestrator;
import com.team.issuemetrics.service.evaluation.SpeedEvaluationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncSchedulerTest {

    @Mock
    private RepositoryProfileRepository repositoryRepo;
    @Mock
    private IssueSyncService issueSyncService;
    @Mock
    private SpeedEvaluationService speedEvaluationService;
    @Mock
    private BatchEvaluationOrchestrator batchEvaluationOrchestrator;

    private final SyncConfig syncConfig = new SyncConfig();
    private SyncScheduler scheduler;

    private final RepositoryProfile web = RepositoryProfile.builder().id(1L).ownerName("acme").repoName("web").build();
    private final RepositoryProfile api = RepositoryProfile.builder().id(2L).ownerName("acme").repoName("api").build();

    @BeforeEach
    void setUp() {
        syncConfig.setAutoEvaluateMaxRounds(3);
        scheduler = new SyncScheduler(syncConfig, new EvaluationConfig(), repositoryRepo,
                issueSyncService, speedEvaluationService, batchEvaluationOrchestrator);
    }

    @Test
    void disabledScheduler_doesNothing() {
        syncConfig.setAutoSyncEnabled(false);

        scheduler.syncAll();

        verifyNoInteractions(repositoryRepo, issueSyncService);
    }

    @Test
    void failingRepository_doesNotStopOthers() {
        syncConfig.setAutoSyncEnabled(true);
        when(repositoryRepo.findAll()).thenReturn(List.of(web, api));
        when(issueSyncService.runSync(1L, false)).thenThrow(new IssueTrackerException("GitHub returned 502"));
        when(batchEvaluationOrchestrator.runBatchEvaluation(eq(2L), eq(EvaluationAxis.QUALITY), anyInt()))
                .thenReturn(result(0, false));
        when(batchEvaluationOrchestrator.runBatchEvaluation(eq(2L), eq(EvaluationAxis.CONSISTENCY), anyInt()))
                .thenReturn(result(0, false));

        scheduler.syncAll();

        verify(issueSyncService).runSync(2L, false);
        verify(speedEvaluationService).evaluateSpeed(2L);
        verify(speedEvaluationService, never()).evaluateSpeed(1L);
    }

    @Test
    void evaluationRounds_stopOnRateLimitOrRoundCap() {
        when(batchEvaluationOrchestrator.runBatchEvaluation(eq(1L), eq(EvaluationAxis.QUALITY), anyInt()))
                .thenReturn(result(30, false));
        when(batchEvaluationOrchestrator.runBatchEvaluation(eq(1L), eq(EvaluationAxis.CONSISTENCY), anyInt()))
                .thenReturn(result(8, true));

        scheduler.syncAndEvaluate(web);

        verify(batchEvaluationOrchestrator, times(3)).runBatchEvaluation(eq(1L), eq(EvaluationAxis.QUALITY), anyInt());
        verify(batchEvaluationOrchestrator, times(1)).runBatchEvaluation(eq(1L), eq(EvaluationAxis.CONSISTENCY), anyInt());
    }

    @Test
    void evaluationRounds_stopWhenRoundOnlyFails() {
        when(batchEvaluationOrchestrator.runBatchEvaluation(eq(1L), eq(EvaluationAxis.QUALITY), anyInt()))
                .thenReturn(BatchEvaluationResult.builder().errors(2).remaining(2).build());
        when(batchEvaluationOrchestrator.runBatchEvaluation(eq(1L), eq(EvaluationAxis.CONSISTENCY), anyInt()))
                .thenReturn(result(0, false));

        scheduler.syncAndEvaluate(web);

        verify(batchEvaluationOrchestrator, times(1)).runBatchEvaluation(eq(1L), eq(EvaluationAxis.QUALITY), anyInt());
    }

    private static BatchEvaluationResult result(int remaining, boolean rateLimited) {
        return BatchEvaluationResult.builder().evaluated(10).remaining(remaining).rateLimited(rateLimited).build();
    }
}
