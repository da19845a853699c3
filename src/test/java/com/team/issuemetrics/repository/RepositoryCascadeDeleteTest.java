package com.team.issuemetrics.repository;

import com.team.issuemetrics.config.ClockConfig;
import com.team.issuemetrics.model.dto.RegisterRepositoryRequest;
import com.team.issuemetrics.model.evaluation.AiEvaluationResult;
import com.team.issuemetrics.model.evaluation.CategoryScore;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.model.evaluation.Grade;
import com.team.issuemetrics.model.github.GitHubIssue;
import com.team.issuemetrics.model.github.GitHubPullRequest;
import com.team.issuemetrics.model.sprint.SprintNumber;
import com.team.issuemetrics.service.evaluation.EvaluationRecorder;
import com.team.issuemetrics.service.registration.RepositoryRegistrationService;
import com.team.issuemetrics.service.sync.SyncRecorder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 刪除 repository 時一併刪除其所有資料，其他 repository 不受影響。
 */
@DataJpaTest
@Import({RepositoryRegistrationService.class, SyncRecorder.class, EvaluationRecorder.class, ClockConfig.class})
class RepositoryCascadeDeleteTest {

    private static final Instant CREATED = Instant.parse("2024-01-08T09:00:00Z");

    @Autowired
    private RepositoryRegistrationService registrationService;
    @Autowired
    private SyncRecorder syncRecorder;
    @Autowired
    private EvaluationRecorder evaluationRecorder;
    @Autowired
    private RepositoryProfileRepository repositoryRepo;
    @Autowired
    private IssueRecordRepository issueRepo;
    @Autowired
    private PullRequestRecordRepository pullRequestRepo;
    @Autowired
    private EvaluationRecordRepository evaluationRepo;
    @Autowired
    private CollaboratorRepository collaboratorRepo;
    @Autowired
    private TrackedCollaboratorRepository trackedCollaboratorRepo;
    @Autowired
    private SyncMetadataRepository syncMetadataRepo;

    @Test
    void deleteRepository_removesOwnedRowsOnly() {
        Long web = register("web");
        Long api = register("api");
        seed(web);
        seed(api);

        registrationService.deleteRepository(web);

        assertThat(repositoryRepo.findById(web)).isEmpty();
        assertThat(issueRepo.findByRepositoryIdOrderByTrackerNumberAsc(web)).isEmpty();
        assertThat(pullRequestRepo.findByRepositoryIdAndTrackerNumber(web, 7)).isEmpty();
        assertThat(collaboratorRepo.findByRepositoryId(web)).isEmpty();
        assertThat(trackedCollaboratorRepo.findTrackedUserNames(web)).isEmpty();
        assertThat(syncMetadataRepo.findByRepositoryId(web)).isEmpty();

        Long apiIssueId = syncRecorder.findIssueId(api, 12);
        assertThat(repositoryRepo.findById(api)).isPresent();
        assertThat(evaluationRepo.findByIssueId(apiIssueId)).isPresent();
        assertThat(evaluationRepo.count()).isEqualTo(1);
        assertThat(pullRequestRepo.findByRepositoryIdAndTrackerNumber(api, 7)).isPresent();
        assertThat(trackedCollaboratorRepo.findTrackedUserNames(api)).containsExactly("alice");
        assertThat(syncMetadataRepo.findByRepositoryId(api)).isPresent();
    }

    private Long register(String repoName) {
        return registrationService.registerRepository(RegisterRepositoryRequest.builder()
                .ownerName("acme")
                .repoName(repoName)
                .trackingStartDate(LocalDate.of(2024, 1, 6))
                .build()).getId();
    }

    private void seed(Long repositoryId) {
        Long authorId = syncRecorder.findOrCreateCollaborator(repositoryId, "alice");
        syncRecorder.upsertIssue(repositoryId, GitHubIssue.builder()
                .number(12)
                .title("Login fails")
                .state("closed")
                .userLogin("alice")
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .closedAt(CREATED.plusSeconds(3600))
                .build(), authorId, null, SprintNumber.of(1));
        Long issueId = syncRecorder.findIssueId(repositoryId, 12);

        evaluationRecorder.saveQuality(issueId, AiEvaluationResult.builder()
                .axis(EvaluationAxis.QUALITY)
                .totalScore(70)
                .grade(Grade.B)
                .categories(List.of(CategoryScore.builder().categoryId("x").score(70).maxScore(100).build()))
                .overallFeedback("ok")
                .suggestions(List.of())
                .build());
        syncRecorder.upsertPullRequest(repositoryId, GitHubPullRequest.builder()
                .number(7)
                .title("Fix login")
                .body("closes #12")
                .state("closed")
                .userLogin("alice")
                .createdAt(CREATED)
                .mergedAt(CREATED.plusSeconds(1800))
                .build(), authorId, issueId);
        syncRecorder.recordSync(repositoryId, CREATED.plusSeconds(7200), 1, true);
        registrationService.registerTrackedCollaborators(repositoryId, List.of("alice"));
    }
}
