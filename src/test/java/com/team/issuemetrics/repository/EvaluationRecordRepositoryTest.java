package com.team.issuemetrics.repository;

import com.team.issuemetrics.model.entity.EvaluationRecord;
import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.entity.IssueRecord.IssueState;
import com.team.issuemetrics.model.evaluation.AiEvaluationResult;
import com.team.issuemetrics.model.evaluation.CategoryScore;
import com.team.issuemetrics.model.evaluation.ConsistencyDetails.PullRequestRef;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.model.evaluation.Grade;
import com.team.issuemetrics.model.evaluation.SpeedScore;
import com.team.issuemetrics.model.github.GitHubIssue;
import com.team.issuemetrics.model.sprint.SprintNumber;
import com.team.issuemetrics.service.evaluation.EvaluationRecorder;
import com.team.issuemetrics.service.sync.SyncRecorder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 各評估軸的寫入互不覆蓋，Issue 重新同步也不會動到評估結果。
 */
@DataJpaTest
@Import({EvaluationRecorder.class, SyncRecorder.class})
class EvaluationRecordRepositoryTest {

    private static final Long REPO_ID = 1L;
    private static final Instant CREATED = Instant.parse("2024-01-08T09:00:00Z");

    @Autowired
    private EvaluationRecorder evaluationRecorder;
    @Autowired
    private SyncRecorder syncRecorder;
    @Autowired
    private IssueRecordRepository issueRepo;
    @Autowired
    private EvaluationRecordRepository evaluationRepo;

    @Test
    void axisWrites_doNotOverwriteEachOther() {
        Long issueId = syncIssue("open", SprintNumber.of(1));

        evaluationRecorder.saveQuality(issueId, result(EvaluationAxis.QUALITY, 88));
        evaluationRecorder.saveSpeed(issueId, SpeedScore.fromHours(100));
        AiEvaluationResult consistency = result(EvaluationAxis.CONSISTENCY, 75);
        consistency.setLinkedPullRequests(List.of(new PullRequestRef(7, "Fix login", "https://github.com/acme/web/pull/7")));
        evaluationRecorder.saveConsistency(issueId, consistency);

        EvaluationRecord record = evaluationRepo.findByIssueId(issueId).orElseThrow();
        assertThat(record.getQualityScore()).isEqualTo(88);
        assertThat(record.getQualityGrade()).isEqualTo(Grade.A);
        assertThat(record.getQualityDetails().getOverallFeedback()).isEqualTo("feedback 88");
        assertThat(record.getSpeedScore()).isEqualTo(40);
        assertThat(record.getSpeedGrade()).isEqualTo(Grade.D);
        assertThat(record.getConsistencyScore()).isEqualTo(75);
        assertThat(record.getConsistencyDetails().getLinkedPullRequests())
                .extracting(PullRequestRef::getNumber).containsExactly(7);
    }

    @Test
    void resync_keepsSprintAndEvaluations() {
        Long issueId = syncIssue("open", SprintNumber.of(1));
        evaluationRecorder.saveQuality(issueId, result(EvaluationAxis.QUALITY, 60));

        // 衝刺設定變更後重新同步，已存在的 Issue 衝刺不變
        Long sameId = syncIssue("closed", SprintNumber.of(5));

        assertThat(sameId).isEqualTo(issueId);
        IssueRecord issue = issueRepo.findById(issueId).orElseThrow();
        assertThat(issue.getSprintNumber()).isEqualTo(1);
        assertThat(issue.getState()).isEqualTo(IssueState.CLOSED);
        assertThat(evaluationRepo.findByIssueId(issueId).orElseThrow().getQualityScore()).isEqualTo(60);
    }

    @Test
    void consistencySkip_isRecorded() {
        Long issueId = syncIssue("closed", SprintNumber.of(1));

        evaluationRecorder.markConsistencySkipped(issueId);

        EvaluationRecord record = evaluationRepo.findByIssueId(issueId).orElseThrow();
        assertThat(record.getConsistencySkippedAt()).isNotNull();
        assertThat(record.getConsistencyScore()).isNull();
    }

    private Long syncIssue(String state, SprintNumber sprint) {
        GitHubIssue source = GitHubIssue.builder()
                .number(12)
                .title("Login fails")
                .body("Steps to reproduce")
                .state(state)
                .userLogin("alice")
                .createdAt(CREATED)
                .updatedAt(CREATED.plusSeconds(60))
                .closedAt("closed".equals(state) ? CREATED.plusSeconds(3600) : null)
                .build();
        Long authorId = syncRecorder.findOrCreateCollaborator(REPO_ID, "alice");
        syncRecorder.upsertIssue(REPO_ID, source, authorId, null, sprint);
        return syncRecorder.findIssueId(REPO_ID, 12);
    }

    private static AiEvaluationResult result(EvaluationAxis axis, int total) {
        return AiEvaluationResult.builder()
                .axis(axis)
                .totalScore(total)
                .grade(Grade.fromScore(total))
                .categories(List.of(CategoryScore.builder().categoryId("x").score(total).maxScore(100).build()))
                .overallFeedback("feedback " + total)
                .suggestions(List.of("Add acceptance criteria"))
                .build();
    }
}
