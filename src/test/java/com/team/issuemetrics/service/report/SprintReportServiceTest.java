package com.team.issuemetrics.service.report;

import com.team.issuemetrics.config.SyncConfig;
import com.team.issuemetrics.exception.RepositoryNotFoundException;
import com.team.issuemetrics.model.dto.SprintDashboard;
import com.team.issuemetrics.model.dto.SprintHistory;
import com.team.issuemetrics.model.dto.UserSprintStats;
import com.team.issuemetrics.model.entity.Collaborator;
import com.team.issuemetrics.model.entity.EvaluationRecord;
import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.entity.IssueRecord.IssueState;
import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.model.evaluation.Grade;
import com.team.issuemetrics.repository.CollaboratorRepository;
import com.team.issuemetrics.repository.EvaluationRecordRepository;
import com.team.issuemetrics.repository.IssueRecordRepository;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import com.team.issuemetrics.repository.TrackedCollaboratorRepository;
import com.team.issuemetrics.service.sprint.SprintService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SprintReportServiceTest {

    private static final Long REPO_ID = 1L;
    // 2024-01-06 起的週衝刺，01-15 屬於衝刺 2（01-13 ~ 01-19）
    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final Instant MONDAY = Instant.parse("2024-01-15T00:00:00Z");

    @Mock
    private RepositoryProfileRepository repositoryRepo;
    @Mock
    private IssueRecordRepository issueRepo;
    @Mock
    private EvaluationRecordRepository evaluationRepo;
    @Mock
    private CollaboratorRepository collaboratorRepo;
    @Mock
    private TrackedCollaboratorRepository trackedCollaboratorRepo;

    private SprintReportService reportService;

    private final IssueRecord aliceClosed = issue(101L, 1, 10L, 2, IssueState.CLOSED, Duration.ofHours(30));
    private final IssueRecord aliceOpen = issue(102L, 2, 10L, 2, IssueState.OPEN, null);
    private final IssueRecord bobClosed = issue(103L, 3, 11L, 2, IssueState.CLOSED, Duration.ofHours(100));
    private final IssueRecord bobLastSprint = issue(104L, 4, 11L, 1, IssueState.CLOSED, Duration.ofHours(130));

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        SprintService sprintService = new SprintService(repositoryRepo, new SyncConfig(), clock);
        reportService = new SprintReportService(repositoryRepo, issueRepo, evaluationRepo, collaboratorRepo,
                trackedCollaboratorRepo, sprintService, clock);

        lenient().when(repositoryRepo.findById(REPO_ID)).thenReturn(Optional.of(RepositoryProfile.builder()
                .id(REPO_ID)
                .ownerName("acme")
                .repoName("web")
                .trackingStartDate(LocalDate.of(2024, 1, 6))
                .build()));
    }

    @Test
    void dashboard_aggregatesPerAuthorAndAveragesRawScores() {
        givenCollaborators(List.of());
        when(issueRepo.findBySprintRange(REPO_ID, 2, 2)).thenReturn(List.of(aliceClosed, aliceOpen, bobClosed));
        when(evaluationRepo.findByIssueIdIn(anyCollection())).thenReturn(List.of(
                EvaluationRecord.builder().issueId(101L).qualityScore(88).qualityGrade(Grade.A).build(),
                EvaluationRecord.builder().issueId(102L).qualityScore(60).qualityGrade(Grade.C).build(),
                EvaluationRecord.builder().issueId(103L).consistencyScore(75).consistencyGrade(Grade.B).build()));

        SprintDashboard dashboard = reportService.getSprintDashboard(REPO_ID, 0);

        assertThat(dashboard.getRepositoryName()).isEqualTo("acme/web");
        assertThat(dashboard.getSprint().getNumber()).isEqualTo(2);
        assertThat(dashboard.getSprint().getPeriod()).isEqualTo("1/13(Sat) - 1/19(Fri)");
        assertThat(dashboard.getTotalIssues()).isEqualTo(3);
        assertThat(dashboard.getClosedIssues()).isEqualTo(2);
        assertThat(dashboard.getOpenIssues()).isEqualTo(1);

        UserSprintStats alice = dashboard.getUsers().get(0);
        assertThat(alice.getUserName()).isEqualTo("alice");
        assertThat(alice.getTotalIssues()).isEqualTo(2);
        assertThat(alice.getAverageSpeedScore()).isEqualTo(100);
        assertThat(alice.getSpeedGrade()).isEqualTo(Grade.A);
        // (88 + 60) / 2 = 74 → B（不是 A 與 C 的平均）
        assertThat(alice.getAverageQualityScore()).isEqualTo(74);
        assertThat(alice.getQualityGrade()).isEqualTo(Grade.B);
        assertThat(alice.getConsistencyGrade()).isNull();
        assertThat(alice.getConsistencyEvaluatedCount()).isZero();

        UserSprintStats bob = dashboard.getUsers().get(1);
        assertThat(bob.getUserName()).isEqualTo("bob");
        assertThat(bob.getAverageSpeedScore()).isEqualTo(40);
        assertThat(bob.getSpeedGrade()).isEqualTo(Grade.D);
        assertThat(bob.getAverageConsistencyScore()).isEqualTo(75);
    }

    @Test
    void dashboard_onlyCountsTrackedCollaboratorsWhenListIsSet() {
        givenCollaborators(List.of("bob"));
        when(issueRepo.findBySprintRange(REPO_ID, 2, 2)).thenReturn(List.of(aliceClosed, aliceOpen, bobClosed));
        when(evaluationRepo.findByIssueIdIn(anyCollection())).thenReturn(List.of());

        SprintDashboard dashboard = reportService.getSprintDashboard(REPO_ID, 0);

        assertThat(dashboard.getTotalIssues()).isEqualTo(1);
        assertThat(dashboard.getUsers()).extracting(UserSprintStats::getUserName).containsExactly("bob");
    }

    @Test
    void dashboard_emptySprintHasNoGrades() {
        givenCollaborators(List.of());
        when(issueRepo.findBySprintRange(REPO_ID, 3, 3)).thenReturn(List.of());

        SprintDashboard dashboard = reportService.getSprintDashboard(REPO_ID, 1);

        assertThat(dashboard.getSprint().isCurrent()).isFalse();
        assertThat(dashboard.getTotalIssues()).isZero();
        assertThat(dashboard.getUsers()).allSatisfy(user -> {
            assertThat(user.getTotalIssues()).isZero();
            assertThat(user.getSpeedGrade()).isNull();
        });
    }

    @Test
    void history_listsSprintsOldestFirstWithGradeDistribution() {
        givenCollaborators(List.of());
        when(issueRepo.findBySprintRange(REPO_ID, 1, 2)).thenReturn(List.of(bobLastSprint, aliceClosed, bobClosed));
        when(evaluationRepo.findByIssueIdIn(anyCollection())).thenReturn(List.of(
                EvaluationRecord.builder().issueId(104L).speedScore(20).speedGrade(Grade.E).build()));

        SprintHistory history = reportService.getSprintHistory(REPO_ID, 2);

        assertThat(history.getSprints()).hasSize(2);
        SprintHistory.SprintEntry previous = history.getSprints().get(0);
        SprintHistory.SprintEntry current = history.getSprints().get(1);

        assertThat(previous.getSprint().getNumber()).isEqualTo(1);
        assertThat(previous.getSprint().getOffset()).isEqualTo(-1);
        assertThat(previous.getTeam().getTotalIssues()).isEqualTo(1);
        assertThat(previous.getGradeDistribution().get(EvaluationAxis.SPEED).get(Grade.E)).isEqualTo(1);

        assertThat(current.getSprint().isCurrent()).isTrue();
        assertThat(current.getTeam().getAverageSpeedScore()).isEqualTo(70);
        assertThat(current.getGradeDistribution().get(EvaluationAxis.SPEED))
                .containsEntry(Grade.A, 1)
                .containsEntry(Grade.D, 1)
                .containsEntry(Grade.B, 0);
        assertThat(current.getGradeDistribution().get(EvaluationAxis.QUALITY).values()).containsOnly(0);
    }

    @Test
    void history_rejectsNonPositiveCount() {
        assertThatThrownBy(() -> reportService.getSprintHistory(REPO_ID, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownRepository_isRejected() {
        when(repositoryRepo.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reportService.getSprintDashboard(99L, 0))
                .isInstanceOf(RepositoryNotFoundException.class);
    }

    private void givenCollaborators(List<String> tracked) {
        when(collaboratorRepo.findByRepositoryId(REPO_ID)).thenReturn(List.of(
                Collaborator.builder().id(11L).repositoryId(REPO_ID).userName("bob").build(),
                Collaborator.builder().id(10L).repositoryId(REPO_ID).userName("alice").build()));
        when(trackedCollaboratorRepo.findTrackedUserNames(REPO_ID)).thenReturn(tracked);
    }

    private static IssueRecord issue(Long id, int number, Long authorId, int sprint, IssueState state,
                                     Duration timeToClose) {
        Instant created = sprint == 2 ? MONDAY : MONDAY.minus(Duration.ofDays(7));
        return IssueRecord.builder()
                .id(id)
                .repositoryId(REPO_ID)
                .trackerNumber(number)
                .title("Issue " + number)
                .state(state)
                .authorCollaboratorId(authorId)
                .sprintNumber(sprint)
                .trackerCreatedAt(created)
                .trackerClosedAt(timeToClose != null ? created.plus(timeToClose) : null)
                .build();
    }
}
