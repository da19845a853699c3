package com.team.issuemetrics.service.evaluation;

import com.team.issuemetrics.exception.IssueNotFoundException;
import com.team.issuemetrics.exception.RepositoryNotFoundException;
import com.team.issuemetrics.model.dto.IssueEvaluation;
import com.team.issuemetrics.model.entity.EvaluationRecord;
import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.entity.IssueRecord.IssueState;
import com.team.issuemetrics.model.evaluation.Grade;
import com.team.issuemetrics.repository.EvaluationRecordRepository;
import com.team.issuemetrics.repository.IssueRecordRepository;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvaluationQueryServiceTest {

    @Mock
    private RepositoryProfileRepository repositoryRepo;
    @Mock
    private IssueRecordRepository issueRepo;
    @Mock
    private EvaluationRecordRepository evaluationRepo;

    @InjectMocks
    private EvaluationQueryService queryService;

    @Test
    void listEvaluations_leavesUnevaluatedAxesEmpty() {
        when(repositoryRepo.existsById(1L)).thenReturn(true);
        when(issueRepo.findByRepositoryIdOrderByTrackerNumberAsc(1L)).thenReturn(List.of(issue(101L, 1L, 1), issue(102L, 1L, 2)));
        when(evaluationRepo.findByIssueIdIn(anyCollection())).thenReturn(List.of(
                EvaluationRecord.builder().issueId(101L).qualityScore(88).qualityGrade(Grade.A).build()));

        List<IssueEvaluation> evaluations = queryService.listEvaluations(1L);

        assertThat(evaluations).extracting(IssueEvaluation::getIssueNumber).containsExactly(1, 2);
        assertThat(evaluations.get(0).getQualityGrade()).isEqualTo(Grade.A);
        assertThat(evaluations.get(0).getConsistencyScore()).isNull();
        assertThat(evaluations.get(1).getQualityScore()).isNull();
        assertThat(evaluations.get(1).getState()).isEqualTo("closed");
    }

    @Test
    void getEvaluation_rejectsIssueOfAnotherRepository() {
        when(issueRepo.findById(101L)).thenReturn(Optional.of(issue(101L, 2L, 1)));

        assertThatThrownBy(() -> queryService.getEvaluation(1L, 101L))
                .isInstanceOf(IssueNotFoundException.class);
    }

    @Test
    void listEvaluations_unknownRepositoryIsRejected() {
        when(repositoryRepo.existsById(9L)).thenReturn(false);

        assertThatThrownBy(() -> queryService.listEvaluations(9L))
                .isInstanceOf(RepositoryNotFoundException.class);
    }

    private static IssueRecord issue(Long id, Long repositoryId, int number) {
        return IssueRecord.builder()
                .id(id)
                .repositoryId(repositoryId)
                .trackerNumber(number)
                .title("Issue " + number)
                .state(IssueState.CLOSED)
                .sprintNumber(1)
                .trackerCreatedAt(Instant.parse("2024-01-08T00:00:00Z"))
                .build();
    }
}
