package com.team.issuemetrics.service.evaluation;

import com.team.issuemetrics.exception.IssueNotFoundException;
import com.team.issuemetrics.exception.RepositoryNotFoundException;
import com.team.issuemetrics.model.dto.IssueEvaluation;
import com.team.issuemetrics.model.entity.EvaluationRecord;
import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.repository.EvaluationRecordRepository;
import com.team.issuemetrics.repository.IssueRecordRepository;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 評估結果的查詢。
 */
@Service
@RequiredArgsConstructor
public class EvaluationQueryService {

    private final RepositoryProfileRepository repositoryRepo;
    private final IssueRecordRepository issueRepo;
    private final EvaluationRecordRepository evaluationRepo;

    @Transactional(readOnly = true)
    public List<IssueEvaluation> listEvaluations(Long repositoryId) {
        if (!repositoryRepo.existsById(repositoryId)) {
            throw new RepositoryNotFoundException(repositoryId);
        }

        List<IssueRecord> issues = issueRepo.findByRepositoryIdOrderByTrackerNumberAsc(repositoryId);
        if (issues.isEmpty()) return List.of();

        Map<Long, EvaluationRecord> evaluations = evaluationRepo
                .findByIssueIdIn(issues.stream().map(IssueRecord::getId).toList())
                .stream()
                .collect(Collectors.toMap(EvaluationRecord::getIssueId, Function.identity()));

        return issues.stream()
                .map(issue -> toView(issue, evaluations.get(issue.getId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public IssueEvaluation getEvaluation(Long repositoryId, Long issueId) {
        IssueRecord issue = issueRepo.findById(issueId)
                .filter(found -> repositoryId.equals(found.getRepositoryId()))
                .orElseThrow(() -> new IssueNotFoundException(repositoryId, issueId));
        return toView(issue, evaluationRepo.findByIssueId(issueId).orElse(null));
    }

    private IssueEvaluation toView(IssueRecord issue, EvaluationRecord evaluation) {
        IssueEvaluation.IssueEvaluationBuilder view = IssueEvaluation.builder()
                .issueId(issue.getId())
                .issueNumber(issue.getTrackerNumber())
                .title(issue.getTitle())
                .state(issue.getState().name().toLowerCase())
                .sprintNumber(issue.getSprintNumber());
        if (evaluation == null) return view.build();

        return view
                .speedScore(evaluation.getSpeedScore())
                .speedGrade(evaluation.getSpeedGrade())
                .qualityScore(evaluation.getQualityScore())
                .qualityGrade(evaluation.getQualityGrade())
                .qualityDetails(evaluation.getQualityDetails())
                .qualityCalculatedAt(evaluation.getQualityCalculatedAt())
                .consistencyScore(evaluation.getConsistencyScore())
                .consistencyGrade(evaluation.getConsistencyGrade())
                .consistencyDetails(evaluation.getConsistencyDetails())
                .consistencyCalculatedAt(evaluation.getConsistencyCalculatedAt())
                .build();
    }
}
