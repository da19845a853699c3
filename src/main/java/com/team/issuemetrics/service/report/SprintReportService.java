package com.team.issuemetrics.service.report;

import com.team.issuemetrics.exception.RepositoryNotFoundException;
import com.team.issuemetrics.model.dto.SprintDashboard;
import com.team.issuemetrics.model.dto.SprintHistory;
import com.team.issuemetrics.model.dto.SprintHistory.SprintEntry;
import com.team.issuemetrics.model.dto.SprintInfo;
import com.team.issuemetrics.model.dto.UserSprintStats;
import com.team.issuemetrics.model.entity.Collaborator;
import com.team.issuemetrics.model.entity.EvaluationRecord;
import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.model.evaluation.Grade;
import com.team.issuemetrics.model.evaluation.Score;
import com.team.issuemetrics.model.evaluation.SpeedScore;
import com.team.issuemetrics.model.sprint.Sprint;
import com.team.issuemetrics.model.sprint.SprintNumber;
import com.team.issuemetrics.repository.CollaboratorRepository;
import com.team.issuemetrics.repository.EvaluationRecordRepository;
import com.team.issuemetrics.repository.IssueRecordRepository;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import com.team.issuemetrics.repository.TrackedCollaboratorRepository;
import com.team.issuemetrics.service.evaluation.SpeedEvaluationService;
import com.team.issuemetrics.service.sprint.SprintCalculator;
import com.team.issuemetrics.service.sprint.SprintService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 衝刺儀表板與歷史推移。
 *
 * 以 Issue 建立者為單位統計；追蹤名單不為空時只統計名單內的使用者。
 * 平均分數是原始分數的平均（四捨五入），等級由平均分數換算，不對等級取平均。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SprintReportService {

    public static final int DEFAULT_HISTORY_COUNT = 12;

    private final RepositoryProfileRepository repositoryRepo;
    private final IssueRecordRepository issueRepo;
    private final EvaluationRecordRepository evaluationRepo;
    private final CollaboratorRepository collaboratorRepo;
    private final TrackedCollaboratorRepository trackedCollaboratorRepo;
    private final SprintService sprintService;
    private final Clock clock;

    /**
     * @param offset 0=目前衝刺, -1=上一個, 1=下一個
     */
    @Transactional(readOnly = true)
    public SprintDashboard getSprintDashboard(Long repositoryId, int offset) {
        RepositoryProfile repository = findRepository(repositoryId);
        SprintCalculator calculator = sprintService.calculatorFor(repository);
        Sprint sprint = calculator.sprintWithOffset(clock.instant(), offset);

        Scope scope = loadScope(repositoryId);
        int number = sprint.number().value();
        List<IssueRecord> issues = scope.filter(issueRepo.findBySprintRange(repositoryId, number, number));
        Map<Long, EvaluationRecord> evaluations = loadEvaluations(issues);

        UserSprintStats overall = aggregate(null, issues, evaluations);
        log.info("查詢衝刺儀表板：{} {}，Issue {} 筆", repository.fullName(), sprint.number(), issues.size());

        return SprintDashboard.builder()
                .repositoryId(repositoryId)
                .repositoryName(repository.fullName())
                .sprint(sprintService.toInfo(calculator, sprint, offset))
                .totalIssues(overall.getTotalIssues())
                .closedIssues(overall.getClosedIssues())
                .openIssues(overall.getOpenIssues())
                .users(perUser(scope, issues, evaluations))
                .build();
    }

    /**
     * 最近 count 個衝刺（含目前衝刺），舊到新排列。
     */
    @Transactional(readOnly = true)
    public SprintHistory getSprintHistory(Long repositoryId, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be 1 or greater: " + count);
        }

        RepositoryProfile repository = findRepository(repositoryId);
        SprintCalculator calculator = sprintService.calculatorFor(repository);
        SprintNumber current = calculator.sprintNumber(clock.instant());
        SprintNumber first = current.plus(-(count - 1));

        Scope scope = loadScope(repositoryId);
        List<IssueRecord> issues = scope.filter(
                issueRepo.findBySprintRange(repositoryId, first.value(), current.value()));
        Map<Long, EvaluationRecord> evaluations = loadEvaluations(issues);
        Map<Integer, List<IssueRecord>> bySprint = issues.stream()
                .collect(Collectors.groupingBy(IssueRecord::getSprintNumber));

        List<SprintEntry> entries = new ArrayList<>();
        for (int offset = -(count - 1); offset <= 0; offset++) {
            SprintNumber number = current.plus(offset);
            Sprint sprint = new Sprint(number, calculator.periodFor(number), offset == 0);
            List<IssueRecord> sprintIssues = bySprint.getOrDefault(number.value(), List.of());

            entries.add(SprintEntry.builder()
                    .sprint(sprintService.toInfo(calculator, sprint, offset))
                    .team(aggregate(null, sprintIssues, evaluations))
                    .users(perUser(scope, sprintIssues, evaluations))
                    .gradeDistribution(gradeDistribution(sprintIssues, evaluations))
                    .build());
        }

        log.info("查詢衝刺歷史：{} {} ~ {}", repository.fullName(), first, current);
        return SprintHistory.builder()
                .repositoryId(repositoryId)
                .sprints(entries)
                .build();
    }

    private RepositoryProfile findRepository(Long repositoryId) {
        return repositoryRepo.findById(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));
    }

    private Scope loadScope(Long repositoryId) {
        List<Collaborator> collaborators = collaboratorRepo.findByRepositoryId(repositoryId);
        Set<String> tracked = new HashSet<>(trackedCollaboratorRepo.findTrackedUserNames(repositoryId));
        List<Collaborator> inScope = tracked.isEmpty()
                ? collaborators
                : collaborators.stream().filter(c -> tracked.contains(c.getUserName())).toList();
        return new Scope(!tracked.isEmpty(), inScope.stream()
                .sorted(Comparator.comparing(Collaborator::getUserName))
                .toList());
    }

    private Map<Long, EvaluationRecord> loadEvaluations(List<IssueRecord> issues) {
        if (issues.isEmpty()) return Map.of();
        return evaluationRepo.findByIssueIdIn(issues.stream().map(IssueRecord::getId).toList())
                .stream()
                .collect(Collectors.toMap(EvaluationRecord::getIssueId, Function.identity()));
    }

    private List<UserSprintStats> perUser(Scope scope, List<IssueRecord> issues,
                                          Map<Long, EvaluationRecord> evaluations) {
        Map<Long, List<IssueRecord>> byAuthor = issues.stream()
                .filter(i -> i.getAuthorCollaboratorId() != null)
                .collect(Collectors.groupingBy(IssueRecord::getAuthorCollaboratorId));

        return scope.collaborators().stream()
                .map(c -> aggregate(c.getUserName(), byAuthor.getOrDefault(c.getId(), List.of()), evaluations))
                .toList();
    }

    UserSprintStats aggregate(String userName, List<IssueRecord> issues, Map<Long, EvaluationRecord> evaluations) {
        int closed = (int) issues.stream().filter(IssueRecord::isClosed).count();

        List<Score> speed = new ArrayList<>();
        List<Score> quality = new ArrayList<>();
        List<Score> consistency = new ArrayList<>();
        for (IssueRecord issue : issues) {
            EvaluationRecord evaluation = evaluations.get(issue.getId());
            speedScore(issue, evaluation).ifPresent(speed::add);
            if (evaluation != null && evaluation.getQualityScore() != null) {
                quality.add(Score.of(evaluation.getQualityScore()));
            }
            if (evaluation != null && evaluation.getConsistencyScore() != null) {
                consistency.add(Score.of(evaluation.getConsistencyScore()));
            }
        }

        Score speedAverage = average(speed);
        Score qualityAverage = average(quality);
        Score consistencyAverage = average(consistency);

        return UserSprintStats.builder()
                .userName(userName)
                .totalIssues(issues.size())
                .closedIssues(closed)
                .openIssues(issues.size() - closed)
                .averageSpeedScore(speedAverage != null ? speedAverage.getValue() : null)
                .speedGrade(speedAverage != null ? speedAverage.getGrade() : null)
                .speedEvaluatedCount(speed.size())
                .averageQualityScore(qualityAverage != null ? qualityAverage.getValue() : null)
                .qualityGrade(qualityAverage != null ? qualityAverage.getGrade() : null)
                .qualityEvaluatedCount(quality.size())
                .averageConsistencyScore(consistencyAverage != null ? consistencyAverage.getValue() : null)
                .consistencyGrade(consistencyAverage != null ? consistencyAverage.getGrade() : null)
                .consistencyEvaluatedCount(consistency.size())
                .build();
    }

    private Map<EvaluationAxis, Map<Grade, Integer>> gradeDistribution(List<IssueRecord> issues,
                                                                     Map<Long, EvaluationRecord> evaluations) {
        Map<EvaluationAxis, Map<Grade, Integer>> distribution = new EnumMap<>(EvaluationAxis.class);
        for (EvaluationAxis axis : EvaluationAxis.values()) {
            Map<Grade, Integer> counts = new EnumMap<>(Grade.class);
            for (Grade grade : Grade.values()) {
                counts.put(grade, 0);
            }
            distribution.put(axis, counts);
        }

        for (IssueRecord issue : issues) {
            EvaluationRecord evaluation = evaluations.get(issue.getId());
            speedScore(issue, evaluation)
                    .ifPresent(s -> distribution.get(EvaluationAxis.SPEED).merge(s.getGrade(), 1, Integer::sum));
            if (evaluation == null) continue;
            if (evaluation.getQualityGrade() != null) {
                distribution.get(EvaluationAxis.QUALITY).merge(evaluation.getQualityGrade(), 1, Integer::sum);
            }
            if (evaluation.getConsistencyGrade() != null) {
                distribution.get(EvaluationAxis.CONSISTENCY).merge(evaluation.getConsistencyGrade(), 1, Integer::sum);
            }
        }
        return distribution;
    }

    /**
     * 已寫入的速度分數優先，沒有時依建立 / 關閉時間即時計算。
     */
    private Optional<Score> speedScore(IssueRecord issue, EvaluationRecord evaluation) {
        if (evaluation != null && evaluation.getSpeedScore() != null) {
            return Optional.of(Score.of(evaluation.getSpeedScore()));
        }
        return SpeedEvaluationService.speedOf(issue).map(SpeedScore::getScore);
    }

    private static Score average(List<Score> scores) {
        return scores.isEmpty() ? null : Score.average(scores);
    }

    /**
     * 統計範圍。restricted=false 時所有 collaborator 的 Issue 都列入。
     */
    private record Scope(boolean restricted, List<Collaborator> collaborators) {

        List<IssueRecord> filter(List<IssueRecord> issues) {
            if (!restricted) return issues;
            Set<Long> ids = collaborators.stream().map(Collaborator::getId).collect(Collectors.toSet());
            return issues.stream()
                    .filter(i -> i.getAuthorCollaboratorId() != null && ids.contains(i.getAuthorCollaboratorId()))
                    .toList();
        }
    }
}
