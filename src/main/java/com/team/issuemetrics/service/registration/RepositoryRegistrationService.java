package com.team.issuemetrics.service.registration;

import com.team.issuemetrics.exception.RepositoryNotFoundException;
import com.team.issuemetrics.model.dto.RegisterRepositoryRequest;
import com.team.issuemetrics.model.dto.SprintSettingsRequest;
import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.model.entity.TrackedCollaborator;
import com.team.issuemetrics.model.sprint.SprintConfig;
import com.team.issuemetrics.repository.CollaboratorRepository;
import com.team.issuemetrics.repository.EvaluationRecordRepository;
import com.team.issuemetrics.repository.IssueRecordRepository;
import com.team.issuemetrics.repository.PullRequestRecordRepository;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import com.team.issuemetrics.repository.SyncMetadataRepository;
import com.team.issuemetrics.repository.TrackedCollaboratorRepository;
import com.team.issuemetrics.service.sync.SyncRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * repository 的登錄、衝刺設定、追蹤名單與刪除。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RepositoryRegistrationService {

    private final RepositoryProfileRepository repositoryRepo;
    private final TrackedCollaboratorRepository trackedCollaboratorRepo;
    private final CollaboratorRepository collaboratorRepo;
    private final IssueRecordRepository issueRepo;
    private final PullRequestRecordRepository pullRequestRepo;
    private final EvaluationRecordRepository evaluationRepo;
    private final SyncMetadataRepository syncMetadataRepo;
    private final SyncRecorder syncRecorder;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException 必填欄位缺少、設定值不合法，或 owner/repo 已登錄
     */
    @Transactional
    public RepositoryProfile registerRepository(RegisterRepositoryRequest request) {
        if (isBlank(request.getOwnerName()) || isBlank(request.getRepoName())) {
            throw new IllegalArgumentException("ownerName and repoName are required");
        }
        if (repositoryRepo.existsByOwnerNameAndRepoName(request.getOwnerName(), request.getRepoName())) {
            throw new IllegalArgumentException(
                    "Repository already registered: " + request.getOwnerName() + "/" + request.getRepoName());
        }

        int startDay = request.getSprintStartDayOfWeek() != null
                ? request.getSprintStartDayOfWeek() : SprintConfig.DEFAULT_START_DAY_OF_WEEK;
        int durationWeeks = request.getSprintDurationWeeks() != null
                ? request.getSprintDurationWeeks() : SprintConfig.DEFAULT_DURATION_WEEKS;
        LocalDate trackingStart = request.getTrackingStartDate() != null
                ? request.getTrackingStartDate() : LocalDate.now(clock);

        // 設定不合法時在這裡就丟出
        new SprintConfig(startDay, durationWeeks, trackingStart);

        LocalDateTime now = LocalDateTime.now(clock);
        RepositoryProfile saved = repositoryRepo.save(RepositoryProfile.builder()
                .ownerName(request.getOwnerName())
                .repoName(request.getRepoName())
                .sprintStartDayOfWeek(startDay)
                .sprintDurationWeeks(durationWeeks)
                .trackingStartDate(trackingStart)
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("已登錄 repository：{} (id={}, 衝刺 {} 週, 起始星期 {})",
                saved.fullName(), saved.getId(), durationWeeks, startDay);
        return saved;
    }

    /**
     * 更新衝刺設定。已同步的 Issue 保留原本的衝刺編號，只有之後新同步的 Issue 套用新設定。
     */
    @Transactional
    public RepositoryProfile updateSprintSettings(Long repositoryId, SprintSettingsRequest request) {
        RepositoryProfile repository = repositoryRepo.findById(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));

        int startDay = request.getSprintStartDayOfWeek() != null
                ? request.getSprintStartDayOfWeek() : repository.getSprintStartDayOfWeek();
        int durationWeeks = request.getSprintDurationWeeks() != null
                ? request.getSprintDurationWeeks() : repository.getSprintDurationWeeks();
        LocalDate trackingStart = request.getTrackingStartDate() != null
                ? request.getTrackingStartDate() : repository.getTrackingStartDate();

        new SprintConfig(startDay, durationWeeks, trackingStart);

        repository.setSprintStartDayOfWeek(startDay);
        repository.setSprintDurationWeeks(durationWeeks);
        repository.setTrackingStartDate(trackingStart);
        repository.setUpdatedAt(LocalDateTime.now(clock));

        log.info("已更新 {} 的衝刺設定：{} 週, 起始星期 {}, 基準日 {}",
                repository.fullName(), durationWeeks, startDay, trackingStart);
        return repositoryRepo.save(repository);
    }

    /**
     * 以 userNames 取代追蹤名單，空清單代表全部列入。
     *
     * @return 登錄後的追蹤名單
     */
    @Transactional
    public List<String> registerTrackedCollaborators(Long repositoryId, List<String> userNames) {
        if (!repositoryRepo.existsById(repositoryId)) {
            throw new RepositoryNotFoundException(repositoryId);
        }

        Set<String> names = new LinkedHashSet<>();
        for (String userName : userNames) {
            if (!isBlank(userName)) names.add(userName.trim());
        }

        trackedCollaboratorRepo.deleteByRepositoryId(repositoryId);
        for (String userName : names) {
            Long collaboratorId = syncRecorder.findOrCreateCollaborator(repositoryId, userName);
            trackedCollaboratorRepo.save(TrackedCollaborator.builder()
                    .repositoryId(repositoryId)
                    .collaboratorId(collaboratorId)
                    .createdAt(LocalDateTime.now(clock))
                    .build());
        }

        log.info("repository {} 追蹤名單：{}", repositoryId, names.isEmpty() ? "(全部)" : names);
        return List.copyOf(names);
    }

    /**
     * 刪除 repository 及其 Issue、PR、評估結果、同步記錄、collaborator、追蹤名單。
     */
    @Transactional
    public void deleteRepository(Long repositoryId) {
        RepositoryProfile repository = repositoryRepo.findById(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));

        // 評估結果要在 Issue 之前刪
        int evaluations = evaluationRepo.deleteByRepositoryId(repositoryId);
        int pullRequests = pullRequestRepo.deleteByRepositoryId(repositoryId);
        int issues = issueRepo.deleteByRepositoryId(repositoryId);
        trackedCollaboratorRepo.deleteByRepositoryId(repositoryId);
        int collaborators = collaboratorRepo.deleteByRepositoryId(repositoryId);
        syncMetadataRepo.deleteByRepositoryId(repositoryId);
        repositoryRepo.delete(repository);

        log.info("已刪除 repository {} (id={})：Issue {} 筆, PR {} 筆, 評估 {} 筆, collaborator {} 筆",
                repository.fullName(), repositoryId, issues, pullRequests, evaluations, collaborators);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
