package com.team.issuemetrics.service.sync;

import com.team.issuemetrics.model.entity.Collaborator;
import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.entity.IssueRecord.IssueState;
import com.team.issuemetrics.model.entity.PullRequestRecord;
import com.team.issuemetrics.model.entity.PullRequestRecord.PullRequestState;
import com.team.issuemetrics.model.entity.SyncMetadata;
import com.team.issuemetrics.model.github.GitHubIssue;
import com.team.issuemetrics.model.github.GitHubPullRequest;
import com.team.issuemetrics.model.sprint.SprintNumber;
import com.team.issuemetrics.repository.CollaboratorRepository;
import com.team.issuemetrics.repository.IssueRecordRepository;
import com.team.issuemetrics.repository.PullRequestRecordRepository;
import com.team.issuemetrics.repository.SyncMetadataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 同步結果寫入 DB。每個方法各自一個 transaction，單筆失敗不影響已寫入的資料。
 * Issue / PR 的 upsert 不會碰到評估結果。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyncRecorder {

    private final CollaboratorRepository collaboratorRepo;
    private final IssueRecordRepository issueRepo;
    private final PullRequestRecordRepository pullRequestRepo;
    private final SyncMetadataRepository syncMetadataRepo;

    @Transactional
    public Long findOrCreateCollaborator(Long repositoryId, String userName) {
        return collaboratorRepo.findByRepositoryIdAndUserName(repositoryId, userName)
                .orElseGet(() -> {
                    log.info("新增 collaborator：{} (repository={})", userName, repositoryId);
                    return collaboratorRepo.save(Collaborator.builder()
                            .repositoryId(repositoryId)
                            .userName(userName)
                            .firstSeenAt(LocalDateTime.now())
                            .build());
                })
                .getId();
    }

    @Transactional(readOnly = true)
    public Long findCollaborator(Long repositoryId, String userName) {
        return collaboratorRepo.findByRepositoryIdAndUserName(repositoryId, userName)
                .map(Collaborator::getId)
                .orElse(null);
    }

    /**
     * 以 (repositoryId, 編號) upsert Issue。
     * 已存在的 Issue 保留原本的 sprintNumber 與建立時間（衝刺在第一次同步時決定）。
     *
     * @return true 表示新建
     */
    @Transactional
    public boolean upsertIssue(Long repositoryId, GitHubIssue source, Long authorId, Long assigneeId,
                               SprintNumber sprintNumber) {
        Optional<IssueRecord> existing = issueRepo.findByRepositoryIdAndTrackerNumber(repositoryId, source.getNumber());
        LocalDateTime now = LocalDateTime.now();

        IssueRecord issue = existing.orElseGet(() -> IssueRecord.builder()
                .repositoryId(repositoryId)
                .trackerNumber(source.getNumber())
                .trackerCreatedAt(source.getCreatedAt())
                .sprintNumber(sprintNumber.value())
                .createdAt(now)
                .build());

        issue.setTitle(source.getTitle());
        issue.setBody(source.getBody());
        issue.setState(IssueState.fromGitHub(source.getState()));
        issue.setAuthorCollaboratorId(authorId);
        issue.setAssigneeCollaboratorId(assigneeId);
        issue.setTrackerClosedAt(source.getClosedAt());
        issue.setTrackerUpdatedAt(source.getUpdatedAt());
        issue.setHtmlUrl(source.getHtmlUrl());
        if (issue.getSprintNumber() == null) {
            issue.setSprintNumber(sprintNumber.value());
        }
        issue.setUpdatedAt(now);

        issueRepo.save(issue);
        return existing.isEmpty();
    }

    /**
     * 以 (repositoryId, 編號) upsert PR。
     */
    @Transactional
    public void upsertPullRequest(Long repositoryId, GitHubPullRequest source, Long authorId, Long linkedIssueId) {
        LocalDateTime now = LocalDateTime.now();
        PullRequestRecord pr = pullRequestRepo.findByRepositoryIdAndTrackerNumber(repositoryId, source.getNumber())
                .orElseGet(() -> PullRequestRecord.builder()
                        .repositoryId(repositoryId)
                        .trackerNumber(source.getNumber())
                        .createdAt(now)
                        .build());

        pr.setTitle(source.getTitle());
        pr.setState(source.isMerged()
                ? PullRequestState.MERGED
                : "closed".equalsIgnoreCase(source.getState()) ? PullRequestState.CLOSED : PullRequestState.OPEN);
        pr.setAuthorCollaboratorId(authorId);
        pr.setLinkedIssueId(linkedIssueId);
        pr.setTrackerCreatedAt(source.getCreatedAt());
        pr.setTrackerMergedAt(source.getMergedAt());
        pr.setUpdatedAt(now);

        pullRequestRepo.save(pr);
    }

    @Transactional(readOnly = true)
    public Long findIssueId(Long repositoryId, int issueNumber) {
        return issueRepo.findByRepositoryIdAndTrackerNumber(repositoryId, issueNumber)
                .map(IssueRecord::getId)
                .orElse(null);
    }

    /**
     * 更新同步狀態（沒有就新增）。
     */
    @Transactional
    public void recordSync(Long repositoryId, Instant syncedAt, int currentSprintNumber, boolean fullSync) {
        SyncMetadata metadata = syncMetadataRepo.findByRepositoryId(repositoryId)
                .orElseGet(() -> SyncMetadata.builder().repositoryId(repositoryId).build());

        metadata.setLastSyncAt(syncedAt);
        metadata.setLastSyncSprintNumber(currentSprintNumber);
        metadata.setLastSyncFull(fullSync);
        syncMetadataRepo.save(metadata);
    }
}
