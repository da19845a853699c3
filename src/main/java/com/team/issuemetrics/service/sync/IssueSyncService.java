package com.team.issuemetrics.service.sync;

import com.team.issuemetrics.exception.RepositoryNotFoundException;
import com.team.issuemetrics.model.dto.SyncResult;
import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.model.entity.SyncMetadata;
import com.team.issuemetrics.model.github.GitHubIssue;
import com.team.issuemetrics.model.github.GitHubPullRequest;
import com.team.issuemetrics.model.sprint.SprintNumber;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import com.team.issuemetrics.repository.SyncMetadataRepository;
import com.team.issuemetrics.repository.TrackedCollaboratorRepository;
import com.team.issuemetrics.service.github.GitHubIssueService;
import com.team.issuemetrics.service.github.GitHubPullRequestService;
import com.team.issuemetrics.service.sprint.SprintCalculator;
import com.team.issuemetrics.service.sprint.SprintService;
import com.team.issuemetrics.util.IssueReferenceParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * GitHub → DB 的 Issue / PR 同步。
 *
 * 流程：
 * 1. 沒有同步記錄或強制全量 → 全量；否則只抓上次同步之後更新的資料
 * 2. 追蹤名單不為空時，只同步名單內使用者建立的 Issue
 * 3. 依建立時間計算衝刺編號後 upsert（已存在的 Issue 衝刺不變）
 * 4. 同步 PR，並由 closing keyword 關聯 Issue
 * 5. 不論同步幾筆，都更新同步記錄
 *
 * 同一個 repository 的同步會排隊執行；不同 repository 可並行。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IssueSyncService {

    private final RepositoryProfileRepository repositoryRepo;
    private final SyncMetadataRepository syncMetadataRepo;
    private final TrackedCollaboratorRepository trackedCollaboratorRepo;
    private final GitHubIssueService issueService;
    private final GitHubPullRequestService pullRequestService;
    private final SyncRecorder syncRecorder;
    private final SprintService sprintService;
    private final Clock clock;

    private final ConcurrentMap<Long, ReentrantLock> repositoryLocks = new ConcurrentHashMap<>();

    /**
     * @throws RepositoryNotFoundException repository 不存在
     * @throws com.team.issuemetrics.exception.IssueTrackerException 從 GitHub 取得資料失敗（同步記錄不會更新）
     */
    public SyncResult runSync(Long repositoryId, boolean forceFullSync) {
        ReentrantLock lock = repositoryLocks.computeIfAbsent(repositoryId, id -> new ReentrantLock());
        if (lock.isLocked()) {
            log.info("repository {} 正在同步中，等待前一次完成", repositoryId);
        }
        lock.lock();
        try {
            return doSync(repositoryId, forceFullSync);
        } finally {
            lock.unlock();
        }
    }

    private SyncResult doSync(Long repositoryId, boolean forceFullSync) {
        RepositoryProfile repository = repositoryRepo.findById(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));

        Optional<SyncMetadata> metadata = syncMetadataRepo.findByRepositoryId(repositoryId);
        boolean fullSync = forceFullSync || metadata.isEmpty();
        Instant since = fullSync ? null : metadata.get().getLastSyncAt();
        // 以開始時間為同步時間，執行期間有更新的資料下次還會再抓到
        Instant startedAt = clock.instant();

        log.info("開始同步 {}：{}", repository.fullName(), fullSync ? "全量" : "差分（since " + since + "）");

        SprintCalculator calculator = sprintService.calculatorFor(repository);
        SyncContext context = new SyncContext(repository, calculator,
                new HashSet<>(trackedCollaboratorRepo.findTrackedUserNames(repositoryId)));

        List<GitHubIssue> issues = issueService
                .listIssues(repository.getOwnerName(), repository.getRepoName(), since)
                .block();

        int synced = 0;
        int skipped = 0;
        int failed = 0;
        for (GitHubIssue issue : issues) {
            if (!context.isInScope(issue.getUserLogin())) {
                log.debug("Issue #{} 建立者 {} 不在追蹤名單，略過", issue.getNumber(), issue.getUserLogin());
                skipped++;
                continue;
            }
            try {
                syncIssue(context, issue);
                synced++;
            } catch (RuntimeException e) {
                failed++;
                log.error("Issue #{} 同步失敗：{}", issue.getNumber(), e.getMessage(), e);
            }
        }

        List<GitHubPullRequest> pullRequests = pullRequestService
                .listPullRequests(repository.getOwnerName(), repository.getRepoName(), since)
                .block();

        int prSynced = 0;
        for (GitHubPullRequest pr : pullRequests) {
            try {
                syncPullRequest(context, pr);
                prSynced++;
            } catch (RuntimeException e) {
                failed++;
                log.error("PR #{} 同步失敗：{}", pr.getNumber(), e.getMessage(), e);
            }
        }

        SprintNumber currentSprint = calculator.sprintNumber(startedAt);
        syncRecorder.recordSync(repositoryId, startedAt, currentSprint.value(), fullSync);

        log.info("同步完成 {}：Issue {} 筆, 略過 {} 筆, PR {} 筆, 失敗 {} 筆",
                repository.fullName(), synced, skipped, prSynced, failed);

        return SyncResult.builder()
                .repositoryId(repositoryId)
                .syncedCount(synced)
                .skippedCount(skipped)
                .failedCount(failed)
                .prSyncedCount(prSynced)
                .fullSync(fullSync)
                .lastSyncedAt(startedAt)
                .build();
    }

    private void syncIssue(SyncContext context, GitHubIssue issue) {
        Long repositoryId = context.repository().getId();
        Long authorId = context.collaboratorId(issue.getUserLogin(),
                userName -> syncRecorder.findOrCreateCollaborator(repositoryId, userName));
        Long assigneeId = context.collaboratorId(issue.getAssigneeLogin(),
                userName -> syncRecorder.findOrCreateCollaborator(repositoryId, userName));
        SprintNumber sprintNumber = context.calculator().sprintNumber(issue.getCreatedAt());

        boolean created = syncRecorder.upsertIssue(repositoryId, issue, authorId, assigneeId, sprintNumber);
        log.debug("Issue #{} {}（{}）", issue.getNumber(), created ? "新增" : "更新", sprintNumber);
    }

    private void syncPullRequest(SyncContext context, GitHubPullRequest pr) {
        Long repositoryId = context.repository().getId();
        // PR 作者只對應既有的 collaborator，不新增
        Long authorId = context.collaboratorId(pr.getUserLogin(),
                userName -> syncRecorder.findCollaborator(repositoryId, userName));
        Long linkedIssueId = IssueReferenceParser.firstClosingReference(pr.getBody())
                .map(number -> syncRecorder.findIssueId(repositoryId, number))
                .orElse(null);

        syncRecorder.upsertPullRequest(repositoryId, pr, authorId, linkedIssueId);
    }
}
