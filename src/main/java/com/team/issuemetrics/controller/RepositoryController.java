package com.team.issuemetrics.controller;

import com.team.issuemetrics.model.dto.RegisterRepositoryRequest;
import com.team.issuemetrics.model.dto.SprintSettingsRequest;
import com.team.issuemetrics.model.dto.SyncResult;
import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import com.team.issuemetrics.service.registration.RepositoryRegistrationService;
import com.team.issuemetrics.service.sync.IssueSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Repository 設定與同步 API。
 *
 * - GET  /api/repositories                                 已登錄清單
 * - POST /api/repositories                                 登錄
 * - PUT  /api/repositories/{id}/sprint-settings            衝刺設定
 * - PUT  /api/repositories/{id}/tracked-collaborators      追蹤名單
 * - POST /api/repositories/{id}/sync?forceFullSync=false   同步
 * - DELETE /api/repositories/{id}                          刪除（含所有同步資料與評估結果）
 */
@RestController
@RequestMapping("/api/repositories")
@Slf4j
@RequiredArgsConstructor
public class RepositoryController {

    private final RepositoryProfileRepository repositoryRepo;
    private final RepositoryRegistrationService registrationService;
    private final IssueSyncService issueSyncService;

    @GetMapping
    public ResponseEntity<List<RepositoryProfile>> list() {
        return ResponseEntity.ok(repositoryRepo.findAll());
    }

    @PostMapping
    public ResponseEntity<RepositoryProfile> register(@RequestBody RegisterRepositoryRequest request) {
        log.info("登錄 repository：{}/{}", request.getOwnerName(), request.getRepoName());
        return ResponseEntity.status(HttpStatus.CREATED).body(registrationService.registerRepository(request));
    }

    @PutMapping("/{id}/sprint-settings")
    public ResponseEntity<RepositoryProfile> updateSprintSettings(@PathVariable Long id,
                                                                  @RequestBody SprintSettingsRequest request) {
        return ResponseEntity.ok(registrationService.updateSprintSettings(id, request));
    }

    @PutMapping("/{id}/tracked-collaborators")
    public ResponseEntity<Map<String, Object>> updateTrackedCollaborators(@PathVariable Long id,
                                                                          @RequestBody List<String> userNames) {
        List<String> tracked = registrationService.registerTrackedCollaborators(id, userNames);
        return ResponseEntity.ok(Map.of(
                "repositoryId", id,
                "trackedCollaborators", tracked));
    }

    @PostMapping("/{id}/sync")
    public ResponseEntity<SyncResult> sync(@PathVariable Long id,
                                           @RequestParam(defaultValue = "false") boolean forceFullSync) {
        log.info("收到同步請求：repository={}, forceFullSync={}", id, forceFullSync);
        return ResponseEntity.ok(issueSyncService.runSync(id, forceFullSync));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        log.info("刪除 repository：{}", id);
        registrationService.deleteRepository(id);
        return ResponseEntity.noContent().build();
    }
}
