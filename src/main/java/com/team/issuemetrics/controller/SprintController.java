package com.team.issuemetrics.controller;

import com.team.issuemetrics.model.dto.SprintDashboard;
import com.team.issuemetrics.model.dto.SprintHistory;
import com.team.issuemetrics.model.dto.SprintInfo;
import com.team.issuemetrics.service.report.SprintReportService;
import com.team.issuemetrics.service.sprint.SprintService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 衝刺查詢 API。
 *
 * - GET /api/sprints/current?repositoryId=&offset=0
 * - GET /api/sprints/dashboard?repositoryId=&offset=0
 * - GET /api/sprints/history?repositoryId=&count=12
 */
@RestController
@RequestMapping("/api/sprints")
@RequiredArgsConstructor
public class SprintController {

    private final SprintService sprintService;
    private final SprintReportService reportService;

    @GetMapping("/current")
    public ResponseEntity<SprintInfo> current(@RequestParam Long repositoryId,
                                              @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(sprintService.getSprint(repositoryId, offset));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<SprintDashboard> dashboard(@RequestParam Long repositoryId,
                                                     @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(reportService.getSprintDashboard(repositoryId, offset));
    }

    @GetMapping("/history")
    public ResponseEntity<SprintHistory> history(@RequestParam Long repositoryId,
                                                 @RequestParam(defaultValue = "" + SprintReportService.DEFAULT_HISTORY_COUNT) int count) {
        return ResponseEntity.ok(reportService.getSprintHistory(repositoryId, count));
    }
}
