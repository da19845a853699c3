package com.team.issuemetrics.service.sync;

import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.service.sprint.SprintCalculator;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 單次同步期間的狀態。collaborator 快取只在這一次同步內有效，不跨執行共用。
 */
class SyncContext {

    private final RepositoryProfile repository;
    private final SprintCalculator calculator;
    private final Set<String> trackedUserNames;
    private final Map<String, Long> collaboratorIds = new HashMap<>();

    SyncContext(RepositoryProfile repository, SprintCalculator calculator, Set<String> trackedUserNames) {
        this.repository = repository;
        this.calculator = calculator;
        this.trackedUserNames = trackedUserNames;
    }

    RepositoryProfile repository() {
        return repository;
    }

    SprintCalculator calculator() {
        return calculator;
    }

    /**
     * 追蹤名單為空時全部列入；否則只列入名單內的建立者。
     */
    boolean isInScope(String creator) {
        return trackedUserNames.isEmpty() || (creator != null && trackedUserNames.contains(creator));
    }

    /**
     * @param loader 快取沒有時呼叫；回傳 null 不會被快取
     */
    Long collaboratorId(String userName, Function<String, Long> loader) {
        if (userName == null || userName.isBlank()) return null;
        return collaboratorIds.computeIfAbsent(userName, loader);
    }
}
