package com.team.issuemetrics.service.sprint;

import com.team.issuemetrics.config.SyncConfig;
import com.team.issuemetrics.exception.RepositoryNotFoundException;
import com.team.issuemetrics.model.dto.SprintInfo;
import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.model.sprint.Sprint;
import com.team.issuemetrics.model.sprint.SprintConfig;
import com.team.issuemetrics.model.sprint.SprintNumber;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * 依 repository 的衝刺設定建立 {@link SprintCalculator}。
 */
@Service
@RequiredArgsConstructor
public class SprintService {

    private final RepositoryProfileRepository repositoryRepo;
    private final SyncConfig syncConfig;
    private final Clock clock;

    public SprintCalculator calculatorFor(RepositoryProfile repository) {
        return new SprintCalculator(repository.toSprintConfig(syncConfig.zone()));
    }

    /**
     * 指定日期往前 / 往後 offset 個衝刺。
     */
    public Sprint computeSprint(SprintConfig config, LocalDate date, int offset) {
        SprintCalculator calculator = new SprintCalculator(config);
        SprintNumber number = calculator.sprintNumber(date).plus(offset);
        return new Sprint(number, calculator.periodFor(number), offset == 0);
    }

    /**
     * repository 目前（offset=0）或前後的衝刺。
     */
    public SprintInfo getSprint(Long repositoryId, int offset) {
        RepositoryProfile repository = repositoryRepo.findById(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));
        SprintCalculator calculator = calculatorFor(repository);
        return toInfo(calculator, calculator.sprintWithOffset(clock.instant(), offset), offset);
    }

    public SprintInfo toInfo(SprintCalculator calculator, Sprint sprint, int offset) {
        SprintConfig config = calculator.getConfig();
        return SprintInfo.builder()
                .number(sprint.number().value())
                .startDate(sprint.period().startDate())
                .endDate(sprint.period().endDate())
                .startAt(sprint.period().startInstant(config.zoneId()))
                .endAt(sprint.period().endInstant(config.zoneId()))
                .period(calculator.format(sprint.period()))
                .current(sprint.isCurrent())
                .offset(offset)
                .startDayName(config.startDay().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .durationWeeks(config.durationWeeks())
                .build();
    }
}
