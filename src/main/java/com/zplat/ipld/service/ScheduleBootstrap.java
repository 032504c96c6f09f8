package com.zplat.ipld.service;

import com.zplat.ipld.entity.LparTarget;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import com.zplat.ipld.repository.LparTargetRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the scheduler registry from the enabled LPARs' schedule column at startup.
 * A malformed schedule is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@ConditionalOnProperty(name = "ipld.scheduler.bootstrap", havingValue = "true", matchIfMissing = true)
public class ScheduleBootstrap implements ApplicationRunner {

    LparTargetRepository lparTargetRepository;
    TaskService taskService;

    @Override
    public void run(ApplicationArguments args) {
        int registered = 0;
        for (LparTarget target : lparTargetRepository.findByEnabledTrue()) {
            if (target.getSchedule() == null || target.getSchedule().isBlank()) continue;
            try {
                String[] spec = parseScheduleSpec(target.getSchedule());
                taskService.scheduleTask(target.getId(), spec[1], spec[0], false);
                registered++;
            } catch (AppException e) {
                log.error("Skipping schedule of LPAR {} ({}): {}", target.getLpar(), target.getSchedule(), e.getMessage());
            }
        }
        log.info("Registered {} scheduled job(s) from LPAR table", registered);
    }

    /** {@code "[weekday] HH:MM"} to {day-or-null, time}. */
    static String[] parseScheduleSpec(String spec) {
        String[] parts = spec.trim().split("\\s+");
        if (parts.length == 1) return new String[]{null, parts[0]};
        if (parts.length == 2) return new String[]{parts[0], parts[1]};
        throw new AppException(ErrorCode.INVALID_SCHEDULE_SPEC, spec);
    }
}
