package com.zplat.ipld.service;

import com.zplat.ipld.dto.response.ScheduledJobResponse;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.FieldDefaults;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * A recurring job held by {@link TaskSchedulerService}: daily at a time of day, or weekly on one weekday.
 * Mutable fields are only touched under the scheduler's registry lock.
 */
@Getter
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ScheduledJob {
    final String tag;
    final String taskName;
    final LocalTime atTime;
    final DayOfWeek dayOfWeek;     // null = every day
    final Runnable task;

    LocalDateTime lastRun;
    LocalDateTime nextRun;

    ScheduledJob(String tag, String taskName, LocalTime atTime, DayOfWeek dayOfWeek, Runnable task, LocalDateTime now) {
        this.tag = tag;
        this.taskName = taskName;
        this.atTime = atTime;
        this.dayOfWeek = dayOfWeek;
        this.task = task;
        this.nextRun = nextAfter(now);
    }

    boolean isDue(LocalDateTime now) {
        return !now.isBefore(nextRun);
    }

    void markRun(LocalDateTime now) {
        lastRun = now;
        nextRun = nextAfter(now);
    }

    /** First occurrence strictly after {@code now}. */
    LocalDateTime nextAfter(LocalDateTime now) {
        LocalDateTime candidate = now.toLocalDate().atTime(atTime);
        if (dayOfWeek == null) {
            return candidate.isAfter(now) ? candidate : candidate.plusDays(1);
        }
        candidate = candidate.with(TemporalAdjusters.nextOrSame(dayOfWeek));
        return candidate.isAfter(now) ? candidate : candidate.plusWeeks(1);
    }

    ScheduledJobResponse toResponse() {
        boolean weekly = dayOfWeek != null;
        return ScheduledJobResponse.builder()
                .tag(tag)
                .task(taskName)
                .lastRun(lastRun)
                .nextRun(nextRun)
                .unit(weekly ? "weeks" : "days")
                .interval(1)
                .period(weekly ? "P7D" : "P1D")
                .startDay(weekly ? dayOfWeek.name().toLowerCase(Locale.ROOT) : null)
                .atTime(atTime)
                .build();
    }
}
