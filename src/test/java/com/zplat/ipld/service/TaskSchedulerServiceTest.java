package com.zplat.ipld.service;

import com.zplat.ipld.dto.response.ScheduledJobResponse;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskSchedulerServiceTest {

    // Monday
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 8, 0);

    ExecutorService launcher;
    TaskSchedulerService scheduler;

    @BeforeEach
    void setUp() {
        launcher = Executors.newFixedThreadPool(2);
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        scheduler = new TaskSchedulerService(clock, launcher);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        launcher.shutdownNow();
    }

    @Test
    void clearByTagRemovesOnlyThatTag() {
        scheduler.schedule("SYSA", "deploy a", "09:00", "monday", false, () -> { });
        scheduler.schedule("SYSB", "deploy b", "10:00", null, false, () -> { });

        assertThat(scheduler.clearJobs("SYSA")).isEqualTo(1);
        assertThat(scheduler.listJobs()).extracting(ScheduledJobResponse::getTag).containsExactly("SYSB");

        scheduler.clearJobs(null);
        assertThat(scheduler.listJobs()).isEmpty();
    }

    @Test
    void sameTagAccumulatesUntilCleared() {
        scheduler.schedule("SYSA", "deploy a", "09:00", "monday", false, () -> { });
        scheduler.schedule("SYSA", "deploy a", "11:00", "monday", false, () -> { });

        assertThat(scheduler.listJobs()).hasSize(2);
        assertThat(scheduler.clearJobs("SYSA")).isEqualTo(2);
    }

    @Test
    void cancelAllWipesRegistryBeforeAdding() {
        scheduler.schedule("SYSA", "deploy a", "09:00", null, false, () -> { });
        scheduler.schedule("SYSB", "deploy b", "09:00", null, false, () -> { });
        scheduler.schedule("SYSC", "deploy c", "09:00", null, true, () -> { });

        assertThat(scheduler.listJobs()).extracting(ScheduledJobResponse::getTag).containsExactly("SYSC");
    }

    @Test
    void listViewDescribesRecurrence() {
        scheduler.schedule("SYSA", "deploy a", "09:00", "Wednesday", false, () -> { });
        scheduler.schedule("SYSB", "deploy b", "07:30", "", false, () -> { });

        List<ScheduledJobResponse> jobs = scheduler.listJobs();
        ScheduledJobResponse weekly = jobs.get(0);
        assertThat(weekly.getUnit()).isEqualTo("weeks");
        assertThat(weekly.getStartDay()).isEqualTo("wednesday");
        assertThat(weekly.getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 3, 9, 0));
        assertThat(weekly.getLastRun()).isNull();

        ScheduledJobResponse daily = jobs.get(1);
        assertThat(daily.getUnit()).isEqualTo("days");
        assertThat(daily.getInterval()).isEqualTo(1);
        assertThat(daily.getStartDay()).isNull();
        // 07:30 already passed today
        assertThat(daily.getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 2, 7, 30));
    }

    @Test
    void tickLaunchesDueJobsAndAdvancesNextRun() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.schedule("SYSA", "deploy a", "09:00", "monday", false, runs::incrementAndGet);
        scheduler.schedule("SYSB", "deploy b", "12:00", null, false, runs::incrementAndGet);

        assertThat(scheduler.tick(NOW.plusMinutes(30))).isEmpty();

        List<CompletableFuture<Void>> launched = scheduler.tick(LocalDateTime.of(2024, 1, 1, 9, 0, 1));
        assertThat(launched).hasSize(1);
        CompletableFuture.allOf(launched.toArray(CompletableFuture[]::new)).join();
        assertThat(runs.get()).isEqualTo(1);

        ScheduledJobResponse sysa = scheduler.listJobs().get(0);
        assertThat(sysa.getLastRun()).isEqualTo(LocalDateTime.of(2024, 1, 1, 9, 0, 1));
        assertThat(sysa.getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 8, 9, 0));
    }

    @Test
    void failingJobDoesNotBreakTheTick() {
        scheduler.schedule("SYSA", "deploy a", "09:00", null, false, () -> {
            throw new IllegalStateException("boom");
        });

        List<CompletableFuture<Void>> launched = scheduler.tick(LocalDateTime.of(2024, 1, 1, 9, 0));

        assertThat(launched).singleElement().satisfies(f ->
                assertThat(f).failsWithin(Duration.ofSeconds(5)));
        assertThat(scheduler.listJobs().get(0).getNextRun()).isEqualTo(LocalDateTime.of(2024, 1, 2, 9, 0));
    }

    @Test
    void rejectsBadTimeAndDay() {
        assertThatThrownBy(() -> scheduler.schedule("SYSA", "t", "9am", null, false, () -> { }))
                .isInstanceOfSatisfying(AppException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_SCHEDULE_TIME));
        assertThatThrownBy(() -> scheduler.schedule("SYSA", "t", "09:00", "funday", false, () -> { }))
                .isInstanceOfSatisfying(AppException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_DAY_OF_WEEK));
        assertThat(scheduler.listJobs()).isEmpty();
    }

    @Test
    void acceptsSecondsInTime() {
        assertThat(TaskSchedulerService.parseTime("09:15:30")).isEqualTo(LocalTime.of(9, 15, 30));
        assertThat(TaskSchedulerService.parseTime("9:15")).isEqualTo(LocalTime.of(9, 15));
        assertThat(TaskSchedulerService.parseDayOfWeek("SUNDAY")).isEqualTo(DayOfWeek.SUNDAY);
    }
}
