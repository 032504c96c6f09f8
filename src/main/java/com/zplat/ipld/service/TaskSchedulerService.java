package com.zplat.ipld.service;

import com.zplat.ipld.dto.response.ScheduledJobResponse;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory registry of recurring jobs, driven by one background thread ticking every second.
 * Due jobs are launched on a separate executor so a long deployment never delays the tick.
 * The registry is volatile: it is rebuilt from the LPAR table at startup.
 */
@Service
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class TaskSchedulerService {

    static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm", Locale.ROOT);
    static final DateTimeFormatter HH_MM_SS = DateTimeFormatter.ofPattern("H:mm:ss", Locale.ROOT);

    Clock clock;
    ExecutorService launcher;

    ReentrantLock lock = new ReentrantLock();
    List<ScheduledJob> jobs = new ArrayList<>();

    @NonFinal
    ScheduledExecutorService ticker;

    public TaskSchedulerService(Clock clock, @Qualifier("launcherExecutor") ExecutorService launcher) {
        this.clock = clock;
        this.launcher = launcher;
    }

    @PostConstruct
    public void start() {
        if (ticker != null && !ticker.isShutdown()) return;
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ipld-scheduler");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleAtFixedRate(this::safeTick, 1, 1, TimeUnit.SECONDS);
        log.info("Task scheduler started");
    }

    @PreDestroy
    public void stop() {
        if (ticker == null) return;
        ticker.shutdownNow();
        try {
            if (!ticker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scheduler tick thread did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Task scheduler stopped");
    }

    /**
     * Registers a job under {@code tag}. A job already registered under the same tag is kept,
     * so callers replacing a schedule must {@link #clearJobs(String)} first.
     *
     * @param time      HH:MM or HH:MM:SS
     * @param dayOfWeek weekday name, blank or null for every day
     * @param cancelAll wipe the whole registry before adding
     */
    public ScheduledJobResponse schedule(String tag, String taskName, String time, String dayOfWeek,
                                         boolean cancelAll, Runnable task) {
        LocalTime at = parseTime(time);
        DayOfWeek day = parseDayOfWeek(dayOfWeek);
        LocalDateTime now = LocalDateTime.now(clock);

        lock.lock();
        try {
            if (cancelAll) {
                log.info("Clearing {} scheduled jobs before registering {}", jobs.size(), tag);
                jobs.clear();
            }
            ScheduledJob job = new ScheduledJob(tag, taskName, at, day, task, now);
            jobs.add(job);
            log.info("Scheduled {} ({}) {} at {}, next run {}", tag, taskName,
                    day == null ? "every day" : "every " + day, at, job.getNextRun());
            return job.toResponse();
        } finally {
            lock.unlock();
        }
    }

    /** Removes the jobs tagged {@code tag}, or every job if {@code tag} is blank. */
    public int clearJobs(String tag) {
        lock.lock();
        try {
            int before = jobs.size();
            if (tag == null || tag.isBlank()) {
                jobs.clear();
            } else {
                jobs.removeIf(job -> job.getTag().equals(tag));
            }
            int removed = before - jobs.size();
            log.info("Cleared {} scheduled job(s){}", removed, tag == null || tag.isBlank() ? "" : " for " + tag);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public List<ScheduledJobResponse> listJobs() {
        lock.lock();
        try {
            return jobs.stream().map(ScheduledJob::toResponse).toList();
        } finally {
            lock.unlock();
        }
    }

    /** Launches every job due at {@code now}; returns the handles of the launched runs. */
    List<CompletableFuture<Void>> tick(LocalDateTime now) {
        List<ScheduledJob> due = new ArrayList<>();
        lock.lock();
        try {
            for (Iterator<ScheduledJob> it = jobs.iterator(); it.hasNext(); ) {
                ScheduledJob job = it.next();
                if (job.isDue(now)) {
                    job.markRun(now);
                    due.add(job);
                }
            }
        } finally {
            lock.unlock();
        }

        List<CompletableFuture<Void>> handles = new ArrayList<>(due.size());
        for (ScheduledJob job : due) {
            log.info("Running scheduled job {} ({})", job.getTag(), job.getTaskName());
            handles.add(CompletableFuture.runAsync(job.getTask(), launcher)
                    .whenComplete((v, ex) -> {
                        if (ex != null) {
                            log.error("Scheduled job {} failed", job.getTag(), ex);
                        } else {
                            log.info("Scheduled job {} finished", job.getTag());
                        }
                    }));
        }
        return handles;
    }

    private void safeTick() {
        try {
            tick(LocalDateTime.now(clock));
        } catch (RuntimeException e) {
            // an exception escaping scheduleAtFixedRate would cancel all future ticks
            log.error("Scheduler tick failed", e);
        }
    }

    static LocalTime parseTime(String time) {
        if (time == null || time.isBlank()) {
            throw new AppException(ErrorCode.INVALID_SCHEDULE_TIME, String.valueOf(time));
        }
        String value = time.trim();
        try {
            return LocalTime.parse(value, value.length() > 5 ? HH_MM_SS : HH_MM);
        } catch (DateTimeParseException e) {
            throw new AppException(ErrorCode.INVALID_SCHEDULE_TIME, value, e);
        }
    }

    static DayOfWeek parseDayOfWeek(String dayOfWeek) {
        if (dayOfWeek == null || dayOfWeek.isBlank()) return null;
        try {
            return DayOfWeek.valueOf(dayOfWeek.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AppException(ErrorCode.INVALID_DAY_OF_WEEK, dayOfWeek, e);
        }
    }
}
