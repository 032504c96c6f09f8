package com.zplat.ipld.service;

import com.zplat.ipld.dto.LparSnapshot;
import com.zplat.ipld.dto.response.DryRunStatusResponse;
import com.zplat.ipld.dto.response.HostOutcome;
import com.zplat.ipld.dto.response.ScheduledJobResponse;
import com.zplat.ipld.entity.LparTarget;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import com.zplat.ipld.mapper.LparTargetMapper;
import com.zplat.ipld.repository.LparTargetRepository;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry points for deployment, dry run and scheduling. Runs are detached: the returned
 * future completes when the run settles, progress goes to the {@link ProgressEmitter}.
 */
@Service
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class TaskService {

    LparTargetRepository lparTargetRepository;
    LparTargetMapper lparTargetMapper;
    DeploymentOrchestratorService orchestrator;
    PreflightValidatorService preflightValidator;
    TaskSchedulerService scheduler;
    ProgressEmitter progressEmitter;
    ExecutorService launcher;
    ExecutorService dryRunExecutor;

    public TaskService(LparTargetRepository lparTargetRepository,
                       LparTargetMapper lparTargetMapper,
                       DeploymentOrchestratorService orchestrator,
                       PreflightValidatorService preflightValidator,
                       TaskSchedulerService scheduler,
                       ProgressEmitter progressEmitter,
                       @Qualifier("launcherExecutor") ExecutorService launcher,
                       @Qualifier("dryRunExecutor") ExecutorService dryRunExecutor) {
        this.lparTargetRepository = lparTargetRepository;
        this.lparTargetMapper = lparTargetMapper;
        this.orchestrator = orchestrator;
        this.preflightValidator = preflightValidator;
        this.scheduler = scheduler;
        this.progressEmitter = progressEmitter;
        this.launcher = launcher;
        this.dryRunExecutor = dryRunExecutor;
    }

    public CompletableFuture<List<HostOutcome>> runDeployment(List<Long> lparIds) {
        List<LparSnapshot> targets = lparTargetMapper.toSnapshots(lparTargetRepository.findByIdIn(lparIds));
        log.info("Dispatching deployment to {} of {} requested LPARs", targets.size(), lparIds.size());
        return CompletableFuture.supplyAsync(() -> orchestrator.run(targets, progressEmitter), launcher)
                .whenComplete((outcomes, ex) -> {
                    if (ex != null) {
                        log.error("Deployment run for {} failed", lparIds, ex);
                    }
                });
    }

    public CompletableFuture<DryRunStatusResponse> runDryRun(String hostname, String username, String dataset) {
        return CompletableFuture
                .supplyAsync(() -> preflightValidator.run(hostname, username, dataset, progressEmitter), dryRunExecutor)
                .whenComplete((status, ex) -> {
                    if (ex != null) {
                        log.error("Dry run execution failed for {}", hostname, ex);
                    } else {
                        log.info("Dry run for {} finished: {}", hostname, status);
                    }
                });
    }

    /**
     * Registers a recurring deployment of one LPAR, tagged with its LPAR name.
     * An existing job with the same tag is not replaced.
     */
    public ScheduledJobResponse scheduleTask(Long lparId, String time, String dayOfWeek, boolean cancelAll) {
        LparTarget target = lparTargetRepository.findById(lparId)
                .orElseThrow(() -> new AppException(ErrorCode.LPAR_NOT_EXISTED, String.valueOf(lparId)));
        LparSnapshot snapshot = lparTargetMapper.toSnapshot(target);
        String tag = snapshot.getLpar() != null ? snapshot.getLpar() : snapshot.getHostname();

        return scheduler.schedule(tag, "deploy " + snapshot.getHostname(), time, dayOfWeek, cancelAll,
                () -> orchestrator.run(List.of(snapshot), progressEmitter));
    }

    public List<ScheduledJobResponse> listScheduledJobs() {
        return scheduler.listJobs();
    }

    public int clearScheduledJobs(String tag) {
        return scheduler.clearJobs(tag);
    }
}
