package com.zplat.ipld.service;

import com.zplat.ipld.common.Constants;
import com.zplat.ipld.dto.LparSnapshot;
import com.zplat.ipld.dto.response.HostOutcome;
import com.zplat.ipld.dto.response.TaskProgressResponse;
import com.zplat.ipld.entity.enumeration.HostStatus;
import com.zplat.ipld.remote.RemoteExecutionChannel;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Stream;

/**
 * Fans the analysis workflow out over a set of LPARs. Each host runs its steps
 * sequentially on one worker; a failing step ends only that host's workflow.
 */
@Service
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class DeploymentOrchestratorService {

    static final double INITIAL_PERCENT = 10;
    static final String NO_TARGETS = "No LPARs found for given IDs";
    private static final int MAX_LOG_OUTPUT = 200;

    RemoteExecutionChannel channel;
    ExecutorService executor;

    @NonFinal
    @Value("${ipld.remote.tmp-root:/tmp/zplatipld/}")
    String remoteTmpRoot;

    @NonFinal
    @Value("${ipld.scripts-dir:scripts}")
    String scriptsDir;

    @NonFinal
    @Value("${ipld.results-root:results}")
    String resultsRoot;

    public DeploymentOrchestratorService(RemoteExecutionChannel channel,
                                         @Qualifier("deploymentExecutor") ExecutorService executor) {
        this.channel = channel;
        this.executor = executor;
    }

    /**
     * Runs the workflow on every target and blocks until all hosts settle.
     * Never throws for a host failure; the failure is returned as an {@code ERROR:} outcome.
     *
     * @return one outcome per target, in target order
     */
    public List<HostOutcome> run(List<LparSnapshot> targets, ProgressEmitter emitter) {
        if (targets == null || targets.isEmpty()) {
            emitter.emit(Constants.EVENT.TASK_PROGRESS, TaskProgressResponse.builder()
                    .result(List.of())
                    .percent(100)
                    .error(NO_TARGETS)
                    .build());
            return List.of();
        }

        Map<String, HostStatus> status = Collections.synchronizedMap(new LinkedHashMap<>());
        targets.forEach(t -> status.put(t.getHostname(), HostStatus.WAIT));

        CompletionService<HostOutcome> completion = new ExecutorCompletionService<>(executor);
        Map<Future<HostOutcome>, LparSnapshot> submitted = new HashMap<>();
        for (LparSnapshot target : targets) {
            submitted.put(completion.submit(() -> deployHost(target, status)), target);
        }
        emitter.emit(Constants.EVENT.TASK_PROGRESS, snapshot(status, INITIAL_PERCENT, List.of()));

        Map<String, HostOutcome> outcomes = new HashMap<>();
        List<String> errors = new ArrayList<>();
        int total = submitted.size();
        int completed = 0;
        double percent = INITIAL_PERCENT;

        while (completed < total) {
            Future<HostOutcome> done;
            try {
                done = completion.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Deployment collector interrupted with {}/{} hosts settled", completed, total);
                break;
            }
            LparSnapshot target = submitted.get(done);
            HostOutcome outcome = outcomeOf(done, target, status);
            outcomes.put(target.getHostname(), outcome);

            if (!outcome.isSuccess()) {
                errors.add("Deployment failed for " + target.getHostname() + ": " + outcome.getResult());
            }
            completed++;
            percent = completed * 100.0 / total;
            emitter.emit(Constants.EVENT.TASK_PROGRESS, snapshot(status, percent, errors));
        }

        emitter.emit(Constants.EVENT.TASK_PROGRESS, snapshot(status, percent, errors));
        log.info("All deployment tasks completed: {} hosts, {} failed", total, errors.size());

        List<HostOutcome> ordered = new ArrayList<>(targets.size());
        for (LparSnapshot target : targets) {
            ordered.add(outcomes.getOrDefault(target.getHostname(),
                    HostOutcome.failure(target.getHostname(), "deployment did not complete")));
        }
        return ordered;
    }

    private HostOutcome outcomeOf(Future<HostOutcome> done, LparSnapshot target, Map<String, HostStatus> status) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            // deployHost catches its own failures, this only covers an unexpected error
            log.error("Deployment failed for {} with exception", target.getHostname(), e.getCause());
            status.put(target.getHostname(), HostStatus.ERROR);
            return HostOutcome.failure(target.getHostname(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status.put(target.getHostname(), HostStatus.ERROR);
            return HostOutcome.failure(target.getHostname(), "interrupted");
        }
    }

    HostOutcome deployHost(LparSnapshot target, Map<String, HostStatus> status) {
        HostOutcome outcome = runSteps(target);
        status.put(target.getHostname(), outcome.isSuccess() ? HostStatus.DONE : HostStatus.ERROR);
        if (outcome.isSuccess()) {
            log.info("Deployment successful for {}", target.getHostname());
        } else {
            log.error("Deployment failed for {}: {}", target.getHostname(), outcome.getResult());
        }
        return outcome;
    }

    private HostOutcome runSteps(LparSnapshot target) {
        String host = target.getHostname();
        String user = target.getUsername();
        String workspace = remoteTmpRoot + target.shortName();
        log.info("Starting deploy loop for {}", host);

        // 1. reset remote workspace
        try {
            String out = channel.runCommand(host, user,
                    "if [ -d " + workspace + " ]; then rm -rf " + workspace + "; fi; "
                            + "mkdir -p " + workspace + " && ls -la " + workspace);
            log.debug("Remote space preparation output on {}: {}", host, out);
        } catch (RuntimeException e) {
            log.error("Failed to prepare remote space on {}", host, e);
            return HostOutcome.failure(host, "An error occured on prepare the remote file space");
        }

        // 2. upload payload
        for (String file : Constants.PAYLOAD.FILES) {
            try {
                channel.uploadFile(host, user, Paths.get(scriptsDir, file), workspace);
                log.debug("Uploaded {} to {}:{}", file, host, workspace);
            } catch (RuntimeException e) {
                log.error("Failed to upload {} to {}", file, host, e);
                return HostOutcome.failure(host,
                        "An error occured on upload file " + file.toUpperCase(Locale.ROOT) + " to " + host);
            }
        }

        // 3. run driver
        try {
            String out = channel.runCommand(host, user,
                    workspace + "/" + Constants.PAYLOAD.DRIVER + " -r cli -a " + host + " -q " + target.getDataset());
            log.info("{} execution output for {}: {}", Constants.PAYLOAD.DRIVER, host, abbreviate(out));
            log.debug("{} full output for {}: {}", Constants.PAYLOAD.DRIVER, host, out);
        } catch (RuntimeException e) {
            log.error("Failed to execute {} on {}", Constants.PAYLOAD.DRIVER, host, e);
            return HostOutcome.failure(host, "An error occured on running the " + Constants.PAYLOAD.DRIVER);
        }

        // 4. collect CSV artifacts
        try {
            Path localDir = recreateLocalDir(Paths.get(resultsRoot, target.shortName()));
            channel.downloadFile(host, user, workspace + "/" + Constants.PAYLOAD.RESULT_GLOB, localDir);
            log.info("Downloaded results from {} into {}", host, localDir);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to download results from {}", host, e);
            return HostOutcome.failure(host, "An error occured on downloading CSV results from " + host);
        }

        // 5. cleanup
        try {
            channel.runCommand(host, user, "rm -rf " + workspace + "; rm -rf " + remoteTmpRoot);
        } catch (RuntimeException e) {
            log.error("Failed to clean remote space on {}", host, e);
            return HostOutcome.failure(host, "An error occured on cleaning the remote file space on " + host);
        }

        return HostOutcome.success(host);
    }

    private static String abbreviate(String s) {
        if (s == null || s.length() <= MAX_LOG_OUTPUT) return s;
        return s.substring(0, MAX_LOG_OUTPUT) + "...";
    }

    static Path recreateLocalDir(Path dir) throws IOException {
        if (Files.exists(dir)) {
            try (Stream<Path> walk = Files.walk(dir)) {
                List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
                for (Path p : paths) {
                    Files.delete(p);
                }
            }
        }
        return Files.createDirectories(dir);
    }

    private static TaskProgressResponse snapshot(Map<String, HostStatus> status, double percent, List<String> errors) {
        List<String> result;
        synchronized (status) {
            result = new ArrayList<>(status.size());
            status.forEach((host, s) -> result.add("'" + host + "': '" + s.value() + "'"));
        }
        return TaskProgressResponse.builder()
                .result(result)
                .percent(percent)
                .error(errors.isEmpty() ? null : String.join(", ", errors))
                .build();
    }
}
