package com.zplat.ipld.controller;

import com.zplat.ipld.common.LogApi;
import com.zplat.ipld.dto.ApiResponse;
import com.zplat.ipld.dto.request.DryRunRequest;
import com.zplat.ipld.dto.request.ScheduleTaskRequest;
import com.zplat.ipld.dto.request.TaskRunRequest;
import com.zplat.ipld.dto.response.ScheduledJobResponse;
import com.zplat.ipld.service.TaskService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class TaskController {
    TaskService taskService;

    // progress is published on the task_progress event
    @LogApi
    @PostMapping("/deploy")
    public ApiResponse<String> deploy(@Valid @RequestBody TaskRunRequest request) {
        taskService.runDeployment(request.getLparIds());
        return ApiResponse.<String>builder().result("Deployment started").build();
    }

    @LogApi
    @PostMapping("/dry-run")
    public ApiResponse<String> dryRun(@Valid @RequestBody DryRunRequest request) {
        taskService.runDryRun(request.getHostname(), request.getUsername(), request.getDataset());
        return ApiResponse.<String>builder().result("Dry run started").build();
    }

    @LogApi
    @PostMapping("/schedule")
    public ApiResponse<ScheduledJobResponse> schedule(@Valid @RequestBody ScheduleTaskRequest request) {
        return ApiResponse.<ScheduledJobResponse>builder()
                .result(taskService.scheduleTask(request.getLparId(), request.getScheduleTime(),
                        request.getDayOfWeek(), request.isCancelJobs()))
                .build();
    }

    @GetMapping("/scheduled")
    public ApiResponse<List<ScheduledJobResponse>> listScheduled() {
        return ApiResponse.<List<ScheduledJobResponse>>builder()
                .result(taskService.listScheduledJobs())
                .build();
    }

    @LogApi
    @DeleteMapping("/scheduled")
    public ApiResponse<Integer> clearScheduled(@RequestParam(required = false) String tag) {
        return ApiResponse.<Integer>builder()
                .result(taskService.clearScheduledJobs(tag))
                .build();
    }
}
