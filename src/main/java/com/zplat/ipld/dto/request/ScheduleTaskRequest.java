package com.zplat.ipld.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ScheduleTaskRequest {
    @NotNull(message = "lparId is required")
    Long lparId;
    @NotBlank(message = "scheduleTime is required")
    String scheduleTime;    // HH:MM
    String dayOfWeek;       // null = every day
    boolean cancelJobs;     // wipe the whole registry first
}
