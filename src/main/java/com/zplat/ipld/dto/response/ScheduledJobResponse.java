package com.zplat.ipld.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ScheduledJobResponse {
    String tag;
    String task;
    LocalDateTime lastRun;
    LocalDateTime nextRun;
    String unit;        // days | weeks
    int interval;
    String period;      // ISO-8601 duration between runs
    String startDay;    // weekday, null for daily jobs
    LocalTime atTime;
}
