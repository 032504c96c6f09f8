package com.zplat.ipld.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

/**
 * Payload of the {@code task_progress} event. Every snapshot is the full state of the run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TaskProgressResponse {
    List<String> result;    // "'host': 'status'"
    double percent;
    String error;           // cumulative, null until a host fails
}
