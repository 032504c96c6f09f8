package com.zplat.ipld.dto.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TaskRunRequest {
    @NotEmpty(message = "lparIds must not be empty")
    List<Long> lparIds;
}
