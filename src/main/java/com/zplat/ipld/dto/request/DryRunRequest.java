package com.zplat.ipld.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class DryRunRequest {
    @NotBlank(message = "hostname is required")
    String hostname;
    @NotBlank(message = "username is required")
    String username;
    @NotBlank(message = "dataset is required")
    String dataset;     // log dataset qualifier
}
