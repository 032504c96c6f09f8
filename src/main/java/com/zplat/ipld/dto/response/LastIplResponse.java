package com.zplat.ipld.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class LastIplResponse {
    Long id;
    String sysname;
    String logDataset;
    String lastIpl;
}
