package com.zplat.ipld.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Row of the done or fail report. Duration columns are only filled for done rows.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@FieldDefaults(level = AccessLevel.PRIVATE)
public class IplResultResponse {
    Long id;
    String sysname;
    String iplDate;
    String logDataset;
    String preIpl;
    String shutdownBegin;
    String shutdownEnd;
    String iplBegin;
    String iplEnd;
    String posIpl;
    String shutdownDuration;
    String poweroffDuration;
    String loadIpl;
    String totalDuration;
}
