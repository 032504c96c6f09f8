package com.zplat.ipld.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only copy of an LPAR row, held for the duration of one run.
 */
@Value
@Builder
public class LparSnapshot {
    Long id;
    String lpar;
    String hostname;
    String username;
    String dataset;
    Boolean enabled;
    String schedule;

    /** First DNS label of the hostname, used for remote workspace and local results directory names. */
    public String shortName() {
        int dot = hostname.indexOf('.');
        return dot > 0 ? hostname.substring(0, dot) : hostname;
    }
}
