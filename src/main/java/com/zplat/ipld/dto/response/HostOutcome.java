package com.zplat.ipld.dto.response;

import lombok.Value;

/**
 * Terminal value of one host workflow: the hostname on success, {@code "ERROR: <reason>"} otherwise.
 */
@Value
public class HostOutcome {
    String hostname;
    String result;

    public static HostOutcome success(String hostname) {
        return new HostOutcome(hostname, hostname);
    }

    public static HostOutcome failure(String hostname, String reason) {
        return new HostOutcome(hostname, "ERROR: " + reason);
    }

    public boolean isSuccess() {
        return !result.startsWith("ERROR");
    }
}
