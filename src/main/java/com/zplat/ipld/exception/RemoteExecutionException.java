package com.zplat.ipld.exception;

import lombok.Getter;

/**
 * Transport failure of a single ssh/scp invocation.
 * {@code exitCode} is -1 when the local process could not be started or timed out.
 */
@Getter
public class RemoteExecutionException extends AppException {

    private final String host;
    private final int exitCode;

    public RemoteExecutionException(ErrorCode errorCode, String host, int exitCode, String detail) {
        super(errorCode, host + " (exit=" + exitCode + "): " + detail);
        this.host = host;
        this.exitCode = exitCode;
    }

    public RemoteExecutionException(ErrorCode errorCode, String host, String detail, Throwable cause) {
        super(errorCode, host + ": " + detail, cause);
        this.host = host;
        this.exitCode = -1;
    }
}
