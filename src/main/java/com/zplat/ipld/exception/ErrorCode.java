package com.zplat.ipld.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

@Getter
public enum ErrorCode {
    UNCATEGORIZED_EXCEPTION(9999, "Uncategorized error", HttpStatus.INTERNAL_SERVER_ERROR),
    INVALID_KEY(1001, "Uncategorized error", HttpStatus.BAD_REQUEST),
    LPAR_NOT_EXISTED(1002, "LPAR not existed", HttpStatus.NOT_FOUND),
    INVALID_SCHEDULE_TIME(1003, "Schedule time must be HH:MM or HH:MM:SS", HttpStatus.BAD_REQUEST),
    INVALID_DAY_OF_WEEK(1004, "Unknown day of week", HttpStatus.BAD_REQUEST),
    INVALID_SCHEDULE_SPEC(1005, "Schedule must be '[weekday] HH:MM'", HttpStatus.BAD_REQUEST),
    INVALID_REPORT_VIEW(1006, "Report view must be one of done, fail, last_ipl", HttpStatus.BAD_REQUEST),
    CREDENTIAL_NOT_FOUND(1010, "No private key found for user", HttpStatus.NOT_FOUND),
    PRIVATE_KEY_WRITE_ERROR(1011, "Cannot write private key file", HttpStatus.INTERNAL_SERVER_ERROR),
    SSH_CONNECTION_ERROR(1012, "SSH connection failed", HttpStatus.BAD_GATEWAY),
    SSH_AUTH_ERROR(1013, "SSH authentication failed", HttpStatus.BAD_GATEWAY),
    SSH_COMMAND_ERROR(1014, "Remote command failed", HttpStatus.BAD_GATEWAY),
    NETWORK_POLICY_ERROR(1020, "Network policy API call failed", HttpStatus.BAD_GATEWAY),
    INGEST_READ_ERROR(1030, "Cannot read results directory", HttpStatus.INTERNAL_SERVER_ERROR),
    ;

    ErrorCode(int code, String message, HttpStatusCode statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    private final int code;
    private final String message;
    private final HttpStatusCode statusCode;
}
