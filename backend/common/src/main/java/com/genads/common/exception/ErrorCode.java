package com.genads.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "Internal server error"),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "Invalid request"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C005", "Not found"),

    // Store
    STORE_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, "S001", "Database not available"),

    // User
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "U003", "Invalid credentials"),
    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "U004", "Email already registered"),

    // Video job
    VIDEO_JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "V006", "Not found"),
    INVALID_VIDEO_JOB_ID(HttpStatus.BAD_REQUEST, "V007", "Invalid id"),

    // Upload
    INVALID_UPLOAD(HttpStatus.BAD_REQUEST, "F001", "Invalid upload"),
    UPLOAD_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "F002", "Failed to store uploaded file");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
