package com.quantpricer.api.dto.response;

import com.quantpricer.exception.BaseException;
import com.quantpricer.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Error body: {@code {success: false, error: {code, status, message, details, timestamp, path}}}.
 * {@code details} names the offending inputs, e.g. {@code {"strike": -5.0}} or the failing
 * request fields.
 */
@Value
public class ApiErrorResponse {

    boolean success = false;
    ErrorDetail error;

    public static ApiErrorResponse of(BaseException ex, String path) {
        return of(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), path);
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus().value())
                .message(message != null ? message : errorCode.getDescription())
                .details(details != null ? details : Map.of())
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Value
    @Builder
    public static class ErrorDetail {
        String code;
        int status;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
