package com.quantpricer.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes returned in {@code error.code} of an {@link com.quantpricer.api.dto.response.ApiErrorResponse}.
 * The code string is the constant name.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Input failed validation"),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "Request could not be read"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "No such endpoint"),
    DOMAIN_ERROR(HttpStatus.UNPROCESSABLE_ENTITY, "Inputs are outside the pricing model's domain"),
    SNAPSHOT_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Curve snapshot could not be read or written"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected server error");

    private final HttpStatus httpStatus;
    private final String description;

    public String getCode() {
        return name();
    }

    public boolean isServerError() {
        return httpStatus.is5xxServerError();
    }
}
