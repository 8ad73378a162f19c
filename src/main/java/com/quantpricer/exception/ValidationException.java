package com.quantpricer.exception;

import java.util.Map;

/**
 * Raised when an instrument, curve or request is malformed at construction time:
 * mismatched curve arrays, non-positive payment frequency, empty payment schedule.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
