package com.quantpricer.exception;

import java.util.Map;

/**
 * Raised when pricing inputs are well-formed but degenerate for the model, e.g. zero
 * volatility or a non-positive spot, where the closed form would divide by zero or
 * take the log of a non-positive number.
 */
public class PricingDomainException extends BaseException {

    public PricingDomainException(String message) {
        super(ErrorCode.DOMAIN_ERROR, message);
    }

    public PricingDomainException(String message, Map<String, Object> details) {
        super(ErrorCode.DOMAIN_ERROR, message, details);
    }
}
