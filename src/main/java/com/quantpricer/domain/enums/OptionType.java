package com.quantpricer.domain.enums;

/**
 * Exercise variant of a European option. Payoff, price and delta dispatch on this tag.
 */
public enum OptionType {
    CALL,
    PUT
}
