package com.quantpricer.domain.vo;

import lombok.Value;

/**
 * A scheduled payment: time in years from today and the amount paid.
 */
@Value
public class Cashflow {

    double time;
    double amount;
}
