package com.quantpricer.domain.vo;

import lombok.Value;

/**
 * One remaining fixed-leg payment of a swap as seen from the valuation time: payment time,
 * accrual fraction, undiscounted amount, the discount factor over {@code time - t} and the
 * present value.
 */
@Value
public class SwapCashflow {

    double time;
    double accrual;
    double amount;
    double discountFactor;
    double presentValue;
}
