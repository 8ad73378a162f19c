package com.quantpricer.curve;

import lombok.Value;

/**
 * The curve read at one maturity: zero rate, discount factor, and the continuously
 * compounded forward rate over the period since the previous node (since 0 for the first).
 */
@Value
public class CurveNode {

    double maturity;
    double zeroRate;
    double discountFactor;
    double forwardRate;
}
