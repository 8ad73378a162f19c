package com.quantpricer.curve;

import lombok.Value;

/**
 * A single knot of a zero curve: maturity in years and the annualized, continuously
 * compounded zero rate as a decimal (0.0325 = 3.25%).
 */
@Value
public class CurvePoint {

    double maturity;
    double rate;
}
