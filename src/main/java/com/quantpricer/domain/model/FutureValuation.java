package com.quantpricer.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Fair price of a future and, when a valuation time and spot are given, the
 * mark-to-market of each side. The position values are null otherwise.
 */
@Value
@Builder
public class FutureValuation {

    EquityFuture future;
    double price;
    Double valuationTime;
    Double spotAtValuation;
    Double longValue;
    Double shortValue;
}
