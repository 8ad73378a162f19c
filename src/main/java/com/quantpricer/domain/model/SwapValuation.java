package com.quantpricer.domain.model;

import com.quantpricer.domain.vo.SwapCashflow;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Leg values, par rate and value of a fixed-rate-payer swap at one valuation time. */
@Value
@Builder
public class SwapValuation {

    double valuationTime;
    double fixedRate;
    double fixedLegValue;
    double floatingLegValue;
    double swapRate;

    /** floatingLegValue - fixedLegValue. */
    double value;

    List<SwapCashflow> fixedLegCashflows;
}
