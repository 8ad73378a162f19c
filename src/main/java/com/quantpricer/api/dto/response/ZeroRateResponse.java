package com.quantpricer.api.dto.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ZeroRateResponse {

    private double maturity;
    private double zeroRate;
    private double discountFactor;
}
