package com.quantpricer.api.dto.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class HistoricalVolatilityResponse {

    /** Annualized volatility as a decimal. */
    private double volatility;

    private int observations;
    private int periodsPerYear;
}
