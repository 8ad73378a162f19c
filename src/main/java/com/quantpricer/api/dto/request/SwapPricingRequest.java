package com.quantpricer.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwapPricingRequest {

    @NotNull(message = "Notional is required")
    @Positive(message = "Notional must be positive")
    private Double notional;

    /** Fixed rate as a decimal. When absent the swap is struck at the par rate. */
    private Double fixedRate;

    /** Payment times in years, strictly increasing. */
    @NotEmpty(message = "At least one payment time is required")
    private List<Double> paymentTimes;

    @PositiveOrZero(message = "Valuation time must not be negative")
    private Double valuationTime;
}
