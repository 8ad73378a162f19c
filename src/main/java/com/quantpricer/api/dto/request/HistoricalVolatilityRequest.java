package com.quantpricer.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalVolatilityRequest {

    /** Closing prices, oldest first. */
    @NotNull(message = "Closing prices are required")
    @Size(min = 3, message = "At least three closing prices are needed")
    private List<@NotNull(message = "Closing prices must not contain nulls") Double> closes;

    /** Defaults to 252 trading days. */
    @Min(value = 1, message = "Periods per year must be positive")
    private Integer periodsPerYear;
}
