package com.quantpricer.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bond price ladder under parallel rate shifts. Either list the shifts explicitly or let the
 * server build an even grid from {@code -maxShift} to {@code +maxShift} (default +/-200bp,
 * 17 points).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLadderRequest {

    @Valid
    @NotNull(message = "Bond is required")
    private BondPricingRequest bond;

    /** Explicit shifts as decimals; takes precedence over the grid settings. */
    private List<@NotNull(message = "Shifts must not contain nulls") Double> shifts;

    @PositiveOrZero(message = "Maximum shift must not be negative")
    private Double maxShift;

    @Min(value = 2, message = "A shift grid needs at least two points")
    private Integer steps;
}
