package com.quantpricer.api.dto.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RollDownResponse {

    private double horizon;

    /** Price today on the current curve. */
    private double price;

    /** Price at the horizon, curve shape unchanged. */
    private double rolledPrice;
}
