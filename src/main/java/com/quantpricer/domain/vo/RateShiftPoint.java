package com.quantpricer.domain.vo;

import lombok.Value;

/** Bond price after moving every zero rate up by {@code shift} (decimal, 0.01 = 100bp). */
@Value
public class RateShiftPoint {

    double shift;
    double price;
}
