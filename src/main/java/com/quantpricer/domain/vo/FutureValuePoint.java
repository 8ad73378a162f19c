package com.quantpricer.domain.vo;

import lombok.Value;

@Value
public class FutureValuePoint {

    double spot;
    double longValue;
    double shortValue;
}
