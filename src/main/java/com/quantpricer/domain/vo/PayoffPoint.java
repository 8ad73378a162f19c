package com.quantpricer.domain.vo;

import lombok.Value;

@Value
public class PayoffPoint {

    double spot;
    double payoff;
}
