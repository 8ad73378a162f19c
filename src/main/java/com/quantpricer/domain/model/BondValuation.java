package com.quantpricer.domain.model;

import com.quantpricer.domain.vo.Cashflow;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BondValuation {

    double valuationTime;
    double price;
    double duration;
    double convexity;
    List<Cashflow> cashflows;
}
