package com.quantpricer.api.dto.response;

import com.quantpricer.curve.CurvePoint;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * The curve the service is pricing against, with rates as decimals.
 */
@Data
@Builder
public class CurveResponse {

    private List<CurvePoint> points;

    /** Snapshot location the curve was loaded from. */
    private String source;

    private Instant loadedAt;
}
