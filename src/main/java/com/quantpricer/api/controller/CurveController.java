package com.quantpricer.api.controller;

import com.quantpricer.api.dto.response.CurveResponse;
import com.quantpricer.api.dto.response.ZeroRateResponse;
import com.quantpricer.curve.CurveNode;
import com.quantpricer.curve.TermStructure;
import com.quantpricer.curve.TermStructureSnapshotStore;
import com.quantpricer.service.PricingContext;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the curve the service prices against.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/curve -- curve knots, source and load time</li>
 *   <li>GET /api/curve/zero-rate?t= -- interpolated zero rate and discount factor</li>
 *   <li>GET /api/curve/term-structure?step= -- zero rate, discount factor and forward rate at
 *       each knot, or every {@code step} years</li>
 *   <li>GET /api/curve/shifted?rateShift=&amp;timeShift= -- the curve after a rate and/or time shift</li>
 *   <li>GET /api/curve/snapshot -- the loaded curve as snapshot CSV (rates in percent)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/curve")
public class CurveController {

    private final PricingContext pricingContext;
    private final TermStructureSnapshotStore snapshotStore;

    public CurveController(PricingContext pricingContext, TermStructureSnapshotStore snapshotStore) {
        this.pricingContext = pricingContext;
        this.snapshotStore = snapshotStore;
    }

    @GetMapping
    public ResponseEntity<CurveResponse> getCurve() {
        return ResponseEntity.ok(CurveResponse.builder()
                .points(pricingContext.getCurve().points())
                .source(pricingContext.getCurveSource())
                .loadedAt(pricingContext.getLoadedAt())
                .build());
    }

    @GetMapping("/zero-rate")
    public ResponseEntity<ZeroRateResponse> getZeroRate(@RequestParam("t") double maturity) {
        TermStructure curve = pricingContext.getCurve();
        return ResponseEntity.ok(ZeroRateResponse.builder()
                .maturity(maturity)
                .zeroRate(curve.zeroRate(maturity))
                .discountFactor(curve.discountFactor(maturity))
                .build());
    }

    @GetMapping("/term-structure")
    public ResponseEntity<List<CurveNode>> getTermStructure(
            @RequestParam(name = "step", required = false) Double step) {
        TermStructure curve = pricingContext.getCurve();
        return ResponseEntity.ok(step == null ? curve.nodes() : curve.nodes(step));
    }

    /**
     * The loaded curve with every rate reduced by {@code rateShift}, then translated along the
     * time axis by {@code timeShift}. The loaded curve itself is not changed.
     */
    @GetMapping("/shifted")
    public ResponseEntity<CurveResponse> getShiftedCurve(
            @RequestParam(defaultValue = "0") double rateShift, @RequestParam(defaultValue = "0") double timeShift) {
        TermStructure shifted = pricingContext.getCurve().shiftRate(rateShift);
        // shiftTime keeps knots strictly before the last maturity, so a zero shift is skipped
        if (timeShift != 0.0) {
            shifted = shifted.shiftTime(timeShift);
        }
        return ResponseEntity.ok(CurveResponse.builder()
                .points(shifted.points())
                .source(pricingContext.getCurveSource())
                .loadedAt(pricingContext.getLoadedAt())
                .build());
    }

    @GetMapping(value = "/snapshot", produces = "text/csv")
    public ResponseEntity<String> exportSnapshot() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"yield_curve.csv\"")
                .body(snapshotStore.toCsv(pricingContext.getCurve()));
    }
}
