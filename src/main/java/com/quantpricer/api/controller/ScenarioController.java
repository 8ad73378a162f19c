package com.quantpricer.api.controller;

import static java.util.Objects.requireNonNullElse;

import com.quantpricer.api.dto.request.FutureValueProfileRequest;
import com.quantpricer.api.dto.request.HistoricalVolatilityRequest;
import com.quantpricer.api.dto.request.OptionPayoffRequest;
import com.quantpricer.api.dto.request.RateLadderRequest;
import com.quantpricer.api.dto.request.RollDownRequest;
import com.quantpricer.api.dto.response.HistoricalVolatilityResponse;
import com.quantpricer.api.dto.response.RollDownResponse;
import com.quantpricer.domain.model.CouponBond;
import com.quantpricer.domain.model.EquityFuture;
import com.quantpricer.domain.vo.FutureValuePoint;
import com.quantpricer.domain.vo.PayoffPoint;
import com.quantpricer.domain.vo.RateShiftPoint;
import com.quantpricer.mapper.PricingDtoMapper;
import com.quantpricer.service.HistoricalVolatilityEstimator;
import com.quantpricer.service.PricingContext;
import com.quantpricer.service.ScenarioAnalysisService;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for what-if analysis.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/scenarios/bonds/rate-ladder -- bond price across parallel rate shifts</li>
 *   <li>POST /api/scenarios/bonds/roll-down -- bond price after time passes on an unchanged curve</li>
 *   <li>POST /api/scenarios/futures/value-profile -- long/short future values across spot levels</li>
 *   <li>POST /api/scenarios/options/payoff-profile -- option payoff at expiry across spot levels</li>
 *   <li>POST /api/scenarios/historical-volatility -- annualized volatility of a close series</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/scenarios")
public class ScenarioController {

    private static final double DEFAULT_MAX_SHIFT = 0.02;
    private static final int DEFAULT_SHIFT_STEPS = 17;
    private static final int DEFAULT_PAYOFF_POINTS = 200;

    private final ScenarioAnalysisService scenarioAnalysisService;
    private final HistoricalVolatilityEstimator historicalVolatilityEstimator;
    private final PricingContext pricingContext;
    private final PricingDtoMapper pricingDtoMapper = Mappers.getMapper(PricingDtoMapper.class);

    public ScenarioController(
            ScenarioAnalysisService scenarioAnalysisService,
            HistoricalVolatilityEstimator historicalVolatilityEstimator,
            PricingContext pricingContext) {
        this.scenarioAnalysisService = scenarioAnalysisService;
        this.historicalVolatilityEstimator = historicalVolatilityEstimator;
        this.pricingContext = pricingContext;
    }

    @PostMapping("/bonds/rate-ladder")
    public ResponseEntity<List<RateShiftPoint>> rateLadder(@RequestBody @Valid RateLadderRequest request) {
        List<Double> shifts = request.getShifts() != null && !request.getShifts().isEmpty()
                ? request.getShifts()
                : scenarioAnalysisService.symmetricShifts(
                        requireNonNullElse(request.getMaxShift(), DEFAULT_MAX_SHIFT),
                        requireNonNullElse(request.getSteps(), DEFAULT_SHIFT_STEPS));
        CouponBond bond = pricingDtoMapper.toBond(request.getBond());
        return ResponseEntity.ok(scenarioAnalysisService.bondRateLadder(bond, pricingContext, shifts));
    }

    @PostMapping("/bonds/roll-down")
    public ResponseEntity<RollDownResponse> rollDown(@RequestBody @Valid RollDownRequest request) {
        CouponBond bond = pricingDtoMapper.toBond(request.getBond());
        return ResponseEntity.ok(RollDownResponse.builder()
                .horizon(request.getHorizon())
                .price(bond.price(pricingContext.getCurve()))
                .rolledPrice(scenarioAnalysisService.rollDown(bond, pricingContext, request.getHorizon()))
                .build());
    }

    @PostMapping("/futures/value-profile")
    public ResponseEntity<List<FutureValuePoint>> futureValueProfile(
            @RequestBody @Valid FutureValueProfileRequest request) {
        EquityFuture future = pricingDtoMapper.toFuture(request.getFuture(), pricingContext);
        return ResponseEntity.ok(scenarioAnalysisService.futureValueProfile(
                future, request.getValuationTime(), request.getSpots(), pricingContext));
    }

    @PostMapping("/options/payoff-profile")
    public ResponseEntity<List<PayoffPoint>> optionPayoffProfile(@RequestBody @Valid OptionPayoffRequest request) {
        return ResponseEntity.ok(scenarioAnalysisService.optionPayoffProfile(
                pricingDtoMapper.toOption(request),
                request.getSpot(),
                requireNonNullElse(request.getPoints(), DEFAULT_PAYOFF_POINTS)));
    }

    @PostMapping("/historical-volatility")
    public ResponseEntity<HistoricalVolatilityResponse> historicalVolatility(
            @RequestBody @Valid HistoricalVolatilityRequest request) {
        int periodsPerYear =
                requireNonNullElse(request.getPeriodsPerYear(), HistoricalVolatilityEstimator.TRADING_DAYS_PER_YEAR);
        return ResponseEntity.ok(HistoricalVolatilityResponse.builder()
                .volatility(historicalVolatilityEstimator.estimate(request.getCloses(), periodsPerYear))
                .observations(request.getCloses().size())
                .periodsPerYear(periodsPerYear)
                .build());
    }
}
