package com.quantpricer.api.controller;

import static java.util.Objects.requireNonNullElse;

import com.quantpricer.api.dto.request.BondPricingRequest;
import com.quantpricer.api.dto.request.FuturePricingRequest;
import com.quantpricer.api.dto.request.ImpliedVolatilityRequest;
import com.quantpricer.api.dto.request.OptionPricingRequest;
import com.quantpricer.api.dto.request.SwapPricingRequest;
import com.quantpricer.api.dto.response.ImpliedVolatilityResponse;
import com.quantpricer.domain.model.BondValuation;
import com.quantpricer.domain.model.FutureValuation;
import com.quantpricer.domain.model.ImpliedVolatility;
import com.quantpricer.domain.model.MarketParameters;
import com.quantpricer.domain.model.OptionValuation;
import com.quantpricer.domain.model.SwapValuation;
import com.quantpricer.mapper.PricingDtoMapper;
import com.quantpricer.service.PricingContext;
import com.quantpricer.service.PricingService;
import jakarta.validation.Valid;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for valuing single instruments against the loaded curve.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/pricing/options -- price and Greeks, analytic or Monte Carlo</li>
 *   <li>POST /api/pricing/options/implied-volatility -- volatility implied by a market price</li>
 *   <li>POST /api/pricing/bonds -- price, duration, convexity and cashflows</li>
 *   <li>POST /api/pricing/swaps -- leg values, par rate and swap value</li>
 *   <li>POST /api/pricing/futures -- forward price and optional position values</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/pricing")
public class PricingController {

    private final PricingService pricingService;
    private final PricingContext pricingContext;
    private final PricingDtoMapper pricingDtoMapper = Mappers.getMapper(PricingDtoMapper.class);

    public PricingController(PricingService pricingService, PricingContext pricingContext) {
        this.pricingService = pricingService;
        this.pricingContext = pricingContext;
    }

    @PostMapping("/options")
    public ResponseEntity<OptionValuation> priceOption(@RequestBody @Valid OptionPricingRequest request) {
        OptionValuation valuation = pricingService.valueOption(
                pricingDtoMapper.toOption(request),
                pricingDtoMapper.toMarket(request, pricingContext),
                request.getModel(),
                request.getPaths(),
                request.getSeed());
        return ResponseEntity.ok(valuation);
    }

    @PostMapping("/options/implied-volatility")
    public ResponseEntity<ImpliedVolatilityResponse> impliedVolatility(
            @RequestBody @Valid ImpliedVolatilityRequest request) {
        MarketParameters market = pricingDtoMapper.toMarket(request, pricingContext);
        ImpliedVolatility iv =
                pricingService.impliedVolatility(pricingDtoMapper.toOption(request), request.getMarketPrice(), market);
        return ResponseEntity.ok(ImpliedVolatilityResponse.builder()
                .available(iv.isAvailable())
                .volatility(iv.isAvailable() ? iv.getVolatility() : null)
                .evaluations(iv.getEvaluations())
                .marketPrice(request.getMarketPrice())
                .rate(market.getRate())
                .build());
    }

    @PostMapping("/bonds")
    public ResponseEntity<BondValuation> priceBond(@RequestBody @Valid BondPricingRequest request) {
        BondValuation valuation = pricingService.valueBond(
                pricingDtoMapper.toBond(request),
                requireNonNullElse(request.getValuationTime(), 0.0),
                pricingContext);
        return ResponseEntity.ok(valuation);
    }

    @PostMapping("/swaps")
    public ResponseEntity<SwapValuation> priceSwap(@RequestBody @Valid SwapPricingRequest request) {
        SwapValuation valuation = pricingService.valueSwap(
                pricingDtoMapper.toSwap(request, pricingContext),
                requireNonNullElse(request.getValuationTime(), 0.0),
                pricingContext);
        return ResponseEntity.ok(valuation);
    }

    @PostMapping("/futures")
    public ResponseEntity<FutureValuation> priceFuture(@RequestBody @Valid FuturePricingRequest request) {
        FutureValuation valuation = pricingService.valueFuture(
                pricingDtoMapper.toFuture(request, pricingContext),
                request.getValuationTime(),
                request.getSpotAtValuation(),
                pricingContext);
        return ResponseEntity.ok(valuation);
    }
}
