package com.quantpricer.mapper;

import static java.util.Objects.requireNonNullElse;

import com.quantpricer.api.dto.request.BondPricingRequest;
import com.quantpricer.api.dto.request.FuturePricingRequest;
import com.quantpricer.api.dto.request.ImpliedVolatilityRequest;
import com.quantpricer.api.dto.request.OptionPayoffRequest;
import com.quantpricer.api.dto.request.OptionPricingRequest;
import com.quantpricer.api.dto.request.SwapPricingRequest;
import com.quantpricer.domain.model.CouponBond;
import com.quantpricer.domain.model.EquityFuture;
import com.quantpricer.domain.model.InterestRateSwap;
import com.quantpricer.domain.model.MarketParameters;
import com.quantpricer.domain.model.Option;
import com.quantpricer.service.PricingContext;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from pricing request DTOs to domain instruments and market state.
 *
 * <p>Used by the pricing and scenario controllers at the API boundary. Inputs the request
 * leaves out are filled here: a missing rate is read off the context's curve at the
 * instrument's maturity, missing yields default to zero, and a swap without a fixed rate is
 * struck at par. The domain constructors then enforce their own invariants.
 */
@Mapper
public interface PricingDtoMapper {

    Option toOption(OptionPricingRequest request);

    Option toOption(ImpliedVolatilityRequest request);

    Option toOption(OptionPayoffRequest request);

    @Mapping(target = "paymentFrequency", source = "paymentFrequency", defaultValue = "1")
    CouponBond toBond(BondPricingRequest request);

    default MarketParameters toMarket(OptionPricingRequest request, PricingContext context) {
        return MarketParameters.builder()
                .spot(request.getSpot())
                .rate(context.rateFor(request.getRate(), request.getMaturity()))
                .volatility(request.getVolatility())
                .dividendYield(requireNonNullElse(request.getDividendYield(), 0.0))
                .repoRate(requireNonNullElse(request.getRepoRate(), 0.0))
                .build();
    }

    // Volatility is left at zero: the solver supplies it
    default MarketParameters toMarket(ImpliedVolatilityRequest request, PricingContext context) {
        return MarketParameters.builder()
                .spot(request.getSpot())
                .rate(context.rateFor(request.getRate(), request.getMaturity()))
                .dividendYield(requireNonNullElse(request.getDividendYield(), 0.0))
                .repoRate(requireNonNullElse(request.getRepoRate(), 0.0))
                .build();
    }

    default EquityFuture toFuture(FuturePricingRequest request, PricingContext context) {
        return new EquityFuture(
                request.getSpot(),
                context.rateFor(request.getRate(), request.getMaturity()),
                requireNonNullElse(request.getDividendYield(), 0.0),
                request.getMaturity());
    }

    default InterestRateSwap toSwap(SwapPricingRequest request, PricingContext context) {
        if (request.getFixedRate() != null) {
            return new InterestRateSwap(request.getNotional(), request.getFixedRate(), request.getPaymentTimes());
        }
        double parRate = new InterestRateSwap(request.getNotional(), 0.0, request.getPaymentTimes())
                .swapRate(context.getCurve(), requireNonNullElse(request.getValuationTime(), 0.0));
        return new InterestRateSwap(request.getNotional(), parRate, request.getPaymentTimes());
    }
}
