package com.quantpricer.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quantpricer.domain.enums.OptionType;
import com.quantpricer.domain.model.Option;
import com.quantpricer.exception.ErrorCode;
import com.quantpricer.exception.PricingDomainException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OptionTest {

    @Test
    @DisplayName("Call payoff is max(S - K, 0)")
    void callPayoff() {
        Option call = Option.call(100, 1);

        assertThat(call.payoff(120)).isEqualTo(20.0);
        assertThat(call.payoff(100)).isEqualTo(0.0);
        assertThat(call.payoff(80)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Put payoff is max(K - S, 0)")
    void putPayoff() {
        Option put = Option.put(100, 1);

        assertThat(put.payoff(80)).isEqualTo(20.0);
        assertThat(put.payoff(120)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Rejects non-positive strike or maturity with a domain error")
    void rejectsDegenerateTerms() {
        assertThatThrownBy(() -> Option.call(0, 1))
                .isInstanceOf(PricingDomainException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.DOMAIN_ERROR);
        assertThatThrownBy(() -> Option.put(100, 0)).isInstanceOf(PricingDomainException.class);
        assertThatThrownBy(() -> new Option(null, 100, 1)).isInstanceOf(PricingDomainException.class);
    }

    @Test
    @DisplayName("withMaturity keeps type and strike")
    void withMaturity() {
        Option rolled = Option.put(95, 1).withMaturity(0.5);

        assertThat(rolled.getType()).isEqualTo(OptionType.PUT);
        assertThat(rolled.getStrike()).isEqualTo(95.0);
        assertThat(rolled.getMaturity()).isEqualTo(0.5);
    }
}
