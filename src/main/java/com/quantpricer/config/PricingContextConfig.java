package com.quantpricer.config;

import com.quantpricer.curve.TermStructure;
import com.quantpricer.curve.TermStructureSnapshotStore;
import com.quantpricer.service.PricingContext;
import java.time.Instant;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Builds the single {@link PricingContext} the application prices against.
 *
 * <p>The curve is loaded once at startup from the snapshot named by
 * {@code quantpricer.curve.snapshot-location}; a missing or unreadable snapshot fails
 * startup. Picking up a refreshed snapshot means building a new context.
 */
@Configuration
public class PricingContextConfig {

    @Bean
    public PricingContext pricingContext(
            TermStructureSnapshotStore snapshotStore,
            ResourceLoader resourceLoader,
            @Value("${quantpricer.curve.snapshot-location:classpath:data/yield_curve.csv}") String snapshotLocation) {
        TermStructure curve = snapshotStore.load(resourceLoader.getResource(snapshotLocation));
        return PricingContext.builder()
                .curve(curve)
                .curveSource(snapshotLocation)
                .loadedAt(Instant.now())
                .build();
    }
}
