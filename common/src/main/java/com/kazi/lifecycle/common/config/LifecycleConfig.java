package com.kazi.lifecycle.common.config;

import com.kazi.lifecycle.common.codec.DateOrderValidator;
import com.kazi.lifecycle.common.codec.OfferDetailsCodec;
import com.kazi.lifecycle.common.lifecycle.ApplicationLifecycleService;
import com.kazi.lifecycle.common.time.Clock;
import com.kazi.lifecycle.common.time.SystemClock;
import com.kazi.lifecycle.common.transition.StatusTransitionAuthority;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
public class LifecycleConfig {

    @Bean
    public StatusTransitionAuthority statusTransitionAuthority() {
        return new StatusTransitionAuthority();
    }

    @Bean
    public DateOrderValidator dateOrderValidator() {
        return new DateOrderValidator();
    }

    @Bean
    public OfferDetailsCodec offerDetailsCodec() {
        return new OfferDetailsCodec();
    }

    @Bean
    public Clock lifecycleClock(@Value("${tracker.lifecycle.zone:UTC}") String zone) {
        return new SystemClock(ZoneId.of(zone));
    }

    @Bean
    public ApplicationLifecycleService applicationLifecycleService(
            StatusTransitionAuthority authority,
            DateOrderValidator dateOrderValidator,
            OfferDetailsCodec offerDetailsCodec,
            Clock clock,
            @Value("${tracker.lifecycle.auto-stamp-dates:false}") boolean autoStampDates
    ) {
        return new ApplicationLifecycleService(
                authority, dateOrderValidator, offerDetailsCodec, clock, autoStampDates);
    }
}
