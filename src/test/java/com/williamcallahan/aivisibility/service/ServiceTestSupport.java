package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.config.AppProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Settings and clocks shared by service tests.
 */
final class ServiceTestSupport {

    private ServiceTestSupport() {}

    static AppProperties fastProperties() {
        AppProperties appProperties = new AppProperties();
        appProperties.getAnalysis().setMaxRetries(2);
        appProperties.getAnalysis().setRetryBaseDelay(Duration.ZERO);
        appProperties.getAnalysis().setPageAttemptTimeout(Duration.ofSeconds(5));
        appProperties.getAnalysis().setSinglePageTimeout(Duration.ofSeconds(5));
        return appProperties;
    }

    /**
     * Clock that only moves when told to.
     */
    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
