package com.daylock.accountability.config;

import com.daylock.engine.warning.WarningThresholds;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class AccountabilityConfig {

    @Value("${accountability.zone:UTC}")
    private String zone;

    // ── warning rule limits ──────────────────────────────────────────────────
    @Value("${accountability.warnings.consecutive-misses:3}")
    private int consecutiveMisses;

    @Value("${accountability.warnings.recent-window-days:14}")
    private int recentWindowDays;

    @Value("${accountability.warnings.min-recent-records:5}")
    private int minRecentRecords;

    @Value("${accountability.warnings.min-attendance-rate:50}")
    private int minAttendanceRate;

    @Value("${accountability.warnings.rejection-lookback:7}")
    private int rejectionLookback;

    @Value("${accountability.warnings.max-rejections:3}")
    private int maxRejections;

    @Value("${accountability.warnings.min-quality-average:2.0}")
    private double minQualityAverage;

    @Value("${accountability.warnings.inactivity-days:7}")
    private int inactivityDays;

    /** Wall clock in the rooms' zone; every "today" and "now" is read from here. */
    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public WarningThresholds warningThresholds() {
        return new WarningThresholds(consecutiveMisses, recentWindowDays, minRecentRecords,
            minAttendanceRate, rejectionLookback, maxRejections, minQualityAverage, inactivityDays);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
