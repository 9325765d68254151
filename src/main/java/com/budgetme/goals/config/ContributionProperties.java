package com.budgetme.goals.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "budgetme.contributions")
public record ContributionProperties(
        Boolean atomicProcedureEnabled,
        Boolean fallbackEnabled,
        Duration sessionTtl,
        Duration streamTimeout
) {
    public ContributionProperties {
        if (atomicProcedureEnabled == null) {
            atomicProcedureEnabled = Boolean.TRUE;
        }
        if (fallbackEnabled == null) {
            fallbackEnabled = Boolean.TRUE;
        }
        if (sessionTtl == null) {
            sessionTtl = Duration.ofMinutes(30);
        }
        if (streamTimeout == null) {
            streamTimeout = Duration.ofMinutes(30);
        }
    }

    public static ContributionProperties defaults() {
        return new ContributionProperties(null, null, null, null);
    }
}
