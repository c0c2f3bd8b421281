package com.trellissystems.mailbox.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a {@link com.trellissystems.mailbox.MailManager}.
 */
public class MailManagerConfig {
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(1);

    private Duration refreshInterval;

    public MailManagerConfig() {
        this.refreshInterval = DEFAULT_REFRESH_INTERVAL;
    }

    /**
     * Sets the pause between two collect/send rounds of the execution loop.
     *
     * @param refreshInterval a positive duration
     * @return This MailManagerConfig instance
     */
    public MailManagerConfig setRefreshInterval(Duration refreshInterval) {
        Objects.requireNonNull(refreshInterval, "refreshInterval cannot be null");
        if (refreshInterval.isNegative() || refreshInterval.isZero()) {
            throw new IllegalArgumentException("Refresh interval must be positive: " + refreshInterval);
        }
        this.refreshInterval = refreshInterval;
        return this;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }
}
