package com.phillippitts.scriptorium.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the save/submit/review workflow.
 */
@ConfigurationProperties(prefix = "scriptorium.review")
@Validated
public class ReviewProperties {

    /** Maximum accepts a single reviewer may record within {@link #window}. */
    @Positive(message = "Accepts per window must be positive")
    private int acceptsPerWindow = 10;

    @NotNull
    private Duration window = Duration.ofMinutes(1);

    /** Reject saves whose text contains URLs. */
    private boolean rejectUrls = true;

    public int getAcceptsPerWindow() {
        return acceptsPerWindow;
    }

    public void setAcceptsPerWindow(int acceptsPerWindow) {
        this.acceptsPerWindow = acceptsPerWindow;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public boolean isRejectUrls() {
        return rejectUrls;
    }

    public void setRejectUrls(boolean rejectUrls) {
        this.rejectUrls = rejectUrls;
    }
}
