package com.phillippitts.scriptorium.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for OCR-assisted transcription.
 */
@ConfigurationProperties(prefix = "scriptorium.ocr")
@Validated
public class OcrProperties {

    private boolean enabled = false;

    /** OCR calls allowed per asset within {@link #window}. */
    @Positive(message = "OCR calls per window must be positive")
    private int callsPerWindow = 1;

    @NotNull
    private Duration window = Duration.ofMinutes(1);

    /** Language passed to the engine when the request does not name one. */
    @NotBlank
    private String defaultLanguage = "eng";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getCallsPerWindow() {
        return callsPerWindow;
    }

    public void setCallsPerWindow(int callsPerWindow) {
        this.callsPerWindow = callsPerWindow;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }
}
