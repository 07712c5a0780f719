package com.phillippitts.scriptorium.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the editing client that drives reservation renewals over HTTP.
 */
@ConfigurationProperties(prefix = "scriptorium.client")
@Validated
public class ClientProperties {

    /** Base URL of the reservation endpoints. */
    @NotBlank
    private String baseUrl = "http://localhost:8080";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
}
