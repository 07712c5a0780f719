package com.phillippitts.scriptorium.service.health;

import com.phillippitts.scriptorium.config.properties.OcrProperties;
import com.phillippitts.scriptorium.service.ocr.OcrEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the OCR engine.
 *
 * <p>OCR is optional, so a disabled engine reports UP with {@code enabled=false}. An enabled
 * but unhealthy engine reports DOWN.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class OcrEngineHealthIndicator implements HealthIndicator {

    private final OcrEngine engine;
    private final OcrProperties props;

    public OcrEngineHealthIndicator(OcrEngine engine, OcrProperties props) {
        this.engine = engine;
        this.props = props;
    }

    @Override
    public Health health() {
        if (!props.isEnabled()) {
            return Health.up()
                    .withDetail("enabled", false)
                    .withDetail("engine", engine.getEngineName())
                    .build();
        }
        Health.Builder builder = engine.isHealthy() ? Health.up() : Health.down();
        return builder
                .withDetail("enabled", true)
                .withDetail("engine", engine.getEngineName())
                .build();
    }
}
