package com.phillippitts.scriptorium.config.ocr;

import com.phillippitts.scriptorium.service.ocr.DisabledOcrEngine;
import com.phillippitts.scriptorium.service.ocr.OcrEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OCR engine wiring. Deployments supply their own {@link OcrEngine} bean; without one,
 * OCR requests fail with 503.
 */
@Configuration
public class OcrConfig {

    private static final Logger LOG = LogManager.getLogger(OcrConfig.class);

    @Bean
    @ConditionalOnMissingBean(OcrEngine.class)
    public OcrEngine ocrEngine() {
        LOG.info("No OCR engine configured; OCR requests will be refused");
        return new DisabledOcrEngine();
    }
}
