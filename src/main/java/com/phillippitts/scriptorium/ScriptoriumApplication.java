package com.phillippitts.scriptorium;

import com.phillippitts.scriptorium.config.properties.ClientProperties;
import com.phillippitts.scriptorium.config.properties.OcrProperties;
import com.phillippitts.scriptorium.config.properties.ReservationProperties;
import com.phillippitts.scriptorium.config.properties.ReviewProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ReservationProperties.class,
        ReviewProperties.class,
        OcrProperties.class,
        ClientProperties.class
})
@EnableScheduling
public class ScriptoriumApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScriptoriumApplication.class, args);
    }
}
