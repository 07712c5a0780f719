package com.phillippitts.scriptorium.config;

import com.phillippitts.scriptorium.client.HttpReservationClient;
import com.phillippitts.scriptorium.client.ReservationClient;
import com.phillippitts.scriptorium.config.properties.ClientProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Wires the editing-client reservation library against {@code scriptorium.client.base-url}.
 */
@Configuration
public class ClientConfig {

    @Bean
    public ReservationClient reservationClient(RestClient.Builder builder, ClientProperties props) {
        return new HttpReservationClient(builder.baseUrl(props.getBaseUrl()).build());
    }
}
