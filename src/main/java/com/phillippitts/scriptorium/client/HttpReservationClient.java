package com.phillippitts.scriptorium.client;

import com.phillippitts.scriptorium.domain.ReservationStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

/**
 * {@link ReservationClient} over HTTP.
 *
 * <p>Status mapping for reserve: 200 GRANTED, 409 CONFLICT, 408 EXPIRED. Anything else, and any
 * I/O failure, is a {@link ReservationTransportException}.
 */
public class HttpReservationClient implements ReservationClient {

    static final String USER_ID_HEADER = "X-User-ID";
    static final String RESERVATION_PATH = "/api/assets/{assetId}/reservation";

    private final RestClient restClient;

    public HttpReservationClient(RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    public ReservationStatus reserve(String assetId, String holder) {
        HttpStatusCode status;
        try {
            status = restClient.post()
                    .uri(RESERVATION_PATH, assetId)
                    .header(USER_ID_HEADER, holder)
                    .exchange((request, response) -> response.getStatusCode());
        } catch (RestClientException e) {
            throw new ReservationTransportException("Reserve request for asset " + assetId + " failed", e);
        }
        if (status.value() == HttpStatus.OK.value()) {
            return ReservationStatus.GRANTED;
        }
        if (status.value() == HttpStatus.CONFLICT.value()) {
            return ReservationStatus.CONFLICT;
        }
        if (status.value() == HttpStatus.REQUEST_TIMEOUT.value()) {
            return ReservationStatus.EXPIRED;
        }
        throw new ReservationTransportException(
                "Unexpected status " + status.value() + " reserving asset " + assetId, status.value());
    }

    @Override
    public void release(String assetId, String holder) {
        HttpStatusCode status;
        try {
            status = restClient.delete()
                    .uri(RESERVATION_PATH, assetId)
                    .header(USER_ID_HEADER, holder)
                    .exchange((request, response) -> response.getStatusCode());
        } catch (RestClientException e) {
            throw new ReservationTransportException("Release request for asset " + assetId + " failed", e);
        }
        if (!status.is2xxSuccessful()) {
            throw new ReservationTransportException(
                    "Unexpected status " + status.value() + " releasing asset " + assetId, status.value());
        }
    }
}
