package com.phillippitts.scriptorium.presentation.controller;

import com.phillippitts.scriptorium.domain.ReservationResult;
import com.phillippitts.scriptorium.presentation.dto.ReservationResponse;
import com.phillippitts.scriptorium.service.reservation.ReservationManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Reserve, renew and release the right to edit an asset.
 *
 * <p>{@code POST /reservation} both acquires and renews; clients call it on page load and on
 * every keep-alive tick. Answers 200 when granted, 409 when another editor holds the asset and
 * 408 when the caller's own reservation lapsed and must be re-acquired.
 */
@RestController
@RequestMapping("/api/assets/{assetId}")
class ReservationController {

    private final ReservationManager reservations;

    ReservationController(ReservationManager reservations) {
        this.reservations = reservations;
    }

    @PostMapping("/reservation")
    ResponseEntity<ReservationResponse> reserve(@PathVariable String assetId,
                                                @RequestHeader(ApiHeaders.USER_ID) String userId) {
        ReservationResult result = reservations.reserve(assetId, userId);
        HttpStatus status = switch (result.status()) {
            case GRANTED -> HttpStatus.OK;
            case CONFLICT -> HttpStatus.CONFLICT;
            case EXPIRED -> HttpStatus.REQUEST_TIMEOUT;
        };
        return ResponseEntity.status(status).body(ReservationResponse.from(result));
    }

    @DeleteMapping("/reservation")
    ResponseEntity<Map<String, Object>> release(@PathVariable String assetId,
                                                @RequestHeader(ApiHeaders.USER_ID) String userId) {
        boolean released = reservations.release(assetId, userId);
        return ResponseEntity.ok(Map.of("released", released));
    }

    /**
     * POST alias of release for page-unload beacons, which cannot send DELETE.
     */
    @PostMapping("/release")
    ResponseEntity<Map<String, Object>> releaseBeacon(@PathVariable String assetId,
                                                      @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return release(assetId, userId);
    }
}
