package com.phillippitts.scriptorium.presentation;

import com.phillippitts.scriptorium.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end checks of the editing and review endpoints over HTTP, including the JSON field naming
 * and status codes clients depend on.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class WorkflowApiIntegrationTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        MutableClock testClock() {
            return MutableClock.startingAt("2026-03-01T10:00:00Z");
        }
    }

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private MutableClock clock;

    private String assetId;

    @BeforeEach
    void setUp() {
        // HttpURLConnection cannot send PATCH
        restTemplate.getRestTemplate().setRequestFactory(new JdkClientHttpRequestFactory());
        assetId = "asset-" + UUID.randomUUID();
    }

    @Test
    void reservationIsExclusiveUntilReleased() {
        ResponseEntity<Map> alice = post("/api/assets/" + assetId + "/reservation", "alice", null);
        ResponseEntity<Map> bob = post("/api/assets/" + assetId + "/reservation", "bob", null);

        assertThat(alice.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(alice.getBody()).containsEntry("status", "granted").containsEntry("holder", "alice");
        assertThat(alice.getBody()).containsKey("expires_at");
        assertThat(bob.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(bob.getBody()).containsEntry("status", "conflict");

        ResponseEntity<Map> released = exchange(HttpMethod.DELETE,
                "/api/assets/" + assetId + "/reservation", "alice", null);
        assertThat(released.getBody()).containsEntry("released", true);

        assertThat(post("/api/assets/" + assetId + "/reservation", "bob", null).getStatusCode())
                .isEqualTo(HttpStatus.OK);
    }

    @Test
    void lapsedReservationAnswers408Once() {
        post("/api/assets/" + assetId + "/reservation", "alice", null);
        clock.advance(Duration.ofMinutes(6));

        ResponseEntity<Map> lapsed = post("/api/assets/" + assetId + "/reservation", "alice", null);
        ResponseEntity<Map> again = post("/api/assets/" + assetId + "/reservation", "alice", null);

        assertThat(lapsed.getStatusCode()).isEqualTo(HttpStatus.REQUEST_TIMEOUT);
        assertThat(again.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void saveSubmitAndAcceptCompletesAsset() {
        post("/api/assets/" + assetId + "/reservation", "alice", null);

        ResponseEntity<Map> saved = post("/api/assets/" + assetId + "/transcriptions", "alice",
                Map.of("text", "Dear Sir, I write to inform you"));
        assertThat(saved.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(saved.getBody()).containsEntry("status", "in_progress")
                .containsEntry("undo_available", false)
                .containsEntry("ocr_generated", false);
        long versionId = ((Number) saved.getBody().get("version_id")).longValue();
        assertThat(saved.getBody()).containsEntry("submit_url", "/api/transcriptions/" + versionId + "/submit");

        ResponseEntity<Map> submitted = post("/api/transcriptions/" + versionId + "/submit", "alice", null);
        assertThat(submitted.getBody()).containsEntry("status", "submitted");

        ResponseEntity<Map> selfReview = exchange(HttpMethod.PATCH,
                "/api/transcriptions/" + versionId + "/review", "alice", Map.of("action", "accept"));
        assertThat(selfReview.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);

        ResponseEntity<Map> accepted = exchange(HttpMethod.PATCH,
                "/api/transcriptions/" + versionId + "/review", "carol", Map.of("action", "accept"));
        assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(accepted.getBody()).containsEntry("status", "completed");

        ResponseEntity<Map> asset = exchange(HttpMethod.GET, "/api/assets/" + assetId, "alice", null);
        assertThat(asset.getBody()).containsEntry("status", "completed");

        // Accepting releases the author's reservation
        assertThat(post("/api/assets/" + assetId + "/reservation", "bob", null).getStatusCode())
                .isEqualTo(HttpStatus.OK);
    }

    @Test
    void staleSaveIsRejectedWith409() {
        post("/api/assets/" + assetId + "/reservation", "alice", null);
        long first = versionId(post("/api/assets/" + assetId + "/transcriptions", "alice", Map.of("text", "one")));
        post("/api/assets/" + assetId + "/transcriptions", "alice", Map.of("text", "two", "supersedes", first));

        ResponseEntity<Map> stale = post("/api/assets/" + assetId + "/transcriptions", "alice",
                Map.of("text", "three", "supersedes", first));

        assertThat(stale.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(stale.getBody()).containsEntry("error_code", "StaleVersionException");
    }

    @Test
    void undoReturnsPreviousVersionAndHistoryListsNewestFirst() {
        post("/api/assets/" + assetId + "/reservation", "alice", null);
        long first = versionId(post("/api/assets/" + assetId + "/transcriptions", "alice", Map.of("text", "one")));
        long second = versionId(post("/api/assets/" + assetId + "/transcriptions", "alice",
                Map.of("text", "two", "supersedes", first)));

        ResponseEntity<List> history = restTemplate.getForEntity("/api/assets/" + assetId + "/transcriptions",
                List.class);
        assertThat(history.getBody()).hasSize(2);
        assertThat(((Number) ((Map<?, ?>) history.getBody().get(0)).get("version_id")).longValue()).isEqualTo(second);

        ResponseEntity<Map> undone = post("/api/assets/" + assetId + "/rollback", "alice", null);
        assertThat(versionId(undone)).isEqualTo(first);
        assertThat(undone.getBody()).containsEntry("redo_available", true);

        ResponseEntity<Map> redone = post("/api/assets/" + assetId + "/rollforward", "alice", null);
        assertThat(versionId(redone)).isEqualTo(second);
    }

    @Test
    void saveWithoutReservationIsForbidden() {
        ResponseEntity<Map> response = post("/api/assets/" + assetId + "/transcriptions", "mallory",
                Map.of("text", "sneaky"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void missingIdentityHeaderIsUnauthenticated() {
        ResponseEntity<Map> response = exchange(HttpMethod.DELETE,
                "/api/assets/" + assetId + "/reservation", null, null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody()).containsEntry("error_code", "Unauthenticated");
    }

    @Test
    void unknownReviewActionIsBadRequest() {
        ResponseEntity<Map> response = exchange(HttpMethod.PATCH, "/api/transcriptions/999999/review", "carol",
                Map.of("action", "approve"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void ocrWhenDisabledIsServiceUnavailable() {
        post("/api/assets/" + assetId + "/reservation", "alice", null);

        ResponseEntity<Map> response = post("/api/assets/" + assetId + "/ocr", "alice", null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    private static long versionId(ResponseEntity<Map> response) {
        return ((Number) response.getBody().get("version_id")).longValue();
    }

    private ResponseEntity<Map> post(String path, String userId, Object body) {
        return exchange(HttpMethod.POST, path, userId, body);
    }

    private ResponseEntity<Map> exchange(HttpMethod method, String path, String userId, Object body) {
        HttpHeaders headers = new HttpHeaders();
        if (userId != null) {
            headers.add("X-User-ID", userId);
        }
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        return restTemplate.exchange(path, method, new HttpEntity<>(body, headers), Map.class);
    }
}
