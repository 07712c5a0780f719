package com.phillippitts.scriptorium.presentation.controller;

import com.phillippitts.scriptorium.domain.ReviewAction;
import com.phillippitts.scriptorium.exception.InvalidTranscriptionException;
import com.phillippitts.scriptorium.presentation.dto.ReviewRequest;
import com.phillippitts.scriptorium.presentation.dto.TranscriptionResponse;
import com.phillippitts.scriptorium.service.review.TranscriptionWorkflow;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Accept or reject a submitted transcription. Reviewers need no reservation.
 */
@RestController
class ReviewController {

    private final TranscriptionWorkflow workflow;

    ReviewController(TranscriptionWorkflow workflow) {
        this.workflow = workflow;
    }

    @PatchMapping("/api/transcriptions/{versionId}/review")
    ResponseEntity<TranscriptionResponse> review(@PathVariable long versionId,
                                                 @RequestHeader(ApiHeaders.USER_ID) String userId,
                                                 @Valid @RequestBody ReviewRequest request) {
        ReviewAction action = ReviewAction.fromWire(request.action())
                .orElseThrow(() -> new InvalidTranscriptionException("Unknown review action: " + request.action()));
        return ResponseEntity.ok(TranscriptionResponse.from(workflow.review(versionId, userId, action)));
    }
}
