package com.phillippitts.scriptorium.presentation.controller;

import com.phillippitts.scriptorium.presentation.dto.AssetResponse;
import com.phillippitts.scriptorium.presentation.dto.OcrRequest;
import com.phillippitts.scriptorium.presentation.dto.SaveRequest;
import com.phillippitts.scriptorium.presentation.dto.TranscriptionResponse;
import com.phillippitts.scriptorium.presentation.dto.VersionResponse;
import com.phillippitts.scriptorium.service.chain.TranscriptionChain;
import com.phillippitts.scriptorium.service.ocr.OcrTranscriptionService;
import com.phillippitts.scriptorium.service.review.TranscriptionWorkflow;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Editing endpoints: save, submit, undo, redo, OCR, and the read-only views of assets and versions.
 */
@RestController
class TranscriptionController {

    private final TranscriptionWorkflow workflow;
    private final OcrTranscriptionService ocr;
    private final TranscriptionChain chain;

    TranscriptionController(TranscriptionWorkflow workflow, OcrTranscriptionService ocr, TranscriptionChain chain) {
        this.workflow = workflow;
        this.ocr = ocr;
        this.chain = chain;
    }

    @PostMapping("/api/assets/{assetId}/transcriptions")
    ResponseEntity<TranscriptionResponse> save(@PathVariable String assetId,
                                               @RequestHeader(ApiHeaders.USER_ID) String userId,
                                               @Valid @RequestBody SaveRequest request) {
        return ResponseEntity.ok(TranscriptionResponse.from(
                workflow.save(assetId, request.text(), request.supersedes(), userId)));
    }

    @PostMapping("/api/transcriptions/{versionId}/submit")
    ResponseEntity<TranscriptionResponse> submit(@PathVariable long versionId,
                                                 @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(TranscriptionResponse.from(workflow.submit(versionId, userId)));
    }

    @PostMapping("/api/assets/{assetId}/rollback")
    ResponseEntity<TranscriptionResponse> rollback(@PathVariable String assetId,
                                                   @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(TranscriptionResponse.from(workflow.rollback(assetId, userId)));
    }

    @PostMapping("/api/assets/{assetId}/rollforward")
    ResponseEntity<TranscriptionResponse> rollforward(@PathVariable String assetId,
                                                      @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(TranscriptionResponse.from(workflow.rollforward(assetId, userId)));
    }

    @PostMapping("/api/assets/{assetId}/ocr")
    ResponseEntity<TranscriptionResponse> ocr(@PathVariable String assetId,
                                              @RequestHeader(ApiHeaders.USER_ID) String userId,
                                              @RequestBody(required = false) OcrRequest request) {
        String language = request == null ? null : request.language();
        Long supersedes = request == null ? null : request.supersedes();
        return ResponseEntity.ok(TranscriptionResponse.from(ocr.transcribe(assetId, language, supersedes, userId)));
    }

    @GetMapping("/api/assets/{assetId}")
    ResponseEntity<AssetResponse> asset(@PathVariable String assetId,
                                        @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId) {
        return ResponseEntity.ok(AssetResponse.from(workflow.describe(assetId, userId)));
    }

    /** Versions reachable from the active one, most recent first. */
    @GetMapping("/api/assets/{assetId}/transcriptions")
    ResponseEntity<List<VersionResponse>> history(@PathVariable String assetId) {
        List<VersionResponse> versions = new ArrayList<>();
        chain.history(assetId).forEach(v -> versions.add(VersionResponse.from(v)));
        return ResponseEntity.ok(versions);
    }

    @GetMapping("/api/transcriptions/{versionId}")
    ResponseEntity<VersionResponse> version(@PathVariable long versionId) {
        return ResponseEntity.ok(VersionResponse.from(chain.get(versionId)));
    }
}
