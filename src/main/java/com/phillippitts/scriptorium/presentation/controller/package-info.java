/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints (all identify the caller through the {@code X-User-ID} header):
 * <ul>
 *   <li>{@link com.phillippitts.scriptorium.presentation.controller.ReservationController}
 *       - {@code POST|DELETE /api/assets/{id}/reservation}, {@code POST /api/assets/{id}/release}</li>
 *   <li>{@link com.phillippitts.scriptorium.presentation.controller.TranscriptionController}
 *       - save, submit, rollback, rollforward, OCR and read-only views</li>
 *   <li>{@link com.phillippitts.scriptorium.presentation.controller.ReviewController}
 *       - {@code PATCH /api/transcriptions/{id}/review}</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they translate requests, delegate to the service layer and let
 * {@code GlobalExceptionHandler} map domain exceptions to status codes.
 */
package com.phillippitts.scriptorium.presentation.controller;
