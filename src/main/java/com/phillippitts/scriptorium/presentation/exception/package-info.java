/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>Reservation conflict, stale version, illegal status transition → 409 Conflict</li>
 *   <li>Caller's own reservation expired → 408 Request Timeout</li>
 *   <li>Self-review, editing without a reservation, submitting another's version → 403 Forbidden</li>
 *   <li>Rate limit → 429 Too Many Requests with {@code Retry-After}</li>
 *   <li>Malformed input, nothing to undo or redo → 400 Bad Request</li>
 *   <li>Unknown transcription → 404 Not Found</li>
 *   <li>Missing {@code X-User-ID} → 401 Unauthorized</li>
 *   <li>OCR or store unavailable → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "error_code": "StaleVersionException",
 *   "message": "The transcription changed since you loaded it",
 *   "details": "This transcription has been superseded (asset=42, expected=3, active=4)",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.scriptorium.exception
 */
package com.phillippitts.scriptorium.presentation.exception;
