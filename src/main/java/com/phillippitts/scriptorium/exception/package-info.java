/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.scriptorium.exception.ScriptoriumException}
 * and are unchecked. Each maps to one HTTP status in
 * {@code com.phillippitts.scriptorium.presentation.exception.GlobalExceptionHandler}:
 * <ul>
 *   <li>{@link com.phillippitts.scriptorium.exception.ReservationConflictException},
 *       {@link com.phillippitts.scriptorium.exception.StaleVersionException},
 *       {@link com.phillippitts.scriptorium.exception.IllegalTransitionException} - 409</li>
 *   <li>{@link com.phillippitts.scriptorium.exception.LeaseExpiredException} - 408</li>
 *   <li>{@link com.phillippitts.scriptorium.exception.NotAuthorizedException} - 403</li>
 *   <li>{@link com.phillippitts.scriptorium.exception.RateLimitedException} - 429</li>
 *   <li>{@link com.phillippitts.scriptorium.exception.InvalidTranscriptionException},
 *       {@link com.phillippitts.scriptorium.exception.HistoryUnavailableException} - 400</li>
 *   <li>{@link com.phillippitts.scriptorium.exception.UnknownVersionException} - 404</li>
 *   <li>{@link com.phillippitts.scriptorium.exception.StoreUnavailableException},
 *       {@link com.phillippitts.scriptorium.exception.OcrUnavailableException} - 503</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.scriptorium.exception;
