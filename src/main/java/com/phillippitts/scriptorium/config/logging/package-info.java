/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Structured logging uses Log4j2 with MDC for request correlation.
 * {@link com.phillippitts.scriptorium.config.logging.MdcFilter} injects {@code requestId},
 * {@code userId} and {@code assetId} for every HTTP request; service code adds {@code assetId}
 * around mutations that do not arrive over HTTP.
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [thread-name] [requestId] [userId] [assetId] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.scriptorium.config.logging;
