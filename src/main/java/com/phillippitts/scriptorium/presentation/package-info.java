/**
 * Presentation layer (REST API controllers, DTOs and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.dto} - request and response records</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.scriptorium.presentation.exception
 */
package com.phillippitts.scriptorium.presentation;
