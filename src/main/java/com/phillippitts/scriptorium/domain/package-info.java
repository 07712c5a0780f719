/**
 * Domain records for asset reservations and transcription review.
 *
 * <p>Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.scriptorium.domain.Lease} - time-bounded exclusive edit right on one asset</li>
 *   <li>{@link com.phillippitts.scriptorium.domain.TranscriptionVersion} - immutable text snapshot linked
 *       to the version it supersedes</li>
 *   <li>{@link com.phillippitts.scriptorium.domain.TranscriptionStatus} - review lifecycle of an asset</li>
 * </ul>
 *
 * <p>All records validate in their compact constructors and carry no persistence annotations.
 */
package com.phillippitts.scriptorium.domain;
