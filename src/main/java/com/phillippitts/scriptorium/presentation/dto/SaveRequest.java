package com.phillippitts.scriptorium.presentation.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Body of a save request.
 *
 * @param text       full transcription text; empty marks "nothing to transcribe"
 * @param supersedes id of the version the editor started from, or {@code null}
 */
public record SaveRequest(
        @NotNull(message = "text is required") String text,
        Long supersedes
) {
}
