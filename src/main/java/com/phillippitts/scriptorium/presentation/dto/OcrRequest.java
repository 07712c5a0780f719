package com.phillippitts.scriptorium.presentation.dto;

/**
 * @param language   engine language code, or {@code null} for the default
 * @param supersedes id of the version the editor is looking at, or {@code null}
 */
public record OcrRequest(String language, Long supersedes) {
}
