package com.phillippitts.scriptorium.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param action {@code accept} or {@code reject}
 */
public record ReviewRequest(@NotBlank(message = "action is required") String action) {
}
