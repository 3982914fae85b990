package uk.gegc.aianswers.features.answers.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "New text for a single answer")
public record UpdateAnswerRequest(
        @Schema(description = "Answer text, may be empty", example = "Honesty and trust")
        @NotNull(message = "Answer is required")
        String answer
) {
}
