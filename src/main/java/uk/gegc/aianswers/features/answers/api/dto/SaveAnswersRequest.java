package uk.gegc.aianswers.features.answers.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;

import java.util.Map;

/**
 * Values are left untyped so that non-string answers can be rejected with a field-level
 * message instead of being silently coerced.
 */
@Schema(description = "Partial answer map to merge into the user's record")
public record SaveAnswersRequest(
        @Schema(
                description = "Question id to answer text",
                example = "{\"1\": \"I value honesty and communication\", \"2\": \"Travel, hiking, reading\"}"
        )
        @NotEmpty(message = "Answers cannot be empty")
        Map<String, Object> answers
) {
}
