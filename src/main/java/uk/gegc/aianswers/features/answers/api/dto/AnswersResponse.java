package uk.gegc.aianswers.features.answers.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A user's answer record")
public record AnswersResponse(
        @Schema(description = "Always true on success")
        boolean success,

        @Schema(description = "Human readable outcome", example = "AI answers saved successfully")
        String message,

        @Schema(description = "Every answer currently held for the user")
        Map<String, String> answers,

        @Schema(description = "Number of answered questions", example = "2")
        @JsonProperty("total_questions")
        Integer totalQuestions,

        @Schema(description = "When the record was first created")
        @JsonProperty("saved_at")
        Instant savedAt,

        @Schema(description = "When the record was last written")
        @JsonProperty("updated_at")
        Instant updatedAt
) {
}
