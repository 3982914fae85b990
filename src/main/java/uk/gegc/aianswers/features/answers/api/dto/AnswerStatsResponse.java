package uk.gegc.aianswers.features.answers.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.Instant;

@Schema(description = "Statistics derived from the user's answers")
public record AnswerStatsResponse(
        boolean success,

        @Schema(description = "Number of answered questions", example = "3")
        @JsonProperty("total_questions")
        int totalQuestions,

        @Schema(description = "Answers with non-blank text", example = "2")
        @JsonProperty("completed_questions")
        int completedQuestions,

        @Schema(description = "completed / total * 100, two decimals", example = "66.67")
        @JsonProperty("completion_percentage")
        BigDecimal completionPercentage,

        @JsonProperty("created_at")
        Instant createdAt,

        @JsonProperty("updated_at")
        Instant updatedAt
) {
}
