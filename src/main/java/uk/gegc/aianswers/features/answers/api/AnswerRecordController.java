package uk.gegc.aianswers.features.answers.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.aianswers.features.answers.api.dto.AnswerStatsResponse;
import uk.gegc.aianswers.features.answers.api.dto.AnswersResponse;
import uk.gegc.aianswers.features.answers.api.dto.MessageResponse;
import uk.gegc.aianswers.features.answers.api.dto.SaveAnswersRequest;
import uk.gegc.aianswers.features.answers.api.dto.UpdateAnswerRequest;
import uk.gegc.aianswers.features.answers.application.AnswerRecordService;
import uk.gegc.aianswers.features.answers.domain.model.AnswerRecord;
import uk.gegc.aianswers.features.answers.infra.mapping.AnswerRecordMapper;
import uk.gegc.aianswers.shared.exception.UnauthorizedException;

import java.util.Map;

@Tag(name = "AI Answers", description = "Per-user answers to the AI onboarding questions")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/ai-answers")
@RequiredArgsConstructor
public class AnswerRecordController {

    private final AnswerRecordService answerRecordService;
    private final AnswersPayloadValidator payloadValidator;
    private final AnswerRecordMapper mapper;

    private String resolveUserId(Authentication authentication) {
        if (authentication == null || authentication.getName() == null || authentication.getName().isBlank()) {
            throw new UnauthorizedException("Authentication is required to access this resource");
        }
        return authentication.getName();
    }

    @Operation(
            summary = "Save answers",
            description = "Merges the submitted answers into the user's record. Existing questions are " +
                    "overwritten, new ones are added, and questions not mentioned are kept."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answers saved",
                    content = @Content(schema = @Schema(implementation = AnswersResponse.class))),
            @ApiResponse(responseCode = "400", description = "Empty answer map, blank question id or non-string answer",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid ID token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Store unavailable or too much contention",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<AnswersResponse> saveAnswers(
            Authentication authentication,
            @Valid @RequestBody SaveAnswersRequest request
    ) {
        String userId = resolveUserId(authentication);
        Map<String, String> answers = payloadValidator.toAnswerMap(request.answers());
        AnswerRecord record = answerRecordService.saveAnswers(userId, answers);
        return ResponseEntity.ok(mapper.toResponse(record, "AI answers saved successfully"));
    }

    @Operation(summary = "Get answers", description = "Returns the user's full answer record.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer record",
                    content = @Content(schema = @Schema(implementation = AnswersResponse.class))),
            @ApiResponse(responseCode = "404", description = "No answers saved yet",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<AnswersResponse> getAnswers(Authentication authentication) {
        AnswerRecord record = answerRecordService.getAnswers(resolveUserId(authentication));
        return ResponseEntity.ok(mapper.toResponse(record, "AI answers retrieved successfully"));
    }

    @Operation(summary = "Delete answers", description = "Removes the user's record. Succeeds even when none exists.")
    @ApiResponse(responseCode = "200", description = "Record removed or already absent")
    @DeleteMapping
    public ResponseEntity<MessageResponse> deleteAnswers(Authentication authentication) {
        answerRecordService.deleteAnswers(resolveUserId(authentication));
        return ResponseEntity.ok(new MessageResponse(true, "AI answers deleted successfully"));
    }

    @Operation(
            summary = "Update a single answer",
            description = "Sets the answer for one question, creating the record if the user has none."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer updated",
                    content = @Content(schema = @Schema(implementation = AnswersResponse.class))),
            @ApiResponse(responseCode = "400", description = "Blank question id or missing answer",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/{questionId}")
    public ResponseEntity<AnswersResponse> updateSingleAnswer(
            Authentication authentication,
            @Parameter(description = "Question id", example = "3") @PathVariable String questionId,
            @Valid @RequestBody UpdateAnswerRequest request
    ) {
        String userId = resolveUserId(authentication);
        AnswerRecord record = answerRecordService.updateSingleAnswer(userId, questionId, request.answer());
        return ResponseEntity.ok(mapper.toResponse(record, "Answer for question " + questionId + " updated successfully"));
    }

    @Operation(summary = "Get answer statistics", description = "Counts derived from the live answer map.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics",
                    content = @Content(schema = @Schema(implementation = AnswerStatsResponse.class))),
            @ApiResponse(responseCode = "404", description = "No answers saved yet",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/stats")
    public ResponseEntity<AnswerStatsResponse> getStats(Authentication authentication) {
        return ResponseEntity.ok(mapper.toStatsResponse(answerRecordService.getStats(resolveUserId(authentication))));
    }
}
