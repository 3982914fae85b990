package uk.gegc.aianswers.features.answers.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.answers")
public class AnswerStoreProperties {

    /**
     * How many read-merge-write rounds a save may run before giving up under contention.
     */
    @Min(value = 1, message = "At least one merge attempt is required")
    private int maxMergeAttempts = 5;

    /**
     * Longest accepted answer text, in characters.
     */
    @Min(value = 1, message = "Answer length limit must be positive")
    private int maxAnswerLength = 4_000;

    /**
     * Most answers one user's record may hold. Together with {@link #maxAnswerLength} this keeps
     * the serialized document inside the {@code answers} column.
     */
    @Min(value = 1, message = "Question limit must be positive")
    private int maxQuestions = 100;

    /**
     * Upper bound for a single store transaction.
     */
    @NotNull(message = "Store timeout must be configured")
    private Duration storeTimeout = Duration.ofSeconds(5);
}
