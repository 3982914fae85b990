package uk.gegc.aianswers.features.answers.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerStatsTest {

    private static final Instant CREATED = Instant.parse("2025-01-10T08:00:00Z");
    private static final Instant UPDATED = Instant.parse("2025-01-12T09:30:00Z");

    @Test
    @DisplayName("blank answers count towards total but not completed")
    void countsCompletedSeparately() {
        AnswerRecord record = new AnswerRecord("u1", Map.of("1", "Honesty", "2", "  ", "3", "Hiking"), CREATED, UPDATED);

        AnswerStats stats = AnswerStats.of(record);

        assertThat(stats.totalQuestions()).isEqualTo(3);
        assertThat(stats.completedQuestions()).isEqualTo(2);
        assertThat(stats.completionPercentage()).isEqualByComparingTo(new BigDecimal("66.67"));
        assertThat(stats.createdAt()).isEqualTo(CREATED);
        assertThat(stats.updatedAt()).isEqualTo(UPDATED);
    }

    @Test
    @DisplayName("an empty map yields zero percent rather than dividing by zero")
    void emptyAnswers() {
        AnswerStats stats = AnswerStats.of(new AnswerRecord("u1", Map.of(), CREATED, CREATED));

        assertThat(stats.totalQuestions()).isZero();
        assertThat(stats.completionPercentage()).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
