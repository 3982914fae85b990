package uk.gegc.aianswers.features.answers.infra.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row per user. The answer map is held as a single JSON document so that it and
 * {@code totalQuestions} are always written together.
 */
@Entity
@Getter
@Setter
@Table(name = "ai_answers")
public class AnswerRecordDocument {

    @Id
    @Column(name = "user_id", length = 128, updatable = false, nullable = false)
    private String userId;

    @Convert(converter = AnswersMapConverter.class)
    @Column(name = "answers", nullable = false, length = 1_000_000)
    private Map<String, String> answers = new LinkedHashMap<>();

    @Column(name = "total_questions", nullable = false)
    private Integer totalQuestions;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
