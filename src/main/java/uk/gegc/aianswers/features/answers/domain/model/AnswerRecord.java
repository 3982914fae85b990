package uk.gegc.aianswers.features.answers.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The per-user answer document.
 *
 * <p>{@code totalQuestions} is never held as state; it is always the size of the
 * current {@code answers} map.
 */
public record AnswerRecord(
        String userId,
        Map<String, String> answers,
        Instant createdAt,
        Instant updatedAt
) {

    public AnswerRecord {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (updatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("updatedAt must not precede createdAt");
        }
        answers = answers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    }

    public int totalQuestions() {
        return answers.size();
    }

    /**
     * Right-biased union of {@code incoming} into {@code current}.
     *
     * @param current  the record as last read from the store, or {@code null} when none exists
     * @param incoming the partial map to apply; its entries win on shared keys
     * @param now      the time of this write
     */
    public static AnswerRecord merge(String userId, AnswerRecord current, Map<String, String> incoming, Instant now) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (current != null) {
            merged.putAll(current.answers());
        }
        merged.putAll(incoming);

        if (current == null) {
            return new AnswerRecord(userId, merged, now, now);
        }
        // keep updatedAt non-decreasing when this node's clock lags the last writer's
        Instant updatedAt = now.isBefore(current.updatedAt()) ? current.updatedAt() : now;
        return new AnswerRecord(userId, merged, current.createdAt(), updatedAt);
    }
}
