package uk.gegc.aianswers.features.answers.infra.persistence;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aianswers.features.answers.config.AnswerStoreProperties;
import uk.gegc.aianswers.features.answers.domain.model.AnswerRecord;
import uk.gegc.aianswers.features.answers.domain.model.StoredAnswerRecord;
import uk.gegc.aianswers.features.answers.domain.store.StoreConflictException;
import uk.gegc.aianswers.features.answers.infra.mapping.AnswerRecordMapper;
import uk.gegc.aianswers.shared.exception.StoreUnavailableException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import({JpaAnswerRecordStore.class, AnswerRecordMapper.class, AnswerStoreProperties.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaAnswerRecordStoreTest {

    private static final Instant T0 = Instant.parse("2025-05-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2025-05-01T10:10:00Z");

    @Autowired
    private JpaAnswerRecordStore store;

    @Autowired
    private AnswerRecordDocumentRepository repository;

    @AfterEach
    void cleanUp() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("find returns empty for an unknown user")
    void find_unknownUser() {
        assertThat(store.find("nobody")).isEmpty();
    }

    @Test
    @DisplayName("a created record reads back with its answers, timestamps and a version")
    void put_createThenFind() {
        Map<String, String> answers = new LinkedHashMap<>();
        answers.put("1", "I value honesty");
        answers.put("2", "");
        answers.put("3", "Wandern, lesen, été");

        StoredAnswerRecord created = store.put(new AnswerRecord("u1", answers, T0, T0), null);

        Optional<StoredAnswerRecord> found = store.find("u1");
        assertThat(found).isPresent();
        assertThat(found.get().version()).isEqualTo(created.version());
        AnswerRecord record = found.get().record();
        assertThat(record.answers()).isEqualTo(answers);
        assertThat(record.totalQuestions()).isEqualTo(3);
        assertThat(record.createdAt()).isEqualTo(T0);
        assertThat(record.updatedAt()).isEqualTo(T0);
        assertThat(repository.findById("u1")).hasValueSatisfying(row ->
                assertThat(row.getTotalQuestions()).isEqualTo(3));
    }

    @Test
    @DisplayName("a second create for the same user is a conflict")
    void put_createTwice() {
        store.put(new AnswerRecord("u1", Map.of("a", "1"), T0, T0), null);

        assertThatThrownBy(() -> store.put(new AnswerRecord("u1", Map.of("b", "2"), T0, T0), null))
                .isInstanceOf(StoreConflictException.class);
        assertThat(store.find("u1").orElseThrow().record().answers()).containsOnlyKeys("a");
    }

    @Test
    @DisplayName("a replacement at the current version bumps the version")
    void put_replaceAtCurrentVersion() {
        StoredAnswerRecord created = store.put(new AnswerRecord("u1", Map.of("a", "1"), T0, T0), null);

        StoredAnswerRecord replaced = store.put(
                new AnswerRecord("u1", Map.of("a", "1", "b", "2"), T0, T1), created.version());

        assertThat(replaced.version()).isGreaterThan(created.version());
        AnswerRecord record = store.find("u1").orElseThrow().record();
        assertThat(record.answers()).containsOnlyKeys("a", "b");
        assertThat(record.createdAt()).isEqualTo(T0);
        assertThat(record.updatedAt()).isEqualTo(T1);
    }

    @Test
    @DisplayName("a replacement at a stale version is a conflict and changes nothing")
    void put_replaceAtStaleVersion() {
        StoredAnswerRecord created = store.put(new AnswerRecord("u1", Map.of("a", "1"), T0, T0), null);
        store.put(new AnswerRecord("u1", Map.of("a", "2"), T0, T1), created.version());

        assertThatThrownBy(() -> store.put(new AnswerRecord("u1", Map.of("a", "stale"), T0, T1), created.version()))
                .isInstanceOf(StoreConflictException.class);
        assertThat(store.find("u1").orElseThrow().record().answers()).containsEntry("a", "2");
    }

    @Test
    @DisplayName("a replacement of a deleted record is a conflict")
    void put_replaceAfterDelete() {
        StoredAnswerRecord created = store.put(new AnswerRecord("u1", Map.of("a", "1"), T0, T0), null);
        store.delete("u1");

        assertThatThrownBy(() -> store.put(new AnswerRecord("u1", Map.of("a", "2"), T0, T1), created.version()))
                .isInstanceOf(StoreConflictException.class);
        assertThat(store.find("u1")).isEmpty();
    }

    @Test
    @DisplayName("delete is a no-op for an unknown user and leaves other users alone")
    void delete_onlyTouchesOwnRow() {
        store.put(new AnswerRecord("u1", Map.of("a", "1"), T0, T0), null);
        store.put(new AnswerRecord("u2", Map.of("a", "1"), T0, T0), null);

        assertThat(store.delete("u1")).isTrue();
        assertThat(store.delete("u1")).isFalse();
        assertThat(store.delete("nobody")).isFalse();

        assertThat(store.find("u1")).isEmpty();
        assertThat(store.find("u2")).isPresent();
    }

    @Test
    @DisplayName("a document too large for its column fails as unavailable, not as a conflict")
    void put_oversizedDocumentIsNotAConflict() {
        AnswerRecord oversized = new AnswerRecord("u-big", Map.of("1", "x".repeat(1_100_000)), T0, T0);

        assertThatThrownBy(() -> store.put(oversized, null))
                .isInstanceOf(StoreUnavailableException.class)
                .isNotInstanceOf(StoreConflictException.class)
                .hasMessage("Answer store is temporarily unavailable");
        assertThat(store.find("u-big")).isEmpty();
    }

    @Test
    @DisplayName("an oversized replacement leaves the stored document untouched")
    void put_oversizedReplacement() {
        StoredAnswerRecord created = store.put(new AnswerRecord("u1", Map.of("a", "1"), T0, T0), null);
        AnswerRecord oversized = new AnswerRecord("u1", Map.of("a", "x".repeat(1_100_000)), T0, T1);

        assertThatThrownBy(() -> store.put(oversized, created.version()))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(store.find("u1")).hasValueSatisfying(stored -> {
            assertThat(stored.version()).isEqualTo(created.version());
            assertThat(stored.record().answers()).containsEntry("a", "1");
        });
    }
}
