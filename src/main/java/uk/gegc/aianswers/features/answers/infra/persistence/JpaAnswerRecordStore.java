package uk.gegc.aianswers.features.answers.infra.persistence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.aianswers.features.answers.config.AnswerStoreProperties;
import uk.gegc.aianswers.features.answers.domain.model.AnswerRecord;
import uk.gegc.aianswers.features.answers.domain.model.StoredAnswerRecord;
import uk.gegc.aianswers.features.answers.domain.store.AnswerRecordStore;
import uk.gegc.aianswers.features.answers.domain.store.StoreConflictException;
import uk.gegc.aianswers.features.answers.infra.mapping.AnswerRecordMapper;
import uk.gegc.aianswers.shared.exception.StoreUnavailableException;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link AnswerRecordStore} on a relational table, one row per user.
 *
 * <p>Creates rely on the primary key to reject a second concurrent insert; replacements rely
 * on the {@code version} column. Both surface as {@link StoreConflictException}. Any other
 * integrity violation, such as a value too long for its column, is not retryable and is
 * reported as {@link StoreUnavailableException}.
 * Every call runs in its own transaction bounded by {@code app.answers.store-timeout}.
 */
@Slf4j
@Component
public class JpaAnswerRecordStore implements AnswerRecordStore {

    private final AnswerRecordDocumentRepository repository;
    private final AnswerRecordMapper mapper;
    private final TransactionTemplate readTransaction;
    private final TransactionTemplate writeTransaction;

    public JpaAnswerRecordStore(AnswerRecordDocumentRepository repository,
                                AnswerRecordMapper mapper,
                                PlatformTransactionManager transactionManager,
                                AnswerStoreProperties properties) {
        this.repository = repository;
        this.mapper = mapper;
        int timeoutSeconds = toTimeoutSeconds(properties.getStoreTimeout());

        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
        this.readTransaction.setTimeout(timeoutSeconds);

        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setTimeout(timeoutSeconds);
    }

    @Override
    public Optional<StoredAnswerRecord> find(String userId) {
        return execute(readTransaction, status -> repository.findById(userId).map(mapper::toStored));
    }

    @Override
    public StoredAnswerRecord put(AnswerRecord record, Long expectedVersion) {
        try {
            return writeTransaction.execute(status -> expectedVersion == null
                    ? insert(record)
                    : replace(record, expectedVersion));
        } catch (OptimisticLockingFailureException ex) {
            throw new StoreConflictException(record.userId(), expectedVersion, ex);
        } catch (DataIntegrityViolationException ex) {
            // only a create that lost the primary key race is contention; anything else fails the same way on retry
            if (expectedVersion == null && rowExists(record.userId())) {
                throw new StoreConflictException(record.userId(), null, ex);
            }
            throw unavailable("put", record.userId(), ex);
        } catch (DataAccessException | TransactionException ex) {
            throw unavailable("put", record.userId(), ex);
        }
    }

    @Override
    public boolean delete(String userId) {
        int removed = execute(writeTransaction, status -> repository.deleteByUserId(userId));
        return removed > 0;
    }

    private boolean rowExists(String userId) {
        return Boolean.TRUE.equals(execute(readTransaction, status -> repository.existsById(userId)));
    }

    private StoredAnswerRecord insert(AnswerRecord record) {
        if (repository.existsById(record.userId())) {
            throw new StoreConflictException(record.userId(), null);
        }
        AnswerRecordDocument saved = repository.saveAndFlush(mapper.toNewDocument(record));
        return mapper.toStored(saved);
    }

    private StoredAnswerRecord replace(AnswerRecord record, long expectedVersion) {
        AnswerRecordDocument document = repository.findById(record.userId())
                .orElseThrow(() -> new StoreConflictException(record.userId(), expectedVersion));
        if (!Objects.equals(document.getVersion(), expectedVersion)) {
            throw new StoreConflictException(record.userId(), expectedVersion);
        }
        mapper.applyReplacement(document, record);
        AnswerRecordDocument saved = repository.saveAndFlush(document);
        return mapper.toStored(saved);
    }

    private <T> T execute(TransactionTemplate template, TransactionCallback<T> callback) {
        try {
            return template.execute(callback);
        } catch (DataAccessException | TransactionException ex) {
            throw unavailable("access", null, ex);
        }
    }

    private StoreUnavailableException unavailable(String operation, String userId, Exception cause) {
        log.error("Answer store {} failed{}: {}", operation,
                userId != null ? " for user " + userId : "", cause.getMessage(), cause);
        return new StoreUnavailableException("Answer store is temporarily unavailable", cause);
    }

    private static int toTimeoutSeconds(Duration timeout) {
        long millis = timeout.toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
