package uk.gegc.aianswers.features.answers.infra.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AnswerRecordDocumentRepository extends JpaRepository<AnswerRecordDocument, String> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM AnswerRecordDocument d WHERE d.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}
