package com.dataops.loader.repository;

import com.dataops.loader.model.DataError;
import com.dataops.loader.model.ErrorKind;
import com.dataops.loader.model.SourceFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data JPA repository for the error ledger
 */
@Repository
public interface DataErrorRepository extends JpaRepository<DataError, Long> {

    /**
     * Errors of one file in report order: row number, then insertion order within a row
     */
    List<DataError> findBySourceFileIdOrderByRowNumberAscIdAsc(Long sourceFileId);

    List<DataError> findBySourceFileIdAndErrorTypeOrderByRowNumberAscIdAsc(Long sourceFileId, ErrorKind errorType);

    long countBySourceFileId(Long sourceFileId);

    /**
     * Error counts grouped by kind: each element is {ErrorKind, Long}
     */
    @Query("""
        SELECT e.errorType, COUNT(e)
          FROM DataError e
         WHERE e.sourceFileId = :sourceFileId
         GROUP BY e.errorType
    """)
    List<Object[]> countByErrorType(@Param("sourceFileId") Long sourceFileId);

    @Query("SELECT COUNT(DISTINCT e.rowNumber) FROM DataError e WHERE e.sourceFileId = :sourceFileId")
    long countDistinctRows(@Param("sourceFileId") Long sourceFileId);

    /**
     * Remove every error of a file before it is reprocessed
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM DataError e WHERE e.sourceFileId = :sourceFileId")
    int deleteBySourceFileId(@Param("sourceFileId") Long sourceFileId);

    /**
     * Retention cleanup, limited to files in the given status
     */
    @Modifying
    @Query("""
        DELETE FROM DataError e
         WHERE e.createdAt < :cutoff
           AND e.sourceFileId IN (SELECT s.id FROM SourceFile s WHERE s.status = :status)
    """)
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff, @Param("status") SourceFile.Status status);
}
