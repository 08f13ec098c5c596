package com.dataops.loader.repository;

import com.dataops.loader.model.SourceFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for SourceFile entity
 */
@Repository
public interface SourceFileRepository extends JpaRepository<SourceFile, Long> {

    /**
     * Atomically move a file into PROCESSING for a new run.
     * Only one caller can win the claim; the others see 0 updated rows.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE SourceFile s
           SET s.status = :processing,
               s.runId = :runId,
               s.startedAt = :now,
               s.updatedAt = :now,
               s.attemptCount = s.attemptCount + 1,
               s.rowCount = NULL,
               s.rowsLoaded = 0,
               s.rowsRejected = 0,
               s.warningCount = 0,
               s.completedAt = NULL,
               s.processingDurationMs = NULL,
               s.errorMessage = NULL,
               s.errorDetails = NULL
         WHERE s.id = :id
           AND s.status IN :startable
    """)
    int claimForRun(@Param("id") Long id,
                    @Param("runId") UUID runId,
                    @Param("now") LocalDateTime now,
                    @Param("processing") SourceFile.Status processing,
                    @Param("startable") Collection<SourceFile.Status> startable);

    /**
     * Persist running counters for the run that currently owns the file.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE SourceFile s
           SET s.rowsLoaded = :loaded,
               s.rowsRejected = :rejected,
               s.warningCount = :warnings,
               s.updatedAt = :now
         WHERE s.id = :id
           AND s.runId = :runId
           AND s.status = :processing
    """)
    int updateProgress(@Param("id") Long id,
                       @Param("runId") UUID runId,
                       @Param("loaded") long loaded,
                       @Param("rejected") long rejected,
                       @Param("warnings") int warnings,
                       @Param("now") LocalDateTime now,
                       @Param("processing") SourceFile.Status processing);

    /**
     * Fail a run that is still PROCESSING under the given run id.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE SourceFile s
           SET s.status = :failed,
               s.errorMessage = :message,
               s.completedAt = :now,
               s.updatedAt = :now
         WHERE s.id = :id
           AND s.runId = :runId
           AND s.status = :processing
    """)
    int failAbandonedRun(@Param("id") Long id,
                         @Param("runId") UUID runId,
                         @Param("message") String message,
                         @Param("now") LocalDateTime now,
                         @Param("processing") SourceFile.Status processing,
                         @Param("failed") SourceFile.Status failed);

    List<SourceFile> findByStatusAndStartedAtBefore(SourceFile.Status status, LocalDateTime startedBefore);

    List<SourceFile> findByStatusOrderByUploadedAtDesc(SourceFile.Status status);

    long countByStatus(SourceFile.Status status);

    @Query("SELECT COALESCE(SUM(s.rowsLoaded), 0) FROM SourceFile s WHERE s.status = :status")
    long sumRowsLoadedByStatus(@Param("status") SourceFile.Status status);

    @Query("SELECT COALESCE(SUM(s.rowsRejected), 0) FROM SourceFile s WHERE s.status = :status")
    long sumRowsRejectedByStatus(@Param("status") SourceFile.Status status);
}
