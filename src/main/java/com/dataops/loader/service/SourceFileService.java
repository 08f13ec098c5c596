package com.dataops.loader.service;

import com.dataops.loader.dto.ProcessingStats;
import com.dataops.loader.exception.RunNotStartableException;
import com.dataops.loader.exception.UnknownTargetTableException;
import com.dataops.loader.model.FileType;
import com.dataops.loader.model.LoadResult;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.repository.DataErrorRepository;
import com.dataops.loader.repository.LoadResultRepository;
import com.dataops.loader.repository.SourceFileRepository;
import com.dataops.loader.storage.SourceFileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registration and lifecycle bookkeeping of source files.
 *
 * Status changes of a run go through this service: the atomic claim that moves
 * a file into PROCESSING, progress counters, and the terminal transition that
 * is written together with the run's LoadResult.
 */
@Service
@Transactional
public class SourceFileService {

    private static final Logger logger = LoggerFactory.getLogger(SourceFileService.class);

    private final SourceFileRepository repository;
    private final DataErrorRepository dataErrorRepository;
    private final LoadResultRepository loadResultRepository;
    private final SourceFileStorage storage;
    private final TargetTableRegistry targetTableRegistry;

    public SourceFileService(SourceFileRepository repository,
                             DataErrorRepository dataErrorRepository,
                             LoadResultRepository loadResultRepository,
                             SourceFileStorage storage,
                             TargetTableRegistry targetTableRegistry) {
        this.repository = repository;
        this.dataErrorRepository = dataErrorRepository;
        this.loadResultRepository = loadResultRepository;
        this.storage = storage;
        this.targetTableRegistry = targetTableRegistry;
    }

    /**
     * Store an uploaded file and create its SourceFile in UPLOADED.
     *
     * @param targetName configured target, or null to detect it from the header
     */
    public SourceFile register(String originalName, FileType fileType, byte[] content, String targetName)
            throws IOException {
        if (targetName != null && !targetTableRegistry.contains(targetName)) {
            throw new UnknownTargetTableException("No target table configured under name '" + targetName + "'");
        }
        String storedName = storage.save(content, originalName);

        SourceFile sourceFile = new SourceFile(originalName, storedName, fileType, content.length);
        sourceFile.setTargetName(targetName);
        sourceFile.setFileChecksum(calculateChecksum(content));

        SourceFile saved = repository.save(sourceFile);
        logger.info("Registered source file {} ({}, {} bytes) as {}",
                saved.getId(), originalName, content.length, storedName);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<SourceFile> findById(Long id) {
        return repository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<SourceFile> findByStatus(SourceFile.Status status) {
        return repository.findByStatusOrderByUploadedAtDesc(status);
    }

    @Transactional(readOnly = true)
    public Optional<LoadResult> findLoadResult(Long sourceFileId) {
        return loadResultRepository.findBySourceFileId(sourceFileId);
    }

    /**
     * Move the file into PROCESSING under a new run id.
     *
     * @throws RunNotStartableException if the file does not exist or is not UPLOADED or FAILED
     */
    public SourceFile claim(Long sourceFileId, UUID runId) {
        int updated = repository.claimForRun(sourceFileId, runId, LocalDateTime.now(),
                SourceFile.Status.PROCESSING, EnumSet.of(SourceFile.Status.UPLOADED, SourceFile.Status.FAILED));
        SourceFile sourceFile = repository.findById(sourceFileId)
                .orElseThrow(() -> new RunNotStartableException("Source file " + sourceFileId + " not found"));
        if (updated == 0 || !runId.equals(sourceFile.getRunId())) {
            throw new RunNotStartableException("Source file " + sourceFileId + " is "
                    + sourceFile.getStatus() + " and cannot be processed");
        }
        logger.info("Claimed source file {} for run {} (attempt {})",
                sourceFileId, runId, sourceFile.getAttemptCount());
        return sourceFile;
    }

    /**
     * Remove the errors and load result left by an earlier run of the file.
     */
    public void clearPreviousRun(Long sourceFileId) {
        int errors = dataErrorRepository.deleteBySourceFileId(sourceFileId);
        int results = loadResultRepository.deleteBySourceFileId(sourceFileId);
        if (errors > 0 || results > 0) {
            logger.info("Cleared {} errors and {} load results of a previous run of file {}",
                    errors, results, sourceFileId);
        }
    }

    public void saveProgress(Long sourceFileId, UUID runId, long rowsLoaded, long rowsRejected, int warnings) {
        int updated = repository.updateProgress(sourceFileId, runId, rowsLoaded, rowsRejected, warnings,
                LocalDateTime.now(), SourceFile.Status.PROCESSING);
        if (updated == 0) {
            logger.warn("Progress not saved: file {} is no longer processing under run {}", sourceFileId, runId);
        }
    }

    /**
     * Write the load result and mark the file COMPLETED in one transaction.
     */
    public SourceFile completeRun(Long sourceFileId, UUID runId, long rowCount, int warnings, LoadResult result) {
        SourceFile sourceFile = requireOwnedRun(sourceFileId, runId);
        loadResultRepository.save(result);
        sourceFile.setWarningCount(warnings);
        sourceFile.markAsCompleted(rowCount, result.getRowsLoaded(), result.getRowsRejected());
        SourceFile saved = repository.save(sourceFile);
        logger.info("Source file {} completed: {} rows, {} loaded, {} rejected in {} ms",
                sourceFileId, rowCount, result.getRowsLoaded(), result.getRowsRejected(),
                saved.getProcessingDurationMs());
        return saved;
    }

    /**
     * Mark the file FAILED, writing the load result when one is given.
     * A file no longer owned by the run is left untouched.
     */
    public void failRun(Long sourceFileId, UUID runId, String message, String details, LoadResult result) {
        Optional<SourceFile> found = repository.findById(sourceFileId);
        if (found.isEmpty() || !found.get().isProcessing() || !runId.equals(found.get().getRunId())) {
            logger.warn("Not failing file {}: it is no longer processing under run {}", sourceFileId, runId);
            return;
        }
        SourceFile sourceFile = found.get();
        if (result != null) {
            loadResultRepository.save(result);
            sourceFile.setRowsLoaded(result.getRowsLoaded());
            sourceFile.setRowsRejected(result.getRowsRejected());
        }
        sourceFile.markAsFailed(message, details);
        repository.save(sourceFile);
        logger.error("Source file {} failed: {}", sourceFileId, message);
    }

    @Transactional(readOnly = true)
    public List<SourceFile> findProcessingStartedBefore(LocalDateTime cutoff) {
        return repository.findByStatusAndStartedAtBefore(SourceFile.Status.PROCESSING, cutoff);
    }

    /**
     * Fail a PROCESSING file whose run is gone, making it restartable.
     */
    public boolean failAbandonedRun(SourceFile sourceFile, String message) {
        int updated = repository.failAbandonedRun(sourceFile.getId(), sourceFile.getRunId(), message,
                LocalDateTime.now(), SourceFile.Status.PROCESSING, SourceFile.Status.FAILED);
        return updated > 0;
    }

    @Transactional(readOnly = true)
    public ProcessingStats getProcessingStats() {
        long uploaded = repository.countByStatus(SourceFile.Status.UPLOADED);
        long processing = repository.countByStatus(SourceFile.Status.PROCESSING);
        long completed = repository.countByStatus(SourceFile.Status.COMPLETED);
        long failed = repository.countByStatus(SourceFile.Status.FAILED);
        return new ProcessingStats(
                uploaded + processing + completed + failed,
                uploaded,
                processing,
                completed,
                failed,
                repository.sumRowsLoadedByStatus(SourceFile.Status.COMPLETED),
                repository.sumRowsRejectedByStatus(SourceFile.Status.COMPLETED));
    }

    private SourceFile requireOwnedRun(Long sourceFileId, UUID runId) {
        SourceFile sourceFile = repository.findById(sourceFileId)
                .orElseThrow(() -> new IllegalStateException("Source file " + sourceFileId + " disappeared"));
        if (!runId.equals(sourceFile.getRunId())) {
            throw new IllegalStateException("Source file " + sourceFileId + " is owned by run "
                    + sourceFile.getRunId() + ", not " + runId);
        }
        return sourceFile;
    }

    /**
     * SHA-256 of the uploaded bytes as lowercase hex.
     */
    static String calculateChecksum(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return bytesToHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder();
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
