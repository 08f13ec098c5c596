package com.dataops.loader.service;

import com.dataops.loader.dto.ValidationSummaryDto;
import com.dataops.loader.model.DataError;
import com.dataops.loader.model.ErrorKind;
import com.dataops.loader.model.Row;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.model.ValidationError;
import com.dataops.loader.repository.DataErrorRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes and queries the error ledger.
 */
@Service
@Slf4j
@Transactional
public class DataErrorService {

    private final DataErrorRepository repository;
    private final ObjectMapper objectMapper;

    public DataErrorService(DataErrorRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    /**
     * Build a ledger entry keeping the row's values as JSON for diagnosis.
     */
    public DataError toEntry(long sourceFileId, ValidationError error, Row row) {
        return DataError.of(sourceFileId, error, row != null ? toRawData(row) : null);
    }

    /**
     * Persist entries in the given order.
     */
    public void saveAll(List<DataError> entries) {
        if (entries.isEmpty()) {
            return;
        }
        repository.saveAll(entries);
        log.debug("Saved {} error entries", entries.size());
    }

    @Transactional(readOnly = true)
    public List<DataError> getErrors(Long sourceFileId) {
        return repository.findBySourceFileIdOrderByRowNumberAscIdAsc(sourceFileId);
    }

    @Transactional(readOnly = true)
    public List<DataError> getErrors(Long sourceFileId, ErrorKind kind) {
        return repository.findBySourceFileIdAndErrorTypeOrderByRowNumberAscIdAsc(sourceFileId, kind);
    }

    @Transactional(readOnly = true)
    public ValidationSummaryDto getSummary(Long sourceFileId) {
        ValidationSummaryDto summary = new ValidationSummaryDto();
        summary.setSourceFileId(sourceFileId);

        long total = 0;
        for (Object[] row : repository.countByErrorType(sourceFileId)) {
            ErrorKind kind = (ErrorKind) row[0];
            long count = ((Number) row[1]).longValue();
            summary.getErrorsByKind().put(kind, count);
            total += count;
        }
        summary.setTotalErrors(total);
        summary.setRejectedRows(repository.countDistinctRows(sourceFileId));
        return summary;
    }

    /**
     * Delete errors older than the cutoff for files in the COMPLETED status.
     */
    public int purgeCompletedOlderThan(LocalDateTime cutoff) {
        int deleted = repository.deleteOlderThan(cutoff, SourceFile.Status.COMPLETED);
        if (deleted > 0) {
            log.info("Purged {} error entries created before {}", deleted, cutoff);
        }
        return deleted;
    }

    private String toRawData(Row row) {
        try {
            return objectMapper.writeValueAsString(row.asMap());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize row {} for the error ledger: {}", row.getRowNumber(), e.getMessage());
            return null;
        }
    }
}
