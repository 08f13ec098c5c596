package com.dataops.loader.service;

import com.dataops.loader.dto.FileStatusDto;
import com.dataops.loader.dto.ProcessingStats;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Status queries that merge persisted file state with live run progress.
 */
@Service
public class PipelineStatusService {

    private final SourceFileService sourceFileService;
    private final PipelineJobService jobService;

    public PipelineStatusService(SourceFileService sourceFileService, PipelineJobService jobService) {
        this.sourceFileService = sourceFileService;
        this.jobService = jobService;
    }

    public Optional<FileStatusDto> getStatus(long sourceFileId) {
        return sourceFileService.findById(sourceFileId).map(sourceFile -> {
            FileStatusDto status = new FileStatusDto(sourceFile);
            jobService.getProgress(sourceFileId).ifPresent(status::applyProgress);
            sourceFileService.findLoadResult(sourceFileId).ifPresent(status::applyResult);
            return status;
        });
    }

    public ProcessingStats getProcessingStats() {
        return sourceFileService.getProcessingStats();
    }
}
