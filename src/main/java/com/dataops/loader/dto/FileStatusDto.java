package com.dataops.loader.dto;

import com.dataops.loader.model.LoadResult;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.service.RunProgress;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Status of a source file, merged with live counters while a run is active
 */
@Data
@NoArgsConstructor
public class FileStatusDto {

    private Long sourceFileId;
    private String originalName;
    private String fileType;
    private String targetName;
    private String status;
    private UUID runId;
    private Integer attemptCount;
    private boolean active;
    private String stage; // live stage of an active run
    private Long totalRows;
    private Long rowsRead;
    private Long rowsLoaded;
    private Long rowsRejected;
    private Integer warningCount;
    private Double completionPercentage;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long processingDurationMs;
    private String errorMessage;
    private Long rowsAttempted; // from the load result, once written
    private String resultStatus;

    public FileStatusDto(SourceFile sourceFile) {
        this.sourceFileId = sourceFile.getId();
        this.originalName = sourceFile.getOriginalName();
        this.fileType = sourceFile.getFileType().name();
        this.targetName = sourceFile.getTargetName();
        this.status = sourceFile.getStatus().name();
        this.runId = sourceFile.getRunId();
        this.attemptCount = sourceFile.getAttemptCount();
        this.totalRows = sourceFile.getRowCount();
        this.rowsLoaded = sourceFile.getRowsLoaded();
        this.rowsRejected = sourceFile.getRowsRejected();
        this.warningCount = sourceFile.getWarningCount();
        this.startedAt = sourceFile.getStartedAt();
        this.completedAt = sourceFile.getCompletedAt();
        this.processingDurationMs = sourceFile.getProcessingDurationMs();
        this.errorMessage = sourceFile.getErrorMessage();
        if (sourceFile.isCompleted()) {
            this.completionPercentage = 100.0;
        }
    }

    public void applyProgress(RunProgress progress) {
        this.active = true;
        this.stage = progress.getStage().name();
        this.rowsRead = progress.getRowsRead();
        this.rowsLoaded = progress.getRowsLoaded();
        this.rowsRejected = progress.getRowsRejected();
        this.warningCount = progress.getWarnings();
        if (progress.getTotalRows() >= 0) {
            this.totalRows = progress.getTotalRows();
            this.completionPercentage = progress.getTotalRows() == 0
                    ? 100.0
                    : Math.min(100.0, progress.getRowsRead() * 100.0 / progress.getTotalRows());
        }
    }

    public void applyResult(LoadResult result) {
        this.rowsAttempted = result.getRowsAttempted();
        this.resultStatus = result.getStatus().name();
    }
}
