package com.dataops.loader.service;

import com.dataops.loader.dto.FileStatusDto;
import com.dataops.loader.model.FileType;
import com.dataops.loader.model.LoadResult;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineStatusServiceTest {

    @Mock
    private SourceFileService sourceFileService;

    @Mock
    private PipelineJobService jobService;

    private PipelineStatusService statusService;

    @BeforeEach
    void setUp() {
        statusService = new PipelineStatusService(sourceFileService, jobService);
    }

    @Test
    void testGetStatus_ActiveRunShowsLiveCounters() {
        // Given
        UUID runId = UUID.randomUUID();
        SourceFile file = TestDataFactory.claimedFile(3L, FileType.CSV, "s", runId);
        RunProgress progress = new RunProgress(3L, runId);
        progress.setStage(RunProgress.Stage.LOADING);
        progress.setTotalRows(10);
        for (int i = 0; i < 4; i++) {
            progress.recordRead();
        }
        progress.recordLoaded(3);
        progress.recordRejected(1);
        when(sourceFileService.findById(3L)).thenReturn(Optional.of(file));
        when(jobService.getProgress(3L)).thenReturn(Optional.of(progress));
        when(sourceFileService.findLoadResult(3L)).thenReturn(Optional.empty());

        // When
        FileStatusDto status = statusService.getStatus(3L).orElseThrow();

        // Then
        assertThat(status.isActive()).isTrue();
        assertThat(status.getStatus()).isEqualTo("PROCESSING");
        assertThat(status.getStage()).isEqualTo("LOADING");
        assertThat(status.getRowsRead()).isEqualTo(4L);
        assertThat(status.getRowsLoaded()).isEqualTo(3L);
        assertThat(status.getCompletionPercentage()).isEqualTo(40.0);
    }

    @Test
    void testGetStatus_CompletedFileShowsResult() {
        UUID runId = UUID.randomUUID();
        SourceFile file = TestDataFactory.claimedFile(3L, FileType.JSON, "s", runId);
        file.markAsCompleted(3, 1, 2);
        when(sourceFileService.findById(3L)).thenReturn(Optional.of(file));
        when(jobService.getProgress(3L)).thenReturn(Optional.empty());
        when(sourceFileService.findLoadResult(3L)).thenReturn(Optional.of(
                LoadResult.of(3L, runId, "customers", 1, 2, LoadResult.Status.COMPLETED, null)));

        FileStatusDto status = statusService.getStatus(3L).orElseThrow();

        assertThat(status.isActive()).isFalse();
        assertThat(status.getRowsAttempted()).isEqualTo(3L);
        assertThat(status.getResultStatus()).isEqualTo("COMPLETED");
        assertThat(status.getCompletionPercentage()).isEqualTo(100.0);
    }

    @Test
    void testGetStatus_UnknownFile() {
        when(sourceFileService.findById(8L)).thenReturn(Optional.empty());

        assertThat(statusService.getStatus(8L)).isEmpty();
    }
}
