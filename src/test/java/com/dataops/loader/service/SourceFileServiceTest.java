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
import com.dataops.loader.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SourceFileService
 * Tests registration, run claims and terminal transitions
 */
class SourceFileServiceTest {

    @Mock
    private SourceFileRepository repository;

    @Mock
    private DataErrorRepository dataErrorRepository;

    @Mock
    private LoadResultRepository loadResultRepository;

    @Mock
    private SourceFileStorage storage;

    @Mock
    private TargetTableRegistry targetTableRegistry;

    private SourceFileService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new SourceFileService(repository, dataErrorRepository, loadResultRepository, storage,
                targetTableRegistry);
        when(repository.save(any(SourceFile.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    // ========== Registration Tests ==========

    @Test
    void testRegister_StoresFileAndCreatesUploadedRecord() throws IOException {
        // Given
        byte[] content = TestDataFactory.lines(TestDataFactory.CUSTOMER_HEADER, "C1,John,j@x.com,10");
        when(targetTableRegistry.contains("customers")).thenReturn(true);
        when(storage.save(content, "customers.csv")).thenReturn("abc_customers.csv");

        // When
        SourceFile registered = service.register("customers.csv", FileType.CSV, content, "customers");

        // Then
        assertThat(registered.getStatus()).isEqualTo(SourceFile.Status.UPLOADED);
        assertThat(registered.getStoredName()).isEqualTo("abc_customers.csv");
        assertThat(registered.getFileSizeBytes()).isEqualTo((long) content.length);
        assertThat(registered.getTargetName()).isEqualTo("customers");
        assertThat(registered.getFileChecksum()).hasSize(64);
    }

    @Test
    void testRegister_UnknownTarget_NothingStored() throws IOException {
        when(targetTableRegistry.contains("invoices")).thenReturn(false);

        assertThatThrownBy(() -> service.register("x.csv", FileType.CSV, new byte[]{1}, "invoices"))
                .isInstanceOf(UnknownTargetTableException.class);
        verify(storage, never()).save(any(), anyString());
    }

    @Test
    void testCalculateChecksum_KnownValue() {
        assertThat(SourceFileService.calculateChecksum(TestDataFactory.utf8("abc")))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    // ========== Claim Tests ==========

    @Test
    void testClaim_Succeeds() {
        UUID runId = UUID.randomUUID();
        SourceFile claimed = TestDataFactory.claimedFile(3L, FileType.CSV, "s", runId);
        when(repository.claimForRun(eq(3L), eq(runId), any(), eq(SourceFile.Status.PROCESSING), any())).thenReturn(1);
        when(repository.findById(3L)).thenReturn(Optional.of(claimed));

        assertThat(service.claim(3L, runId)).isSameAs(claimed);
    }

    @Test
    void testClaim_FileMissing() {
        when(repository.findById(3L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.claim(3L, UUID.randomUUID()))
                .isInstanceOf(RunNotStartableException.class)
                .hasMessage("Source file 3 not found");
    }

    @Test
    void testClaim_LostRace() {
        // Another run claimed the file first
        SourceFile other = TestDataFactory.claimedFile(3L, FileType.CSV, "s", UUID.randomUUID());
        when(repository.claimForRun(eq(3L), any(), any(), any(), any())).thenReturn(0);
        when(repository.findById(3L)).thenReturn(Optional.of(other));

        assertThatThrownBy(() -> service.claim(3L, UUID.randomUUID()))
                .isInstanceOf(RunNotStartableException.class)
                .hasMessage("Source file 3 is PROCESSING and cannot be processed");
    }

    @Test
    void testClearPreviousRun_DeletesErrorsAndResult() {
        service.clearPreviousRun(3L);

        verify(dataErrorRepository).deleteBySourceFileId(3L);
        verify(loadResultRepository).deleteBySourceFileId(3L);
    }

    // ========== Terminal Transition Tests ==========

    @Test
    void testCompleteRun_WritesResultAndCounters() {
        UUID runId = UUID.randomUUID();
        SourceFile file = TestDataFactory.claimedFile(3L, FileType.CSV, "s", runId);
        when(repository.findById(3L)).thenReturn(Optional.of(file));
        LoadResult result = LoadResult.of(3L, runId, "customers", 8, 2, LoadResult.Status.COMPLETED, null);

        SourceFile completed = service.completeRun(3L, runId, 10, 1, result);

        verify(loadResultRepository).save(result);
        assertThat(completed.getStatus()).isEqualTo(SourceFile.Status.COMPLETED);
        assertThat(completed.getRowCount()).isEqualTo(10L);
        assertThat(completed.getRowsLoaded()).isEqualTo(8L);
        assertThat(completed.getRowsRejected()).isEqualTo(2L);
        assertThat(completed.getWarningCount()).isEqualTo(1);
        assertThat(completed.getCompletedAt()).isNotNull();
    }

    @Test
    void testCompleteRun_OtherRunOwnsFile() {
        SourceFile file = TestDataFactory.claimedFile(3L, FileType.CSV, "s", UUID.randomUUID());
        when(repository.findById(3L)).thenReturn(Optional.of(file));
        UUID staleRun = UUID.randomUUID();
        LoadResult result = LoadResult.of(3L, staleRun, "customers", 1, 0, LoadResult.Status.COMPLETED, null);

        assertThatThrownBy(() -> service.completeRun(3L, staleRun, 1, 0, result))
                .isInstanceOf(IllegalStateException.class);
        verify(loadResultRepository, never()).save(any());
    }

    @Test
    void testFailRun_WithResult() {
        UUID runId = UUID.randomUUID();
        SourceFile file = TestDataFactory.claimedFile(3L, FileType.CSV, "s", runId);
        when(repository.findById(3L)).thenReturn(Optional.of(file));
        LoadResult result = LoadResult.of(3L, runId, "customers", 4, 1, LoadResult.Status.FAILED, "Store failure");

        service.failRun(3L, runId, "Store failure", "details", result);

        verify(loadResultRepository).save(result);
        ArgumentCaptor<SourceFile> captor = ArgumentCaptor.forClass(SourceFile.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(SourceFile.Status.FAILED);
        assertThat(captor.getValue().getErrorMessage()).isEqualTo("Store failure");
        assertThat(captor.getValue().getRowsLoaded()).isEqualTo(4L);
    }

    @Test
    void testFailRun_FileNoLongerOwned_Ignored() {
        SourceFile file = TestDataFactory.claimedFile(3L, FileType.CSV, "s", UUID.randomUUID());
        file.setStatus(SourceFile.Status.FAILED);
        when(repository.findById(3L)).thenReturn(Optional.of(file));

        service.failRun(3L, UUID.randomUUID(), "late failure", null, null);

        verify(repository, never()).save(any(SourceFile.class));
    }

    @Test
    void testFailAbandonedRun_DelegatesConditionalUpdate() {
        UUID runId = UUID.randomUUID();
        SourceFile file = TestDataFactory.claimedFile(3L, FileType.CSV, "s", runId);
        when(repository.failAbandonedRun(eq(3L), eq(runId), eq("Run abandoned"), any(LocalDateTime.class),
                eq(SourceFile.Status.PROCESSING), eq(SourceFile.Status.FAILED))).thenReturn(1);

        assertThat(service.failAbandonedRun(file, "Run abandoned")).isTrue();
    }

    // ========== Statistics Tests ==========

    @Test
    void testGetProcessingStats() {
        when(repository.countByStatus(SourceFile.Status.UPLOADED)).thenReturn(2L);
        when(repository.countByStatus(SourceFile.Status.PROCESSING)).thenReturn(1L);
        when(repository.countByStatus(SourceFile.Status.COMPLETED)).thenReturn(5L);
        when(repository.countByStatus(SourceFile.Status.FAILED)).thenReturn(1L);
        when(repository.sumRowsLoadedByStatus(SourceFile.Status.COMPLETED)).thenReturn(900L);
        when(repository.sumRowsRejectedByStatus(SourceFile.Status.COMPLETED)).thenReturn(12L);

        ProcessingStats stats = service.getProcessingStats();

        assertThat(stats.getTotalFiles()).isEqualTo(9L);
        assertThat(stats.getCompletedFiles()).isEqualTo(5L);
        assertThat(stats.getTotalRowsLoaded()).isEqualTo(900L);
        assertThat(stats.getTotalRowsRejected()).isEqualTo(12L);
    }
}
