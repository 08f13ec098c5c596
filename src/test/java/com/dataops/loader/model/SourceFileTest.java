package com.dataops.loader.model;

import com.dataops.loader.util.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceFileTest {

    @Test
    void testNewFile_UploadedAndStartable() {
        SourceFile file = new SourceFile("a.csv", "x_a.csv", FileType.CSV, 10L);

        assertThat(file.getStatus()).isEqualTo(SourceFile.Status.UPLOADED);
        assertThat(file.isStartable()).isTrue();
        assertThat(file.getRowsLoaded()).isZero();
        assertThat(file.getAttemptCount()).isZero();
    }

    @Test
    void testMarkAsCompleted_FromProcessing() {
        SourceFile file = TestDataFactory.claimedFile(1L, FileType.CSV, "s", UUID.randomUUID());

        file.markAsCompleted(3, 1, 2);

        assertThat(file.isCompleted()).isTrue();
        assertThat(file.isStartable()).isFalse();
        assertThat(file.getRowCount()).isEqualTo(3L);
        assertThat(file.getProcessingDurationMs()).isNotNull();
    }

    @Test
    void testMarkAsFailed_TruncatesMessageAndAllowsRestart() {
        SourceFile file = TestDataFactory.claimedFile(1L, FileType.CSV, "s", UUID.randomUUID());

        file.markAsFailed("x".repeat(1200), "details");

        assertThat(file.isFailed()).isTrue();
        assertThat(file.isStartable()).isTrue();
        assertThat(file.getErrorMessage()).hasSize(1000).endsWith("...");
    }

    @Test
    void testTerminalTransition_RequiresProcessing() {
        SourceFile file = TestDataFactory.uploadedFile(1L, FileType.JSON);

        assertThatThrownBy(() -> file.markAsCompleted(1, 1, 0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot move from UPLOADED to COMPLETED");
    }

    @Test
    void testCompletedFileCannotFail() {
        SourceFile file = TestDataFactory.claimedFile(1L, FileType.CSV, "s", UUID.randomUUID());
        file.markAsCompleted(1, 1, 0);

        assertThatThrownBy(() -> file.markAsFailed("late", null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testFileTypeFromValue() {
        assertThat(FileType.fromValue(" CSV ")).isEqualTo(FileType.CSV);
        assertThat(FileType.fromValue("json")).isEqualTo(FileType.JSON);
        assertThatThrownBy(() -> FileType.fromValue("xlsx"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported file type");
    }
}
