package com.dataops.loader.service;

import com.dataops.loader.config.LoaderProperties;
import com.dataops.loader.dto.ValidationPreviewDto;
import com.dataops.loader.exception.RunNotStartableException;
import com.dataops.loader.model.ErrorKind;
import com.dataops.loader.model.FileType;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.model.ValidationError;
import com.dataops.loader.parser.FileParserFactory;
import com.dataops.loader.storage.SourceFileStorage;
import com.dataops.loader.util.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValidationPreviewServiceTest {

    private static final long FILE_ID = 4L;

    @Mock
    private SourceFileService sourceFileService;

    @Mock
    private SourceFileStorage storage;

    @Mock
    private TargetTableRegistry registry;

    private LoaderProperties properties;
    private ValidationPreviewService previewService;
    private SourceFile sourceFile;

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.properties();
        properties.getPreview().setDefaultSampleSize(2);
        properties.getPreview().setMaxSampleSize(3);
        ObjectMapper objectMapper = new ObjectMapper();
        previewService = new ValidationPreviewService(sourceFileService, storage,
                new FileParserFactory(properties, objectMapper), new TargetTableResolver(registry),
                new RowValidator(new RuleEngine()), properties);

        sourceFile = TestDataFactory.uploadedFile(FILE_ID, FileType.CSV);
        lenient().when(sourceFileService.findById(FILE_ID)).thenReturn(Optional.of(sourceFile));
        lenient().when(registry.getAll()).thenReturn(List.of(TestDataFactory.customerTarget(100)));
    }

    @Test
    void testPreview_SamplesFirstRows() throws IOException {
        // Given
        givenContent(TestDataFactory.lines(
                TestDataFactory.CUSTOMER_HEADER,
                "CUST001,John,john@x.com,1000",
                "CUST002,Jane,bad-email,2000",
                ",NoCode,x@y.com,-5",
                "CUST004,Bob,bob@x.com,1"));

        // When
        ValidationPreviewDto preview = previewService.preview(FILE_ID, 3);

        // Then
        assertThat(preview.isParsable()).isTrue();
        assertThat(preview.getTargetName()).isEqualTo("customers");
        assertThat(preview.getSampleSize()).isEqualTo(3);
        assertThat(preview.getValidRows()).isEqualTo(1);
        assertThat(preview.getErrorRows()).isEqualTo(2);
        assertThat(preview.getErrorRate()).isCloseTo(66.6667, within(0.0001));
        assertThat(preview.getSampleErrors()).extracting(ValidationError::getKind)
                .containsExactly(ErrorKind.FORMAT, ErrorKind.REQUIRED, ErrorKind.RANGE);
    }

    @Test
    void testPreview_SampleSizeDefaultAndCap() throws IOException {
        givenContent(TestDataFactory.lines(TestDataFactory.CUSTOMER_HEADER,
                "C1,A,a@x.com,1", "C2,B,b@x.com,1", "C3,C,c@x.com,1", "C4,D,d@x.com,1", "C5,E,e@x.com,1"));

        assertThat(previewService.preview(FILE_ID, 0).getSampleSize()).isEqualTo(2);
        assertThat(previewService.preview(FILE_ID, 500).getSampleSize()).isEqualTo(3);
    }

    @Test
    void testPreview_MalformedFileReportedNotThrown() throws IOException {
        givenContent(TestDataFactory.lines(TestDataFactory.CUSTOMER_HEADER, "C1,\"open"));

        ValidationPreviewDto preview = previewService.preview(FILE_ID, 10);

        assertThat(preview.isParsable()).isFalse();
        assertThat(preview.getFatalError()).contains("Unterminated quoted field");
        assertThat(preview.getSampleSize()).isZero();
    }

    @Test
    void testPreview_StoredFileMissing() throws IOException {
        when(storage.open(sourceFile.getStoredName())).thenThrow(new NoSuchFileException("gone"));

        ValidationPreviewDto preview = previewService.preview(FILE_ID, 10);

        assertThat(preview.getFatalError()).startsWith("Could not read source file");
    }

    @Test
    void testPreview_UnknownFile() {
        when(sourceFileService.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> previewService.preview(99L, 10))
                .isInstanceOf(RunNotStartableException.class);
    }

    private void givenContent(byte[] content) throws IOException {
        when(storage.open(sourceFile.getStoredName())).thenAnswer(invocation -> new ByteArrayInputStream(content));
    }
}
