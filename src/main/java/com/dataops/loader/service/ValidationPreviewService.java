package com.dataops.loader.service;

import com.dataops.loader.config.LoaderProperties;
import com.dataops.loader.dto.ValidationPreviewDto;
import com.dataops.loader.exception.FatalParseException;
import com.dataops.loader.exception.RunNotStartableException;
import com.dataops.loader.exception.UnknownTargetTableException;
import com.dataops.loader.model.Row;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.model.TargetTable;
import com.dataops.loader.model.ValidationError;
import com.dataops.loader.parser.FileParserFactory;
import com.dataops.loader.parser.ParsedFile;
import com.dataops.loader.parser.RowIterator;
import com.dataops.loader.storage.SourceFileStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Dry-run validation of the first rows of a stored file.
 * Nothing is loaded, persisted or changed on the source file.
 */
@Service
@Slf4j
public class ValidationPreviewService {

    private final SourceFileService sourceFileService;
    private final SourceFileStorage storage;
    private final FileParserFactory parserFactory;
    private final TargetTableResolver targetTableResolver;
    private final RowValidator rowValidator;
    private final LoaderProperties properties;

    public ValidationPreviewService(SourceFileService sourceFileService,
                                    SourceFileStorage storage,
                                    FileParserFactory parserFactory,
                                    TargetTableResolver targetTableResolver,
                                    RowValidator rowValidator,
                                    LoaderProperties properties) {
        this.sourceFileService = sourceFileService;
        this.storage = storage;
        this.parserFactory = parserFactory;
        this.targetTableResolver = targetTableResolver;
        this.rowValidator = rowValidator;
        this.properties = properties;
    }

    /**
     * @param sampleSize rows to examine; non-positive uses the configured default,
     *                   larger values are capped at the configured maximum
     * @throws RunNotStartableException if the file does not exist
     */
    public ValidationPreviewDto preview(long sourceFileId, int sampleSize) {
        SourceFile sourceFile = sourceFileService.findById(sourceFileId)
                .orElseThrow(() -> new RunNotStartableException("Source file " + sourceFileId + " not found"));
        LoaderProperties.Preview config = properties.getPreview();
        int limit = sampleSize > 0 ? Math.min(sampleSize, config.getMaxSampleSize()) : config.getDefaultSampleSize();

        ValidationPreviewDto preview = new ValidationPreviewDto();
        preview.setSourceFileId(sourceFileId);

        try {
            ParsedFile parsed = parserFactory.forType(sourceFile.getFileType())
                    .parse(() -> storage.open(sourceFile.getStoredName()));
            preview.setHeader(parsed.getHeader());

            TargetTable target = targetTableResolver.resolve(sourceFile, parsed.getHeader());
            preview.setTargetName(target.getName());

            try (RowIterator rows = parsed.rows()) {
                int examined = 0;
                while (examined < limit && rows.hasNext()) {
                    Row row = rows.next();
                    examined++;
                    List<ValidationError> errors = rowValidator.validate(row, target.getRules());
                    if (errors.isEmpty()) {
                        preview.setValidRows(preview.getValidRows() + 1);
                    } else {
                        preview.setErrorRows(preview.getErrorRows() + 1);
                        preview.getSampleErrors().addAll(errors);
                    }
                }
                preview.setSampleSize(examined);
                preview.setErrorRate(examined == 0 ? 0.0 : preview.getErrorRows() * 100.0 / examined);
            }
        } catch (FatalParseException | UnknownTargetTableException e) {
            preview.setFatalError(e.getMessage());
        } catch (IOException | UncheckedIOException e) {
            preview.setFatalError("Could not read source file: " + e.getMessage());
        }

        log.info("Preview of file {}: {} rows sampled, {} with errors{}", sourceFileId, preview.getSampleSize(),
                preview.getErrorRows(), preview.isParsable() ? "" : " (fatal: " + preview.getFatalError() + ")");
        return preview;
    }
}
