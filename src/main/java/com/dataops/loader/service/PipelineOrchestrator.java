package com.dataops.loader.service;

import com.dataops.loader.config.LoaderProperties;
import com.dataops.loader.exception.FatalParseException;
import com.dataops.loader.exception.FatalStoreException;
import com.dataops.loader.exception.PipelineException;
import com.dataops.loader.exception.RunCancelledException;
import com.dataops.loader.exception.UnknownTargetTableException;
import com.dataops.loader.model.DataError;
import com.dataops.loader.model.LoadResult;
import com.dataops.loader.model.Row;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.model.TargetTable;
import com.dataops.loader.model.ValidationError;
import com.dataops.loader.parser.FileParserFactory;
import com.dataops.loader.parser.ParsedFile;
import com.dataops.loader.parser.RowIterator;
import com.dataops.loader.storage.SourceFileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives one run over one source file: claim, parse, validate, load, finish.
 *
 * Rows are processed strictly in file order. Errors of rejected rows are held
 * until the next batch boundary and written together with the store's own
 * rejections, sorted by row number, so the ledger stays in row order.
 *
 * A run ends COMPLETED whenever every row was settled, whatever the number of
 * rejected rows. Fatal parse errors fail the file without a load result.
 * Store failures and cancellation fail the file with a FAILED load result that
 * counts only rows whose outcome was settled before the failure. A batch that
 * was being inserted when the store failed is rolled back and not counted.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final SourceFileService sourceFileService;
    private final DataErrorService dataErrorService;
    private final SourceFileStorage storage;
    private final FileParserFactory parserFactory;
    private final TargetTableResolver targetTableResolver;
    private final RowValidator rowValidator;
    private final BatchLoader batchLoader;
    private final TargetStore targetStore;
    private final LoaderProperties properties;

    public PipelineOrchestrator(SourceFileService sourceFileService,
                                DataErrorService dataErrorService,
                                SourceFileStorage storage,
                                FileParserFactory parserFactory,
                                TargetTableResolver targetTableResolver,
                                RowValidator rowValidator,
                                BatchLoader batchLoader,
                                TargetStore targetStore,
                                LoaderProperties properties) {
        this.sourceFileService = sourceFileService;
        this.dataErrorService = dataErrorService;
        this.storage = storage;
        this.parserFactory = parserFactory;
        this.targetTableResolver = targetTableResolver;
        this.rowValidator = rowValidator;
        this.batchLoader = batchLoader;
        this.targetStore = targetStore;
        this.properties = properties;
    }

    /**
     * Execute a run on the calling thread.
     *
     * @return the load result of a completed run
     * @throws com.dataops.loader.exception.RunNotStartableException if the file cannot be claimed
     * @throws PipelineException if the run failed; the file is FAILED when this is thrown
     */
    public LoadResult run(RunProgress progress) {
        long fileId = progress.getSourceFileId();
        UUID runId = progress.getRunId();

        SourceFile sourceFile = sourceFileService.claim(fileId, runId);

        Run run = new Run(sourceFile, progress);
        try {
            sourceFileService.clearPreviousRun(fileId);
            return run.execute();
        } catch (FatalParseException | UnknownTargetTableException e) {
            logger.error("Run {} rejected file {}: {}", runId, fileId, e.getMessage());
            // A read failure after loading started still needs a result for the committed rows
            recordFailure(run, e.getMessage(), e, run.session != null);
            throw e;
        } catch (FatalStoreException | RunCancelledException e) {
            logger.error("Run {} aborted for file {}: {}", runId, fileId, e.getMessage());
            recordFailure(run, e.getMessage(), e, true);
            throw e;
        } catch (DataAccessException | TransactionException e) {
            FatalStoreException fatal = new FatalStoreException("Store failure: " + e.getMessage(), e);
            logger.error("Run {} aborted for file {}: {}", runId, fileId, fatal.getMessage(), e);
            recordFailure(run, fatal.getMessage(), e, true);
            throw fatal;
        } catch (RuntimeException e) {
            logger.error("Run {} failed unexpectedly for file {}", runId, fileId, e);
            recordFailure(run, "Unexpected error: " + e.getMessage(), e, true);
            throw e;
        } finally {
            progress.setStage(RunProgress.Stage.DONE);
        }
    }

    /**
     * Best-effort bookkeeping after a fatal error. Failures here are logged and
     * never replace the original exception.
     */
    private void recordFailure(Run run, String message, Throwable cause, boolean withResult) {
        long fileId = run.sourceFile.getId();
        UUID runId = run.progress.getRunId();
        LoadResult result = null;

        if (withResult && run.target != null) {
            try {
                run.savePendingErrors();
            } catch (RuntimeException e) {
                logger.error("Could not save pending errors of failed run {}: {}", runId, e.getMessage());
            }
            long loaded = run.session != null ? run.session.getRowsLoaded() : 0;
            result = LoadResult.of(fileId, runId, run.target.getTable(), loaded, run.rejectedRows(),
                    LoadResult.Status.FAILED, message);
        }

        try {
            sourceFileService.failRun(fileId, runId, message, describe(cause), result);
        } catch (RuntimeException e) {
            logger.error("Could not mark file {} as failed: {}", fileId, e.getMessage(), e);
        }
    }

    private static String describe(Throwable cause) {
        StringBuilder details = new StringBuilder(cause.getClass().getName());
        Throwable current = cause.getCause();
        while (current != null && current != current.getCause()) {
            details.append(" <- ").append(current.getClass().getName());
            if (current.getMessage() != null) {
                details.append(": ").append(current.getMessage());
            }
            current = current.getCause();
        }
        return details.toString();
    }

    /**
     * State of one run in progress.
     */
    private final class Run {

        private final SourceFile sourceFile;
        private final RunProgress progress;
        private final List<DataError> pendingErrors = new ArrayList<>();
        private final Map<Long, Row> batchRows = new HashMap<>();
        private TargetTable target;
        private LoadSession session;
        private long validationRejected;
        private int warnings;

        private Run(SourceFile sourceFile, RunProgress progress) {
            this.sourceFile = sourceFile;
            this.progress = progress;
        }

        private LoadResult execute() {
            long fileId = sourceFile.getId();
            UUID runId = progress.getRunId();

            progress.setStage(RunProgress.Stage.PARSING);
            ParsedFile parsed = parse();
            warnings = parsed.getWarningCount();
            progress.setTotalRows(parsed.getRowCount());
            progress.setWarnings(warnings);

            target = targetTableResolver.resolve(sourceFile, parsed.getHeader());
            session = batchLoader.openSession(targetStore, target, fileId, progress);
            logger.info("Loading {} rows of file {} into {}", parsed.getRowCount(), fileId, target);

            progress.setStage(RunProgress.Stage.LOADING);
            int errorFlushThreshold = Math.max(1, properties.getBatch().getErrorFlushThreshold());
            try (RowIterator rows = parsed.rows()) {
                while (rows.hasNext()) {
                    Row row = rows.next();
                    progress.recordRead();
                    List<ValidationError> errors = rowValidator.validate(row, target.getRules());
                    if (errors.isEmpty()) {
                        session.offer(row);
                        batchRows.put(row.getRowNumber(), row);
                    } else {
                        validationRejected++;
                        progress.recordRejected(1);
                        for (ValidationError error : errors) {
                            pendingErrors.add(dataErrorService.toEntry(fileId, error, row));
                        }
                        logger.debug("Row {} rejected with {} errors", row.getRowNumber(), errors.size());
                    }
                    if (session.isFull() || pendingErrors.size() >= errorFlushThreshold) {
                        flush();
                    }
                }
            } catch (IOException | UncheckedIOException e) {
                throw new FatalParseException("Could not read source file: " + e.getMessage(), 0, e);
            }
            flush();

            progress.setStage(RunProgress.Stage.FINISHING);
            LoadResult result = LoadResult.of(fileId, runId, target.getTable(), session.getRowsLoaded(),
                    rejectedRows(), LoadResult.Status.COMPLETED, null);
            sourceFileService.completeRun(fileId, runId, parsed.getRowCount(), warnings, result);
            return result;
        }

        private ParsedFile parse() {
            try {
                return parserFactory.forType(sourceFile.getFileType())
                        .parse(() -> storage.open(sourceFile.getStoredName()));
            } catch (IOException | UncheckedIOException e) {
                throw new FatalParseException("Could not read source file: " + e.getMessage(), 0, e);
            }
        }

        /**
         * Batch boundary: poll cancellation, insert buffered rows, write errors in row order.
         */
        private void flush() {
            if (progress.isCancelRequested()) {
                throw new RunCancelledException(sourceFile.getId());
            }
            BatchOutcome outcome = session.flush();
            addStoreRejections(outcome.getRejections());
            batchRows.clear();
            savePendingErrors();
            sourceFileService.saveProgress(sourceFile.getId(), progress.getRunId(),
                    session.getRowsLoaded(), rejectedRows(), warnings);
        }

        private void addStoreRejections(List<ValidationError> rejections) {
            for (ValidationError rejection : rejections) {
                pendingErrors.add(dataErrorService.toEntry(sourceFile.getId(), rejection,
                        batchRows.get(rejection.getRowNumber())));
            }
        }

        private void savePendingErrors() {
            if (pendingErrors.isEmpty()) {
                return;
            }
            // Stable sort keeps rule order within a row
            pendingErrors.sort(Comparator.comparingLong(DataError::getRowNumber));
            dataErrorService.saveAll(new ArrayList<>(pendingErrors));
            pendingErrors.clear();
        }

        private long rejectedRows() {
            return validationRejected + (session != null ? session.getRowsRejected() : 0);
        }
    }
}
