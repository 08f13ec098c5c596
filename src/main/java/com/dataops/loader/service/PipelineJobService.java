package com.dataops.loader.service;

import com.dataops.loader.exception.RunNotStartableException;
import com.dataops.loader.model.LoadResult;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.util.RunContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Runs pipelines on the worker pool, one run per file at a time.
 *
 * Runs of different files share nothing but the store. Each active run is
 * tracked by file id so it can be cancelled and its progress read.
 */
@Service
public class PipelineJobService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineJobService.class);

    private final PipelineOrchestrator orchestrator;
    private final SourceFileService sourceFileService;
    private final TaskExecutor executor;
    private final ConcurrentMap<Long, RunProgress> activeRuns = new ConcurrentHashMap<>();

    public PipelineJobService(PipelineOrchestrator orchestrator,
                              SourceFileService sourceFileService,
                              @Qualifier("pipelineExecutor") TaskExecutor executor) {
        this.orchestrator = orchestrator;
        this.sourceFileService = sourceFileService;
        this.executor = executor;
    }

    /**
     * Queue a run of the file on the worker pool.
     *
     * @return a future completed with the load result, or completed exceptionally
     *         with the {@link com.dataops.loader.exception.PipelineException} that failed the run
     * @throws RunNotStartableException if the file cannot start a run or the pool is full
     */
    public CompletableFuture<LoadResult> submit(long sourceFileId) {
        RunProgress progress = register(sourceFileId);
        try {
            CompletableFuture<LoadResult> future = CompletableFuture.supplyAsync(() -> execute(progress), executor);
            logger.info("Queued run {} for source file {}", progress.getRunId(), sourceFileId);
            return future;
        } catch (TaskRejectedException e) {
            activeRuns.remove(sourceFileId, progress);
            throw new RunNotStartableException("Worker pool is full, source file " + sourceFileId + " not queued");
        }
    }

    /**
     * Execute a run on the calling thread.
     */
    public LoadResult runNow(long sourceFileId) {
        return execute(register(sourceFileId));
    }

    /**
     * Request cancellation of the active run of a file. The run stops at its next batch boundary.
     *
     * @return false when the file has no active run
     */
    public boolean cancel(long sourceFileId) {
        RunProgress progress = activeRuns.get(sourceFileId);
        if (progress == null) {
            return false;
        }
        progress.requestCancel();
        logger.info("Cancellation requested for run {} of source file {}", progress.getRunId(), sourceFileId);
        return true;
    }

    public Optional<RunProgress> getProgress(long sourceFileId) {
        return Optional.ofNullable(activeRuns.get(sourceFileId));
    }

    public boolean isActive(long sourceFileId) {
        return activeRuns.containsKey(sourceFileId);
    }

    public Set<Long> getActiveFileIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    private RunProgress register(long sourceFileId) {
        SourceFile sourceFile = sourceFileService.findById(sourceFileId)
                .orElseThrow(() -> new RunNotStartableException("Source file " + sourceFileId + " not found"));
        if (!sourceFile.isStartable()) {
            throw new RunNotStartableException("Source file " + sourceFileId + " is "
                    + sourceFile.getStatus() + " and cannot be processed");
        }
        RunProgress progress = new RunProgress(sourceFileId, UUID.randomUUID());
        if (activeRuns.putIfAbsent(sourceFileId, progress) != null) {
            throw new RunNotStartableException("Source file " + sourceFileId + " already has an active run");
        }
        return progress;
    }

    private LoadResult execute(RunProgress progress) {
        RunContextUtil.set(progress.getSourceFileId(), progress.getRunId());
        try {
            return orchestrator.run(progress);
        } finally {
            activeRuns.remove(progress.getSourceFileId(), progress);
            RunContextUtil.clear();
        }
    }
}
