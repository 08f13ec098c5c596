package com.dataops.loader.service;

import com.dataops.loader.config.LoaderProperties;
import com.dataops.loader.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Scheduled housekeeping: fail runs abandoned in PROCESSING and purge old errors.
 */
@Service
public class MaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceService.class);

    static final String ABANDONED_MESSAGE = "Run abandoned";

    private final SourceFileService sourceFileService;
    private final DataErrorService dataErrorService;
    private final PipelineJobService jobService;
    private final LoaderProperties properties;

    public MaintenanceService(SourceFileService sourceFileService,
                              DataErrorService dataErrorService,
                              PipelineJobService jobService,
                              LoaderProperties properties) {
        this.sourceFileService = sourceFileService;
        this.dataErrorService = dataErrorService;
        this.jobService = jobService;
        this.properties = properties;
    }

    /**
     * Fail PROCESSING files started before the timeout whose run is not active in this process.
     *
     * @return number of files failed
     */
    @Scheduled(fixedDelayString = "${loader.maintenance.reaper-interval:PT5M}",
            initialDelayString = "${loader.maintenance.reaper-interval:PT5M}")
    public int reapStaleRuns() {
        LocalDateTime cutoff = LocalDateTime.now().minus(properties.getMaintenance().getStaleRunTimeout());
        int reaped = 0;
        for (SourceFile sourceFile : sourceFileService.findProcessingStartedBefore(cutoff)) {
            if (jobService.isActive(sourceFile.getId())) {
                continue;
            }
            if (sourceFileService.failAbandonedRun(sourceFile, ABANDONED_MESSAGE)) {
                reaped++;
                logger.warn("Source file {} was processing since {} under run {}; marked as failed",
                        sourceFile.getId(), sourceFile.getStartedAt(), sourceFile.getRunId());
            }
        }
        return reaped;
    }

    /**
     * Delete errors of completed files older than the retention period.
     */
    @Scheduled(cron = "${loader.maintenance.retention-cron:0 30 3 * * *}")
    public int purgeExpiredErrors() {
        int retentionDays = properties.getMaintenance().getErrorRetentionDays();
        if (retentionDays <= 0) {
            return 0;
        }
        return dataErrorService.purgeCompletedOlderThan(LocalDateTime.now().minusDays(retentionDays));
    }
}
