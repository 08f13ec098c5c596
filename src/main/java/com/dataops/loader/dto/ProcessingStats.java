package com.dataops.loader.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * File counts per status and row totals over completed files, for dashboards
 */
@Getter
@AllArgsConstructor
@ToString
public class ProcessingStats {

    private final long totalFiles;
    private final long uploadedFiles;
    private final long processingFiles;
    private final long completedFiles;
    private final long failedFiles;
    private final long totalRowsLoaded;
    private final long totalRowsRejected;

    public static ProcessingStats empty() {
        return new ProcessingStats(0, 0, 0, 0, 0, 0, 0);
    }
}
