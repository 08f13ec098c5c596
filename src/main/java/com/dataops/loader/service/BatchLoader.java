package com.dataops.loader.service;

import com.dataops.loader.config.LoaderProperties;
import com.dataops.loader.model.TargetTable;
import org.springframework.stereotype.Component;

/**
 * Opens load sessions that group validated rows into bounded batches.
 * The store is passed per session; the loader keeps no connection of its own.
 */
@Component
public class BatchLoader {

    private final LoaderProperties properties;

    public BatchLoader(LoaderProperties properties) {
        this.properties = properties;
    }

    public LoadSession openSession(TargetStore store, TargetTable target, long sourceFileId, RunProgress progress) {
        LoaderProperties.Batch batch = properties.getBatch();
        return new LoadSession(store, target, sourceFileId, progress,
                Math.max(1, batch.getRowByRowThreshold()),
                Math.max(0, batch.getMaxIsolationRetries()));
    }
}
