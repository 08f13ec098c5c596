package com.dataops.loader.service;

import com.dataops.loader.model.ValidationError;

import java.util.List;

/**
 * Result of flushing one batch: rows committed and rows the store refused.
 */
public final class BatchOutcome {

    private static final BatchOutcome EMPTY = new BatchOutcome(0, List.of());

    private final int loaded;
    private final List<ValidationError> rejections;

    BatchOutcome(int loaded, List<ValidationError> rejections) {
        this.loaded = loaded;
        this.rejections = List.copyOf(rejections);
    }

    static BatchOutcome empty() {
        return EMPTY;
    }

    public int getLoaded() {
        return loaded;
    }

    public List<ValidationError> getRejections() {
        return rejections;
    }

    public int getRejected() {
        return rejections.size();
    }

    @Override
    public String toString() {
        return "BatchOutcome{loaded=" + loaded + ", rejected=" + rejections.size() + "}";
    }
}
