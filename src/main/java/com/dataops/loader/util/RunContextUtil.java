package com.dataops.loader.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Utility class for tagging log lines with the run being executed.
 * Uses SLF4J MDC (Mapped Diagnostic Context) for thread-local storage.
 *
 * Usage:
 * - Set on the worker thread when a run starts
 * - IMPORTANT: always clear in a finally block, pool threads are reused
 */
public final class RunContextUtil {

    public static final String RUN_ID_KEY = "runId";
    public static final String SOURCE_FILE_ID_KEY = "sourceFileId";

    private RunContextUtil() {
    }

    public static void set(long sourceFileId, UUID runId) {
        MDC.put(SOURCE_FILE_ID_KEY, String.valueOf(sourceFileId));
        MDC.put(RUN_ID_KEY, runId.toString());
    }

    /**
     * @return the current run id or "NO-RUN" outside a run
     */
    public static String getCurrentRunId() {
        String runId = MDC.get(RUN_ID_KEY);
        return runId != null ? runId : "NO-RUN";
    }

    public static boolean hasRunContext() {
        return MDC.get(RUN_ID_KEY) != null;
    }

    public static void clear() {
        MDC.remove(RUN_ID_KEY);
        MDC.remove(SOURCE_FILE_ID_KEY);
    }
}
