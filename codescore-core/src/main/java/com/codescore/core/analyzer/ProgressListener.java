package com.codescore.core.analyzer;

/**
 * Receives progress updates while files are analyzed.
 *
 * <p>Called once after each file finishes, whether it was analyzed, skipped or failed.
 * Calls may arrive from worker threads.
 */
@FunctionalInterface
public interface ProgressListener {

    /** Listener that ignores every update. */
    ProgressListener NONE = (completed, total) -> { };

    /**
     * @param completed files finished so far
     * @param total files submitted
     */
    void onProgress(int completed, int total);
}
