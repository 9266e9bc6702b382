package com.workledger.api.worker;

import java.util.UUID;

/**
 * The out-of-process unit that searches the mailbox and parses timesheet attachments.
 */
public interface ExtractionWorker {

    /**
     * Runs the worker to completion or timeout. Never throws for worker-side problems
     * (bad exit, unreadable result, timeout); those come back as a failed result.
     */
    WorkerResult run(WorkerRequest request);

    /**
     * Deletes the result artifact left by {@link #run}. An already absent artifact is not an error.
     *
     * @return true when a file was actually removed
     */
    boolean discardResult(UUID jobId);
}
