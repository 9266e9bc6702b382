package com.workledger.api.worker;

import com.workledger.api.dto.ExtractedEntry;

import java.util.List;

/**
 * Exactly one of these is produced per worker invocation.
 */
public record WorkerResult(
        Outcome outcome,
        List<ExtractedEntry> extractedData,
        String message,
        List<String> errors
) {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        TIMED_OUT
    }

    public static WorkerResult succeeded(List<ExtractedEntry> extractedData, String message) {
        return new WorkerResult(Outcome.SUCCEEDED,
                extractedData != null ? List.copyOf(extractedData) : List.of(), message, List.of());
    }

    public static WorkerResult failed(String message, List<String> errors) {
        return new WorkerResult(Outcome.FAILED, List.of(), message, errors != null ? errors : List.of());
    }

    public static WorkerResult timedOut(String message, List<String> errors) {
        return new WorkerResult(Outcome.TIMED_OUT, List.of(), message, errors != null ? errors : List.of());
    }

    public boolean success() {
        return outcome == Outcome.SUCCEEDED;
    }
}
