package com.phillippitts.livescribe.service.worker;

/**
 * Point-in-time counters of a {@link RecognitionWorker}.
 *
 * @param submitted chunks accepted into the queue
 * @param dropped chunks rejected because the queue was full or the worker was stopped
 * @param processed chunks recognized successfully
 * @param failed chunks whose recognition threw
 * @param filtered chunks or results discarded by the filters
 * @param evicted results evicted from a full result queue
 * @param pendingChunks chunks waiting for recognition
 * @param pendingResults segments waiting for the consumer
 * @param averageRtf running real-time factor (0 before the first recognition)
 */
public record WorkerStats(
        long submitted,
        long dropped,
        long processed,
        long failed,
        long filtered,
        long evicted,
        int pendingChunks,
        int pendingResults,
        double averageRtf
) { }
