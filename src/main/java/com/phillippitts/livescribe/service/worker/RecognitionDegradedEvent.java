package com.phillippitts.livescribe.service.worker;

import java.time.Instant;

/**
 * Published once per streak when recognition keeps running slower than real time.
 *
 * @param engine recognizer name
 * @param averageRtf running real-time factor when the streak was detected
 * @param consecutiveChunks length of the slow streak
 * @param at detection time
 */
public record RecognitionDegradedEvent(String engine, double averageRtf, int consecutiveChunks, Instant at) { }
