package com.phillippitts.livescribe.service.align;

/**
 * Counters of a {@link TimestampAligner} since startup.
 *
 * @param attempted   alignment runs
 * @param successful  runs that aligned at least one target
 * @param cacheHits   subtitle files served from the parse cache
 * @param successRate successful / attempted, or 0.0 before the first run
 */
public record AlignmentStats(long attempted, long successful, long cacheHits, double successRate) { }
