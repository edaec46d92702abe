package com.phillippitts.livescribe.service.audio.source;

import java.time.Instant;

/**
 * Published when the decode source cannot start or dies before producing audio.
 *
 * @param reason short machine-friendly reason (e.g. DECODER_START_FAILED)
 * @param locator input locator
 * @param at when the failure was observed
 */
public record SourceErrorEvent(String reason, String locator, Instant at) { }
