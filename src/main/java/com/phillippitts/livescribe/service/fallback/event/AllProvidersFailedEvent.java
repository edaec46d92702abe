package com.phillippitts.livescribe.service.fallback.event;

import java.time.Instant;

/** Published when no provider tier produced a transcript. */
public record AllProvidersFailedEvent(String reason, int attempts, Instant at) { }
