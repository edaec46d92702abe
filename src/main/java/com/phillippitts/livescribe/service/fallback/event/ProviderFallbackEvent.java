package com.phillippitts.livescribe.service.fallback.event;

import java.time.Instant;

/** Published when a provider tier fails and the chain moves on to the next tier. */
public record ProviderFallbackEvent(String tier, String kind, String reason, Instant at) { }
