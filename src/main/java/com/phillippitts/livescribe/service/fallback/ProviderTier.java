package com.phillippitts.livescribe.service.fallback;

import java.nio.file.Path;

/**
 * One provider strategy in the file transcription fallback chain.
 */
public interface ProviderTier {

    /** Stable tier name used in configuration, events and metrics. */
    String name();

    /** Whether the tier's provider is configured and installed. Checked once when the chain is built. */
    boolean isAvailable();

    /**
     * Transcribes a canonical WAV file in a single attempt.
     * Implementations classify failures in the result instead of throwing.
     */
    ProviderResult transcribe(Path wav);
}
