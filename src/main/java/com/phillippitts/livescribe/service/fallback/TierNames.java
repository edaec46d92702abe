package com.phillippitts.livescribe.service.fallback;

/**
 * Configuration names of the built-in provider tiers.
 */
public final class TierNames {

    public static final String INTEGRATED_DIARIZATION = "integrated-diarization";
    public static final String RECOGNITION_WITH_DIARIZATION = "recognition-with-diarization";
    public static final String RECOGNITION_ONLY = "recognition-only";

    private TierNames() {}
}
