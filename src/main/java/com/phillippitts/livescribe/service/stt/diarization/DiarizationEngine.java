package com.phillippitts.livescribe.service.stt.diarization;

import com.phillippitts.livescribe.domain.DiarizationInterval;
import com.phillippitts.livescribe.exception.DiarizationUnavailableException;

import java.nio.file.Path;
import java.util.List;

/**
 * Standalone speaker diarization: who spoke when, without recognizing words.
 */
public interface DiarizationEngine {

    /**
     * @param wav canonical WAV file
     * @return speaker intervals in file time, ordered as the diarizer reported them
     * @throws DiarizationUnavailableException if the diarizer is not configured or fails
     */
    List<DiarizationInterval> diarize(Path wav);

    /** Whether a diarizer is configured and present. */
    boolean isAvailable();

    String getEngineName();
}
