package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.Transcript;
import com.phillippitts.livescribe.service.fallback.FallbackOutcome;
import com.phillippitts.livescribe.service.transcript.TranscriptFiles;

/**
 * Result of a file transcription.
 *
 * @param sessionId  session id (also the output sub-directory name)
 * @param outcome    fallback chain outcome; check {@link FallbackOutcome#isSuccess()}
 * @param transcript the transcript, or null when every provider failed
 * @param files      persisted files, or null when nothing was written
 */
public record FileTranscriptionResult(String sessionId,
                                      FallbackOutcome outcome,
                                      Transcript transcript,
                                      TranscriptFiles files) {

    public boolean isSuccess() {
        return outcome.isSuccess();
    }
}
