/**
 * Recognition and diarization capabilities.
 *
 * <p>{@link com.phillippitts.livescribe.service.stt.RecognitionEngine} is the once-initialized
 * recognizer handle shared by the live worker and the file tiers. Provider adapters live in
 * sub-packages: {@code whisper} (local process), {@code scribe} (hosted HTTP service with
 * integrated diarization) and {@code diarization} (external RTTM diarizer).
 */
package com.phillippitts.livescribe.service.stt;
