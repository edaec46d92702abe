package com.phillippitts.livescribe.service.transcript;

import java.nio.file.Path;

/**
 * Locations of the artifacts written for one session.
 */
public record TranscriptFiles(Path directory, Path json, Path text, Path srt, Path vtt) {
}
