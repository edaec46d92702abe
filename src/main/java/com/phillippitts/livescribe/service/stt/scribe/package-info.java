/**
 * Hosted speech-to-text client with integrated diarization: multipart upload, retry with
 * exponential backoff, and word-list parsing.
 */
package com.phillippitts.livescribe.service.stt.scribe;
