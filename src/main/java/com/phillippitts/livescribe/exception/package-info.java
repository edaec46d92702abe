/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.livescribe.exception.LiveScribeException} - Base exception</li>
 *   <li>{@link com.phillippitts.livescribe.exception.SourceUnavailableException} - decode process
 *       failed to start or exited immediately (terminal at session start)</li>
 *   <li>{@link com.phillippitts.livescribe.exception.RecognitionException} - a single recognition
 *       call failed (recovered per chunk or by the fallback chain)</li>
 *   <li>{@link com.phillippitts.livescribe.exception.DiarizationUnavailableException} - diarizer not
 *       configured or failed; output degrades to recognition-only</li>
 *   <li>{@link com.phillippitts.livescribe.exception.AllProvidersExhaustedException} - every
 *       provider failed (terminal, returned as a structured failure)</li>
 *   <li>{@link com.phillippitts.livescribe.exception.InvalidAudioException} - unusable audio input</li>
 * </ul>
 *
 * <p>Dropped chunks and rejected alignments are counted and logged, never thrown.
 *
 * @since 1.0
 */
package com.phillippitts.livescribe.exception;
