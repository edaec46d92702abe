/**
 * Immutable domain model of the transcription pipeline.
 *
 * <p>All value types are Java records that validate their shape in compact constructors,
 * so downstream code never re-checks provider payloads:
 * <ul>
 *   <li>{@link com.phillippitts.livescribe.domain.AudioChunk} - fixed-duration PCM slice</li>
 *   <li>{@link com.phillippitts.livescribe.domain.Word} - recognized word with optional speaker/channel</li>
 *   <li>{@link com.phillippitts.livescribe.domain.TranscriptSegment} - timestamped recognized text</li>
 *   <li>{@link com.phillippitts.livescribe.domain.SpeakerTurn} - merged same-speaker run of words</li>
 *   <li>{@link com.phillippitts.livescribe.domain.DiarizationInterval} - speaker-labeled time span</li>
 *   <li>{@link com.phillippitts.livescribe.domain.AlignmentTarget} - summary awaiting a timestamp</li>
 * </ul>
 *
 * <p>{@link com.phillippitts.livescribe.domain.Transcript} is the only mutable aggregate and is
 * append-only.
 *
 * @since 1.0
 */
package com.phillippitts.livescribe.domain;
