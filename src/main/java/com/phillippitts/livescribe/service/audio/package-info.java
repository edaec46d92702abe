/**
 * Audio format constants, chunking and energy measures for the canonical 16 kHz mono PCM stream.
 *
 * <p>The decode source lives in {@code service.audio.source}.
 */
package com.phillippitts.livescribe.service.audio;
