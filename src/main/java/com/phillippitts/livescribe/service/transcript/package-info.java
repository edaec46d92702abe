/**
 * Transcript assembly and export: the rolling live transcript, word-to-turn segmentation,
 * diarization reconciliation, caption rendering and parsing, and transcript persistence.
 */
package com.phillippitts.livescribe.service.transcript;
