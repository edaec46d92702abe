/**
 * External speaker diarization producing RTTM.
 */
package com.phillippitts.livescribe.service.stt.diarization;
