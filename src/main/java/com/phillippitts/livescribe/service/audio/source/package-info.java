/**
 * ffmpeg-backed audio input: the live decode source and file conversion to canonical WAV.
 */
package com.phillippitts.livescribe.service.audio.source;
