/**
 * whisper.cpp recognizer adapter: process invocation and JSON output parsing.
 */
package com.phillippitts.livescribe.service.stt.whisper;
