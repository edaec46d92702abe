package com.phillippitts.livescribe.service.stt.scribe;

import com.phillippitts.livescribe.config.stt.ScribeProperties;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Form fields for one speech-to-text upload.
 *
 * <p>The service rejects (422) a diarization threshold unless diarization is on and no speaker
 * count is given, so {@link #formFields()} only emits it in that case. Booleans are sent as
 * lowercase strings.
 *
 * @param modelId recognition model
 * @param diarize request speaker labels
 * @param useMultiChannel transcribe channels separately
 * @param numSpeakers expected speaker count, or null
 * @param diarizationThreshold speaker separation threshold, or null
 */
public record ScribeRequest(
        String modelId,
        boolean diarize,
        boolean useMultiChannel,
        Integer numSpeakers,
        Double diarizationThreshold
) {
    static final String TIMESTAMPS_GRANULARITY = "word";

    public ScribeRequest {
        Objects.requireNonNull(modelId, "modelId");
    }

    public static ScribeRequest from(ScribeProperties props) {
        return new ScribeRequest(props.modelId(), props.diarize(), props.useMultiChannel(),
                props.numSpeakers(), props.diarizationThreshold());
    }

    public Map<String, String> formFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("model_id", modelId);
        fields.put("timestamps_granularity", TIMESTAMPS_GRANULARITY);
        fields.put("diarize", String.valueOf(diarize));
        if (useMultiChannel) {
            fields.put("use_multi_channel", "true");
        }
        if (numSpeakers != null) {
            fields.put("num_speakers", String.valueOf(numSpeakers));
        }
        if (sendsThreshold()) {
            fields.put("diarization_threshold", String.valueOf(diarizationThreshold));
        }
        return fields;
    }

    boolean sendsThreshold() {
        return diarize && numSpeakers == null && diarizationThreshold != null;
    }
}
