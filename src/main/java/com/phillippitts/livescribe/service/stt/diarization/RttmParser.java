package com.phillippitts.livescribe.service.stt.diarization;

import com.phillippitts.livescribe.domain.DiarizationInterval;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses RTTM speaker lines:
 * {@code SPEAKER <file> <chan> <start> <dur> <NA> <NA> <label> <NA> <NA>}.
 *
 * <p>Other record types, comments and malformed lines are skipped.
 */
public final class RttmParser {

    private static final Logger LOG = LogManager.getLogger(RttmParser.class);
    private static final int MIN_FIELDS = 8;

    private RttmParser() {}

    public static List<DiarizationInterval> parse(String rttm) {
        List<DiarizationInterval> intervals = new ArrayList<>();
        if (rttm == null || rttm.isBlank()) {
            return intervals;
        }
        int skipped = 0;
        for (String line : rttm.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] f = trimmed.split("\\s+");
            if (f.length < MIN_FIELDS || !"SPEAKER".equals(f[0])) {
                skipped++;
                continue;
            }
            try {
                double start = Double.parseDouble(f[3]);
                double duration = Double.parseDouble(f[4]);
                if (duration < 0) {
                    skipped++;
                    continue;
                }
                intervals.add(new DiarizationInterval(f[7], start, start + duration));
            } catch (NumberFormatException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            LOG.debug("Skipped {} non-speaker or malformed RTTM lines", skipped);
        }
        return intervals;
    }
}
