package com.phillippitts.livescribe.service.align;

import com.phillippitts.livescribe.domain.AlignmentTarget;

import java.util.List;

/**
 * Result of aligning a target list.
 *
 * @param targets      copies of the input targets, in input order, aligned where possible
 * @param alignedCount targets that received a start timestamp
 * @param partial      true when fewer than the configured share of targets were aligned
 */
public record AlignmentReport(List<AlignmentTarget> targets, int alignedCount, boolean partial) {

    public AlignmentReport {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }
}
