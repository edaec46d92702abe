package com.phillippitts.livescribe.service.fallback;

import com.phillippitts.livescribe.domain.TimedText;
import com.phillippitts.livescribe.exception.AllProvidersExhaustedException;
import com.phillippitts.livescribe.exception.AllProvidersExhaustedException.Attempt;

import java.util.List;

/**
 * Final result of a fallback chain run.
 *
 * @param provider tier that produced the entries, or null on failure
 * @param entries  transcript entries (empty on failure)
 * @param attempts tiers that failed before the outcome was decided, in order
 * @param error    set only when every tier failed
 */
public record FallbackOutcome(String provider,
                              List<TimedText> entries,
                              List<Attempt> attempts,
                              AllProvidersExhaustedException error) {

    public FallbackOutcome {
        entries = entries == null ? List.of() : List.copyOf(entries);
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static FallbackOutcome success(String provider, List<TimedText> entries, List<Attempt> failedBefore) {
        return new FallbackOutcome(provider, entries, failedBefore, null);
    }

    public static FallbackOutcome failure(AllProvidersExhaustedException error) {
        return new FallbackOutcome(null, List.of(), error.getAttempts(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
