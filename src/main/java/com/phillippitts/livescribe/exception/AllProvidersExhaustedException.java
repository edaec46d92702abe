package com.phillippitts.livescribe.exception;

import java.util.List;

/**
 * Structured terminal failure: every provider in the fallback chain failed for one input.
 *
 * <p>Returned inside a fallback outcome rather than thrown, so callers can still flush partial work.
 */
public class AllProvidersExhaustedException extends LiveScribeException {

    /**
     * One failed tier attempt.
     *
     * @param provider tier name
     * @param kind     failure classification (e.g. TRANSIENT_EXHAUSTED)
     * @param message  short diagnostic, never transcript text
     */
    public record Attempt(String provider, String kind, String message) { }

    private final List<Attempt> attempts;

    public AllProvidersExhaustedException(List<Attempt> attempts) {
        super(buildMessage(attempts));
        this.attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public List<Attempt> getAttempts() {
        return attempts;
    }

    private static String buildMessage(List<Attempt> attempts) {
        if (attempts == null || attempts.isEmpty()) {
            return "All providers exhausted (no provider available)";
        }
        StringBuilder sb = new StringBuilder("All providers exhausted: ");
        for (int i = 0; i < attempts.size(); i++) {
            Attempt a = attempts.get(i);
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(a.provider()).append('=').append(a.kind());
        }
        return sb.toString();
    }
}
