package com.phillippitts.livescribe.service.fallback;

import com.phillippitts.livescribe.domain.TimedText;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one provider tier attempt: either entries or a classified failure.
 *
 * <p>Tiers return this instead of throwing so the chain decides on fallback by inspecting the kind.
 *
 * @param provider tier name
 * @param entries  transcript entries in time order (empty on failure)
 * @param failure  failure kind, or null on success
 * @param message  short diagnostic on failure, never transcript text
 */
public record ProviderResult(String provider, List<TimedText> entries, FailureKind failure, String message) {

    public ProviderResult {
        Objects.requireNonNull(provider, "provider");
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Successful result. An empty entry list is reported as {@link FailureKind#EMPTY_RESULT}.
     */
    public static ProviderResult ok(String provider, List<? extends TimedText> entries) {
        if (entries == null || entries.isEmpty()) {
            return err(provider, FailureKind.EMPTY_RESULT, "no transcript entries");
        }
        return new ProviderResult(provider, List.copyOf(entries), null, null);
    }

    public static ProviderResult err(String provider, FailureKind kind, String message) {
        return new ProviderResult(provider, List.of(), Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isOk() {
        return failure == null;
    }
}
