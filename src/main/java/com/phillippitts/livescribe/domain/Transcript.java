package com.phillippitts.livescribe.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Append-only aggregate of timestamped entries for one session.
 *
 * <p>The pipeline is the sole writer; readers take snapshots via {@link #entries()}.
 * Entries are never reordered or removed.
 */
public final class Transcript {

    private final String sessionId;
    private final Instant createdAt;
    private final Object lock = new Object();
    private final List<TimedText> entries = new ArrayList<>();
    private volatile String provider;

    public Transcript(String sessionId, Instant createdAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static Transcript start(String sessionId) {
        return new Transcript(sessionId, Instant.now());
    }

    public void append(TimedText entry) {
        Objects.requireNonNull(entry, "entry");
        synchronized (lock) {
            entries.add(entry);
        }
    }

    public void appendAll(Collection<? extends TimedText> more) {
        Objects.requireNonNull(more, "more");
        synchronized (lock) {
            for (TimedText t : more) {
                entries.add(Objects.requireNonNull(t, "entry"));
            }
        }
    }

    public List<TimedText> entries() {
        synchronized (lock) {
            return List.copyOf(entries);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Entry texts joined with single spaces, in append order.
     */
    public String fullText() {
        StringBuilder sb = new StringBuilder();
        for (TimedText t : entries()) {
            String text = t.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(text);
        }
        return sb.toString();
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String provider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }
}
