package com.phillippitts.livescribe.service.align;

import com.phillippitts.livescribe.config.properties.AlignmentProperties;
import com.phillippitts.livescribe.domain.AlignmentTarget;
import com.phillippitts.livescribe.domain.TimedText;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.service.transcript.CaptionFormat;
import com.phillippitts.livescribe.service.transcript.SubtitleParser;
import com.phillippitts.livescribe.service.transcript.TranscriptReader;
import com.phillippitts.livescribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Anchors derived summaries (chapters, highlights) onto a persisted transcript's timeline.
 *
 * <p><b>Algorithm:</b> segment texts are normalized and joined into one corpus, with a map from
 * corpus offset back to the source segment. Each target's normalized cue (its first
 * {@code alignment.max-cue-chars} characters) is matched against the corpus from the last accepted
 * offset onward, so alignment never moves backwards. A match shorter than
 * {@code min(cueLength * min-match-ratio, min-match-chars)} is rejected and the target stays
 * unaligned. A final pass bumps any timestamp smaller than its predecessor to
 * {@code previous + monotonic-step-seconds}.
 *
 * <p>Rejection is a partial result, not an error.
 *
 * <p><b>Thread Safety:</b> alignment itself is stateless; the subtitle cache and counters are
 * concurrent.
 */
public class TimestampAligner {

    private static final Logger LOG = LogManager.getLogger(TimestampAligner.class);

    private static final String JSON_EXTENSION = ".json";

    private final AlignmentProperties props;
    private final Map<String, List<TranscriptSegment>> cache = new ConcurrentHashMap<>();
    private final AtomicLong attempted = new AtomicLong();
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();

    public TimestampAligner(AlignmentProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public AlignmentReport align(List<AlignmentTarget> targets, List<? extends TimedText> segments) {
        Objects.requireNonNull(targets, "targets");
        Objects.requireNonNull(segments, "segments");
        attempted.incrementAndGet();
        if (targets.isEmpty() || segments.isEmpty()) {
            return new AlignmentReport(targets, 0, true);
        }
        Corpus corpus = Corpus.build(segments);
        if (corpus.text().isEmpty()) {
            return new AlignmentReport(targets, 0, true);
        }

        List<AlignmentTarget> aligned = new ArrayList<>(targets.size());
        int lastPosition = 0;
        for (int i = 0; i < targets.size(); i++) {
            AlignmentTarget target = targets.get(i);
            String cue = cueOf(target);
            if (cue.isEmpty()) {
                aligned.add(target);
                continue;
            }
            LongestCommonSubstring.Match match = LongestCommonSubstring.find(corpus.text(), lastPosition, cue);
            double required = Math.min(cue.length() * props.minMatchRatio(), props.minMatchChars());
            if (match.size() == 0 || match.size() < required) {
                LOG.debug("Target {} rejected: match {} < required {} ('{}')",
                        i + 1, match.size(), required, LogSanitizer.preview(target.title()));
                aligned.add(target);
                continue;
            }
            int offset = match.aStart();
            TimedText source = segments.get(corpus.segmentAt(offset));
            aligned.add(target.withStartTimestamp(source.start()));
            lastPosition = Math.max(offset, lastPosition);
            LOG.debug("Target {} aligned at {}s (match {} chars)", i + 1, source.start(), match.size());
        }

        List<AlignmentTarget> monotonic = enforceMonotonic(aligned);
        int count = (int) monotonic.stream().filter(AlignmentTarget::isAligned).count();
        if (count > 0) {
            successful.incrementAndGet();
        }
        boolean partial = count == 0 || count < targets.size() * props.partialThreshold();
        LOG.info("Timestamp alignment: {}/{} targets aligned against {} segments",
                count, targets.size(), segments.size());
        return new AlignmentReport(monotonic, count, partial);
    }

    /**
     * Aligns against a caption ({@code .srt}, {@code .vtt}) or persisted transcript ({@code .json})
     * file. Parsed files are cached by path. A missing or unsupported file yields an unaligned,
     * partial report.
     */
    public AlignmentReport alignToFile(List<AlignmentTarget> targets, Path file) {
        Objects.requireNonNull(targets, "targets");
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            LOG.warn("Alignment source not found: {}", file);
            attempted.incrementAndGet();
            return new AlignmentReport(targets, 0, true);
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (CaptionFormat.fromFileName(name) == null && !name.endsWith(JSON_EXTENSION)) {
            LOG.warn("Unsupported alignment source: {}", file.getFileName());
            attempted.incrementAndGet();
            return new AlignmentReport(targets, 0, true);
        }
        return align(targets, cachedSegments(file));
    }

    public AlignmentStats stats() {
        long a = attempted.get();
        long s = successful.get();
        return new AlignmentStats(a, s, cacheHits.get(), a == 0 ? 0.0 : (double) s / a);
    }

    public void clearCache() {
        cache.clear();
    }

    List<AlignmentTarget> enforceMonotonic(List<AlignmentTarget> targets) {
        List<AlignmentTarget> out = new ArrayList<>(targets.size());
        double last = 0.0;
        for (AlignmentTarget t : targets) {
            if (!t.isAligned()) {
                out.add(t);
                continue;
            }
            double ts = t.startTimestamp();
            if (ts < last) {
                double bumped = last + props.monotonicStepSeconds();
                LOG.debug("Correcting non-monotonic timestamp {}s -> {}s", ts, bumped);
                out.add(t.withStartTimestamp(bumped));
                last = bumped;
            } else {
                out.add(t);
                last = ts;
            }
        }
        return out;
    }

    private String cueOf(AlignmentTarget target) {
        String normalized = TextNormalizer.normalize(target.searchText());
        return normalized.length() <= props.maxCueChars()
                ? normalized
                : normalized.substring(0, props.maxCueChars());
    }

    private List<TranscriptSegment> cachedSegments(Path file) {
        String key = file.toAbsolutePath().normalize().toString();
        List<TranscriptSegment> cached = cache.get(key);
        if (cached != null) {
            cacheHits.incrementAndGet();
            return cached;
        }
        List<TranscriptSegment> parsed = List.copyOf(parse(file));
        cache.put(key, parsed);
        return parsed;
    }

    private static List<TranscriptSegment> parse(Path file) {
        if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(JSON_EXTENSION)) {
            try {
                return TranscriptReader.read(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read transcript " + file, e);
            }
        }
        return SubtitleParser.parseFile(file);
    }

    /**
     * Normalized segment texts joined by single spaces. Each non-empty segment owns its characters
     * plus the separator that follows it.
     */
    record Corpus(String text, int[] charToSegment) {

        static Corpus build(List<? extends TimedText> segments) {
            StringBuilder sb = new StringBuilder();
            List<Integer> owners = new ArrayList<>();
            for (int i = 0; i < segments.size(); i++) {
                String normalized = TextNormalizer.normalize(segments.get(i).text());
                if (normalized.isEmpty()) {
                    continue;
                }
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(normalized);
                for (int c = 0; c <= normalized.length(); c++) {
                    owners.add(i);
                }
            }
            int[] map = new int[owners.size()];
            for (int i = 0; i < map.length; i++) {
                map[i] = owners.get(i);
            }
            return new Corpus(sb.toString(), map);
        }

        int segmentAt(int offset) {
            return charToSegment[Math.min(offset, charToSegment.length - 1)];
        }
    }
}
