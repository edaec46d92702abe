package com.phillippitts.livescribe.service.stt.scribe;

import com.phillippitts.livescribe.config.stt.ScribeProperties;
import com.phillippitts.livescribe.domain.Word;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * HTTP client for the hosted speech-to-text service with integrated diarization.
 *
 * <p>Uploads a file as multipart/form-data to {@code {base-url}/v1/speech-to-text} with the
 * {@code xi-api-key} header and returns the word list.
 *
 * <p><b>Retry policy:</b> status 429, any 5xx, and network errors are transient. Up to
 * {@code scribe.max-retries} attempts are made in total; between attempts the client sleeps
 * {@code 2^attempt + uniform(0.2, 0.5)} seconds ({@code attempt} is 0-based). 422 and other
 * 4xx responses are not retried.
 */
public class ScribeClient {

    private static final Logger LOG = LogManager.getLogger(ScribeClient.class);

    /** Upload size limit enforced by the service. */
    static final long MAX_UPLOAD_BYTES = 3L * 1024 * 1024 * 1024;
    static final String ENDPOINT = "/v1/speech-to-text";
    private static final int ERROR_PREVIEW_CHARS = 200;

    private final ScribeProperties props;
    private final HttpTransport transport;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;

    public ScribeClient(ScribeProperties props) {
        this(props, new JdkHttpTransport(props.connectTimeout()), Sleeper.THREAD,
                () -> ThreadLocalRandom.current().nextDouble(0.2, 0.5));
    }

    // Package-private for tests
    ScribeClient(ScribeProperties props, HttpTransport transport, Sleeper sleeper, DoubleSupplier jitter) {
        this.props = Objects.requireNonNull(props, "props");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    public boolean isConfigured() {
        return props.hasApiKey();
    }

    /**
     * Uploads {@code audio} and returns recognized words with speaker and channel tags.
     *
     * @throws InvalidAudioException if the file is missing or over the upload limit
     * @throws ScribeException classified by {@link ScribeException.Reason}
     */
    public List<Word> transcribe(Path audio) {
        Objects.requireNonNull(audio, "audio");
        long size = validateSize(audio);
        ScribeRequest request = ScribeRequest.from(props);
        URI uri = URI.create(trimSlash(props.baseUrl()) + ENDPOINT);
        LOG.info("Uploading {} ({} bytes) for recognition: diarize={}, multiChannel={}",
                audio.getFileName(), size, request.diarize(), request.useMultiChannel());

        HttpTransport.HttpReply reply = sendWithRetry(uri, request, audio);
        if (reply.statusCode() == 422) {
            throw new ScribeException(ScribeException.Reason.REJECTED, 422,
                    "Validation error (422): " + validationDetail(reply.body()));
        }
        if (!reply.isSuccess()) {
            throw new ScribeException(ScribeException.Reason.HTTP_ERROR, reply.statusCode(),
                    "HTTP " + reply.statusCode() + " - " + LogSanitizer.truncate(reply.body(), ERROR_PREVIEW_CHARS));
        }
        try {
            List<Word> words = ScribeResponseParser.parseWords(reply.body());
            LOG.info("Recognition received: {} words", words.size());
            return words;
        } catch (RecognitionException e) {
            throw new ScribeException(ScribeException.Reason.INVALID_RESPONSE, reply.statusCode(),
                    e.getMessage(), e);
        }
    }

    private HttpTransport.HttpReply sendWithRetry(URI uri, ScribeRequest request, Path audio) {
        int maxAttempts = Math.max(1, props.maxRetries());
        int lastStatus = -1;
        String lastProblem = "no attempt made";
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                HttpTransport.HttpReply reply = transport.send(buildRequest(uri, request, audio));
                if (!isTransient(reply.statusCode())) {
                    return reply;
                }
                lastStatus = reply.statusCode();
                lastProblem = "HTTP " + reply.statusCode();
            } catch (IOException e) {
                lastStatus = -1;
                lastProblem = e.getClass().getSimpleName() + ": " + e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ScribeException(ScribeException.Reason.TRANSIENT_EXHAUSTED, lastStatus, "Interrupted", e);
            }
            if (attempt < maxAttempts - 1) {
                Duration backoff = backoff(attempt);
                LOG.warn("Attempt {}/{} failed ({}); retrying in {} ms",
                        attempt + 1, maxAttempts, lastProblem, backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ScribeException(ScribeException.Reason.TRANSIENT_EXHAUSTED, lastStatus,
                            "Interrupted during backoff", e);
                }
            }
        }
        throw new ScribeException(ScribeException.Reason.TRANSIENT_EXHAUSTED, lastStatus,
                "Failed after " + maxAttempts + " attempts: " + lastProblem);
    }

    Duration backoff(int attempt) {
        double seconds = Math.pow(2, attempt) + jitter.getAsDouble();
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    static boolean isTransient(int status) {
        return status == 429 || status >= 500;
    }

    private HttpRequest buildRequest(URI uri, ScribeRequest request, Path audio) throws IOException {
        MultipartBody body = new MultipartBody();
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(props.requestTimeout())
                .header("xi-api-key", props.apiKey())
                .header("Content-Type", body.contentType())
                .POST(body.publisher(request.formFields(), audio))
                .build();
    }

    private static long validateSize(Path audio) {
        try {
            long size = Files.size(audio);
            if (size > MAX_UPLOAD_BYTES) {
                throw new InvalidAudioException(size, "exceeds 3GB upload limit");
            }
            return size;
        } catch (IOException e) {
            throw new InvalidAudioException("cannot read " + audio.getFileName() + ": " + e.getMessage());
        }
    }

    private static String validationDetail(String body) {
        try {
            Object detail = new JSONObject(body).opt("detail");
            return detail == null ? "Unknown validation error" : LogSanitizer.truncate(detail.toString(), ERROR_PREVIEW_CHARS);
        } catch (JSONException e) {
            return LogSanitizer.truncate(body, ERROR_PREVIEW_CHARS);
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
