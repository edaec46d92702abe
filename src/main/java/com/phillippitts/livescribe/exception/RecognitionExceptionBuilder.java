package com.phillippitts.livescribe.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link RecognitionException} with diagnostic context.
 *
 * <pre>
 * throw RecognitionExceptionBuilder.create("Process failed")
 *         .engine("whisper")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * <p>Resulting message format:
 * {@code {message} (exitCode={code}, durationMs={ms}, {key}={value}, ...) (engine: {engine})}
 */
public final class RecognitionExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RecognitionExceptionBuilder(String message) {
        this.message = message;
    }

    public static RecognitionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RecognitionExceptionBuilder(message);
    }

    public RecognitionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public RecognitionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public RecognitionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public RecognitionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message. Null keys or values are skipped.
     */
    public RecognitionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public RecognitionException build() {
        String detailed = buildDetailedMessage();
        String engine = engineName != null ? engineName : "unknown";
        if (cause != null) {
            return new RecognitionException(detailed, engine, cause);
        }
        return new RecognitionException(detailed, engine);
    }

    private String buildDetailedMessage() {
        StringBuilder details = new StringBuilder();
        if (exitCode != null) {
            details.append("exitCode=").append(exitCode);
        }
        if (durationMs != null) {
            appendSeparator(details);
            details.append("durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            appendSeparator(details);
            details.append(entry.getKey()).append('=').append(entry.getValue());
        }
        if (details.length() == 0) {
            return message;
        }
        return message + " (" + details + ")";
    }

    private static void appendSeparator(StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append(", ");
        }
    }
}
