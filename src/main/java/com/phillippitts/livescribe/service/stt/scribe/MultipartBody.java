package com.phillippitts.livescribe.service.stt.scribe;

import java.io.FileNotFoundException;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

/**
 * Hand-built multipart/form-data body: text fields first, then the audio file part.
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="model_id"
 *
 * scribe_v1
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="audio.wav"
 * Content-Type: audio/wav
 *
 * [binary data]
 * --boundary--
 * </pre>
 *
 * <p>The file is streamed from disk rather than loaded into memory.
 */
final class MultipartBody {

    private final String boundary;

    MultipartBody() {
        this("livescribe-" + UUID.randomUUID());
    }

    MultipartBody(String boundary) {
        this.boundary = boundary;
    }

    String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    BodyPublisher publisher(Map<String, String> fields, Path file) throws FileNotFoundException {
        return BodyPublishers.concat(
                BodyPublishers.ofByteArray(head(fields, file.getFileName().toString())),
                BodyPublishers.ofFile(file),
                BodyPublishers.ofByteArray(tail()));
    }

    byte[] head(Map<String, String> fields, String filename) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            sb.append("--").append(boundary).append("\r\n");
            sb.append("Content-Disposition: form-data; name=\"").append(field.getKey()).append("\"\r\n\r\n");
            sb.append(field.getValue()).append("\r\n");
        }
        sb.append("--").append(boundary).append("\r\n");
        sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"").append(filename).append("\"\r\n");
        sb.append("Content-Type: audio/wav\r\n\r\n");
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    byte[] tail() {
        return ("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8);
    }
}
