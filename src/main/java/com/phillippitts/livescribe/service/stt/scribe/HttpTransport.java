package com.phillippitts.livescribe.service.stt.scribe;

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * Sends a prepared HTTP request. Abstracted for testing.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * @throws IOException on connection or protocol failure
     * @throws InterruptedException if the calling thread is interrupted
     */
    HttpReply send(HttpRequest request) throws IOException, InterruptedException;

    /**
     * Status and body of a completed exchange.
     */
    record HttpReply(int statusCode, String body) {
        public HttpReply {
            body = body == null ? "" : body;
        }

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
