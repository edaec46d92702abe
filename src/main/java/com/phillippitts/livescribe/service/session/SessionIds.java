package com.phillippitts.livescribe.service.session;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Session id generation: {@code <prefix>-yyyyMMdd-HHmmss-<8 hex>}, safe as a directory name.
 */
final class SessionIds {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private SessionIds() {}

    static String next(String prefix, Clock clock) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return prefix + "-" + LocalDateTime.now(clock).format(STAMP) + "-" + random;
    }
}
