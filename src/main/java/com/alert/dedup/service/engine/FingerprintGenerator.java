package com.alert.dedup.service.engine;

import com.alert.dedup.service.model.Alert;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Derives the deduplication key of an alert.
 *
 * The key is the MD5 hex digest of {@code type_server_client_message[:50]},
 * with documented defaults for absent fields. Id, timestamp, severity and
 * metadata do not take part.
 */
public class FingerprintGenerator {

    static final int MESSAGE_PREFIX_LENGTH = 50;

    public String fingerprint(Alert alert) {
        String message = alert.getMessageOrDefault();
        if (message.length() > MESSAGE_PREFIX_LENGTH) {
            message = message.substring(0, MESSAGE_PREFIX_LENGTH);
        }

        String key = String.join("_",
                alert.getTypeOrDefault(),
                alert.getServerOrDefault(),
                alert.getClientOrDefault(),
                message);
        return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
    }
}
