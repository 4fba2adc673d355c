package ca.nestsync.service;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;

/**
 * Opaque pagination cursors: base64 of {@code <kind>:<uuid>}.
 */
public final class Cursors {

    public static final String CHILD = "child";
    public static final String INVENTORY_ITEM = "inventory_item";
    public static final String USAGE_LOG = "usage_log";

    private Cursors() {
    }

    public static String encode(String kind, UUID id) {
        return Base64.getEncoder().encodeToString((kind + ":" + id).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if the cursor is malformed or of another kind
     */
    public static UUID decode(String kind, String cursor) {
        try {
            String raw = new String(Base64.getDecoder().decode(cursor), StandardCharsets.UTF_8);
            String prefix = kind + ":";
            if (!raw.startsWith(prefix)) {
                throw new IllegalArgumentException("Invalid cursor");
            }
            return UUID.fromString(raw.substring(prefix.length()));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid cursor", ex);
        }
    }
}
