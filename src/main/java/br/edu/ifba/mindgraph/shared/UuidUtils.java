package br.edu.ifba.mindgraph.shared;

import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.util.UUID;

/**
 * Time-ordered identifiers for nodes, edges, turns and log entries.
 */
public final class UuidUtils {

    private static final SecureRandom random = new SecureRandom();

    private UuidUtils() {
    }

    /**
     * Generates a UUID v7: 48-bit millisecond timestamp followed by random bits,
     * so ids sort by creation time.
     */
    public static UUID randomV7() {
        final byte[] value = new byte[16];
        random.nextBytes(value);
        final ByteBuffer timestamp = ByteBuffer.allocate(Long.BYTES);
        timestamp.putLong(System.currentTimeMillis());
        System.arraycopy(timestamp.array(), 2, value, 0, 6);
        value[6] = (byte) ((value[6] & 0x0F) | 0x70);
        value[8] = (byte) ((value[8] & 0x3F) | 0x80);
        final ByteBuffer buf = ByteBuffer.wrap(value);
        return new UUID(buf.getLong(), buf.getLong());
    }

    public static String newId() {
        return randomV7().toString();
    }

    /**
     * Extracts the millisecond timestamp of a v7 UUID.
     *
     * @throws IllegalArgumentException if the UUID is not version 7
     */
    public static long timestampMillis(final UUID uuid) {
        if (uuid.version() != 7) {
            throw new IllegalArgumentException("Not a UUID v7: " + uuid);
        }
        return uuid.getMostSignificantBits() >>> 16;
    }
}
