package com.genads.api.store;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Opaque record identifiers: 24 lowercase hex characters,
 * a 4-byte epoch-seconds prefix followed by 8 random bytes.
 */
public final class RecordIds {

    public static final int LENGTH = 24;

    private static final Pattern WELL_FORMED = Pattern.compile("^[0-9a-fA-F]{24}$");
    private static final SecureRandom RANDOM = new SecureRandom();

    private RecordIds() {
    }

    public static String next(Instant now) {
        byte[] bytes = new byte[12];
        long seconds = now.getEpochSecond();
        bytes[0] = (byte) (seconds >>> 24);
        bytes[1] = (byte) (seconds >>> 16);
        bytes[2] = (byte) (seconds >>> 8);
        bytes[3] = (byte) seconds;

        byte[] random = new byte[8];
        RANDOM.nextBytes(random);
        System.arraycopy(random, 0, bytes, 4, random.length);

        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Lookups treat ids failing this check as "not found". Hex digits may be
     * either case.
     */
    public static boolean isWellFormed(String id) {
        return id != null && WELL_FORMED.matcher(id).matches();
    }

    /**
     * Stored form of a well-formed id.
     */
    public static String normalize(String id) {
        return id.toLowerCase(Locale.ROOT);
    }
}
