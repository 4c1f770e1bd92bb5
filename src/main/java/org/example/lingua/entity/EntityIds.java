package org.example.lingua.entity;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Opaque 24-hex-character identifiers shared by every entity and exchanged with
 * the generation backend.
 */
public final class EntityIds {

    private static final Pattern ID_PATTERN = Pattern.compile("^[a-f0-9]{24}$");
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private EntityIds() {
    }

    public static String newId() {
        byte[] bytes = new byte[12];
        RANDOM.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    public static boolean isValid(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }
}
