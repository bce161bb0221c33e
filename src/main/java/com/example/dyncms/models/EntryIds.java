package com.example.dyncms.models;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Identifier scheme shared by content entries and media: canonical lowercase UUID strings.
 */
public final class EntryIds {

    public static final int LENGTH = 36;

    private static final Pattern CANONICAL =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    private EntryIds() {
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValid(String candidate) {
        return candidate != null
                && candidate.length() == LENGTH
                && CANONICAL.matcher(candidate).matches();
    }

    /** True when the token has the shape of an identifier, whether or not it is a valid one. */
    public static boolean looksLikeId(String candidate) {
        return candidate != null && candidate.length() == LENGTH;
    }
}
