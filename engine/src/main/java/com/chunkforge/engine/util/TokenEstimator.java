package com.chunkforge.engine.util;

/**
 * Cheap token estimate used for budgeting and cache accounting:
 * roughly 3.5 characters per token, rounded up.
 */
public final class TokenEstimator {

    private static final double CHARS_PER_TOKEN = 3.5;

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
    }
}
