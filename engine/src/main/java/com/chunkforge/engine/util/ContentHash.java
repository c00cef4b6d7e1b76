package com.chunkforge.engine.util;

import java.nio.charset.StandardCharsets;

/**
 * 64-bit FNV-1a content hash, rendered as 16 lowercase hex characters.
 *
 * Not cryptographic: used only to build cache keys and compare conversation
 * messages, where a rare collision costs a wrong cache hit at worst.
 */
public final class ContentHash {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME        = 0x100000001b3L;

    private ContentHash() {}

    public static String of(String content) {
        long hash = FNV_OFFSET_BASIS;
        byte[] bytes = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
        for (byte b : bytes) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return String.format("%016x", hash);
    }
}
