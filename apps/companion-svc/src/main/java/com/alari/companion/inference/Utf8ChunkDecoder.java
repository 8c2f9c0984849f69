package com.alari.companion.inference;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Incremental UTF-8 decoding for a chunked body. Bytes of a character split across chunks are
 * held back until the rest arrives. One instance per stream; not thread-safe.
 */
final class Utf8ChunkDecoder {

    private static final byte[] EMPTY = new byte[0];

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    private byte[] pending = EMPTY;

    String decode(byte[] chunk) {
        byte[] input = pending.length == 0 ? chunk : concat(pending, chunk);
        ByteBuffer in = ByteBuffer.wrap(input);
        // UTF-8 never yields more chars than bytes
        CharBuffer out = CharBuffer.allocate(input.length);
        decoder.decode(in, out, false);
        pending = in.hasRemaining() ? copyRemaining(in) : EMPTY;
        out.flip();
        return out.toString();
    }

    boolean hasPendingBytes() {
        return pending.length > 0;
    }

    private static byte[] copyRemaining(ByteBuffer in) {
        byte[] rest = new byte[in.remaining()];
        in.get(rest);
        return rest;
    }

    private static byte[] concat(byte[] head, byte[] tail) {
        byte[] joined = new byte[head.length + tail.length];
        System.arraycopy(head, 0, joined, 0, head.length);
        System.arraycopy(tail, 0, joined, head.length, tail.length);
        return joined;
    }
}
