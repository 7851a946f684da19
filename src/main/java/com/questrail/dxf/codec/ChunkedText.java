package com.questrail.dxf.codec;

import java.util.ArrayList;
import java.util.List;

/**
 * Long strings split across several groups.
 *
 * <p>A group value holds at most {@value #MAX_CHUNK_LENGTH} characters. Text that
 * fits is written as a single group on the primary code; longer text is written
 * as consecutive chunks, all on the continuation code. Reading concatenates
 * chunks in the order they arrive, whichever of the two codes they use.</p>
 *
 * <p>Value lines lose their leading whitespace when scanned, so a cut never
 * leaves whitespace at the start of the next chunk; the whitespace ends the
 * previous chunk instead. A cut never separates a surrogate pair.</p>
 */
public final class ChunkedText
{
    public static final int MAX_CHUNK_LENGTH = 250;

    private ChunkedText() {}

    public static List<String> split(String text) {
        List<String> chunks = new ArrayList<>();
        if (text.length() <= MAX_CHUNK_LENGTH) {
            chunks.add(text);
            return chunks;
        }
        int start = 0;
        while (start < text.length()) {
            int end = cutPoint(text, start);
            chunks.add(text.substring(start, end));
            start = end;
        }
        return chunks;
    }

    private static int cutPoint(String text, int start) {
        int limit = start + MAX_CHUNK_LENGTH;
        if (limit >= text.length()) {
            return text.length();
        }
        int end = limit;
        while (end > start + 1 && !isCleanCut(text, end)) {
            end--;
        }
        if (end > start + 1) {
            return end;
        }
        // A window of nothing but whitespace has no clean cut; keep pairs whole at least.
        return Character.isLowSurrogate(text.charAt(limit)) ? limit - 1 : limit;
    }

    private static boolean isCleanCut(String text, int end) {
        char next = text.charAt(end);
        return !Character.isWhitespace(next)
            && !(Character.isLowSurrogate(next) && Character.isHighSurrogate(text.charAt(end - 1)));
    }

    public static String append(String existing, String chunk) {
        return existing == null ? chunk : existing + chunk;
    }

    public static void write(GroupWriter out, int primaryCode, int continuationCode, String text) {
        List<String> chunks = split(text);
        if (chunks.size() == 1) {
            out.text(primaryCode, chunks.get(0));
            return;
        }
        for (String chunk : chunks) {
            out.text(continuationCode, chunk);
        }
    }
}
