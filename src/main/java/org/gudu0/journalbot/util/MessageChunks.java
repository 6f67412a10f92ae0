package org.gudu0.journalbot.util;

import java.util.ArrayList;
import java.util.List;

public final class MessageChunks {

    /** Discord's per-message character limit. */
    public static final int DISCORD_LIMIT = 2000;

    private MessageChunks() {}

    /**
     * Splits text into consecutive pieces of at most {@code limit} chars.
     * Never splits a surrogate pair.
     */
    public static List<String> split(String text, int limit) {
        if (limit < 2) throw new IllegalArgumentException("limit must be >= 2");
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;

        int i = 0;
        while (i < text.length()) {
            int end = Math.min(text.length(), i + limit);
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) end--;
            out.add(text.substring(i, end));
            i = end;
        }
        return out;
    }
}
