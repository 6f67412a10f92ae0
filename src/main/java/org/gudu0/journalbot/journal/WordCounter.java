package org.gudu0.journalbot.journal;

/**
 * Counts words as runs of non-whitespace characters.
 */
public final class WordCounter {
    private WordCounter() {}

    public static int count(String text) {
        if (text == null || text.isEmpty()) return 0;

        int words = 0;
        boolean inWord = false;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            // Covers Unicode spaces like NBSP and NEL too, not just ASCII.
            boolean space = Character.isWhitespace(cp) || Character.isSpaceChar(cp) || cp == 0x85;
            if (space) {
                inWord = false;
            } else if (!inWord) {
                inWord = true;
                words++;
            }
            i += Character.charCount(cp);
        }
        return words;
    }
}
