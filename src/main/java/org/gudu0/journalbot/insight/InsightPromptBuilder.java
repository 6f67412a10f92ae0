package org.gudu0.journalbot.insight;

import org.gudu0.journalbot.store.JournalEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the model prompt from a day's entries. Authors are anonymized as "Journal 1..N",
 * numbered in order of each author's first entry.
 */
public final class InsightPromptBuilder {

    private static final Comparator<JournalEntry> BY_TIME =
            Comparator.comparing(JournalEntry::createdAt).thenComparingLong(JournalEntry::id);

    private InsightPromptBuilder() {}

    public static List<String> anonymizedJournals(List<JournalEntry> entries) {
        Map<Long, List<JournalEntry>> byUser = entries.stream()
                .sorted(BY_TIME)
                .collect(Collectors.groupingBy(JournalEntry::userId, LinkedHashMap::new, Collectors.toList()));

        List<String> out = new ArrayList<>();
        int n = 1;
        for (List<JournalEntry> userEntries : byUser.values()) {
            String text = userEntries.stream()
                    .map(JournalEntry::content)
                    .collect(Collectors.joining("\n\n"));
            out.add("Journal " + n++ + ":\n" + text);
        }
        return out;
    }

    public static String build(List<JournalEntry> entries, String request) {
        String journals = String.join("\n\n---\n\n", anonymizedJournals(entries));
        return "You have access to journal entries from multiple users from today.\n"
                + "Here are the journals:\n\n"
                + journals
                + "\n\nUser's request: " + request
                + "\n\nPlease respond to the user's request based on these journal entries.";
    }
}
