package org.gudu0.journalbot.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageChunksTest {

    @Test
    void shortTextIsOneChunk() {
        assertThat(MessageChunks.split("hi", 2000)).containsExactly("hi");
    }

    @Test
    void longTextIsSplitAtTheLimit() {
        String text = "a".repeat(4500);

        List<String> chunks = MessageChunks.split(text, MessageChunks.DISCORD_LIMIT);

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(0)).hasSize(2000);
        assertThat(chunks.get(2)).hasSize(500);
        assertThat(String.join("", chunks)).isEqualTo(text);
    }

    @Test
    void surrogatePairsStayTogether() {
        String text = "a" + "😀".repeat(3);

        List<String> chunks = MessageChunks.split(text, 2);

        assertThat(String.join("", chunks)).isEqualTo(text);
        assertThat(chunks).allSatisfy(c -> assertThat(Character.isHighSurrogate(c.charAt(c.length() - 1))).isFalse());
    }

    @Test
    void emptyTextHasNoChunks() {
        assertThat(MessageChunks.split("", 2000)).isEmpty();
        assertThat(MessageChunks.split(null, 2000)).isEmpty();
    }
}
