package org.gudu0.journalbot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypedConfigStoreTest {

    @TempDir
    Path dir;

    @Test
    void missingFileUsesDefaultsAndSaveWritesIt() throws Exception {
        Path file = dir.resolve("config.json");
        TypedConfigStore<BotConfig> store = new TypedConfigStore<>(file, BotConfig.class, BotConfig::new);

        assertThat(store.existed()).isFalse();
        assertThat(store.cfg().dailyWordRequirement).isEqualTo(500);

        store.cfg().sharedChannelId = "42";
        store.save();

        TypedConfigStore<BotConfig> reloaded = new TypedConfigStore<>(file, BotConfig.class, BotConfig::new);
        assertThat(reloaded.existed()).isTrue();
        assertThat(reloaded.cfg().sharedChannelId).isEqualTo("42");
        assertThat(dir.resolve("config.json.tmp")).doesNotExist();
    }

    @Test
    void unknownKeysAreIgnoredAndMissingKeysDefault() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"dailyWordRequirement\": 300, \"legacyOption\": true, \"access\": {\"maxAttempts\": 7}}");

        BotConfig cfg = new TypedConfigStore<>(file, BotConfig.class, BotConfig::new).cfg();

        assertThat(cfg.dailyWordRequirement).isEqualTo(300);
        assertThat(cfg.access.maxAttempts).isEqualTo(7);
        assertThat(cfg.access.timeoutSeconds).isEqualTo(5);
        assertThat(cfg.timezone).isEqualTo("America/New_York");
    }

    @Test
    void brokenFileIsNotReplacedByDefaults() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{ not json");

        assertThatThrownBy(() -> new TypedConfigStore<>(file, BotConfig.class, BotConfig::new))
                .isInstanceOf(ConfigInvalidException.class);
        assertThat(Files.readString(file)).isEqualTo("{ not json");
    }
}
