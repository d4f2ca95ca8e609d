package com.mocha.supporters.sync.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlocklistLoaderTest {
    private final BlocklistLoader loader = new BlocklistLoader(new DefaultResourceLoader(), new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void loadsSlugsFromClasspath() {
        Blocklist blocklist = loader.load("classpath:blocklist-test.json");

        assertThat(blocklist.slugs()).containsExactlyInAnyOrder("spammy-casino", "link-farm");
        assertThat(blocklist.contains("link-farm")).isTrue();
        assertThat(blocklist.contains("mochajs")).isFalse();
        assertThat(blocklist.contains(null)).isFalse();
    }

    @Test
    void loadsSlugsFromFileAndSkipsBlankEntries() throws Exception {
        Path file = tempDir.resolve("blocklist.json");
        Files.writeString(file, "[\"one\", \"  \", 42, \" two \"]");

        Blocklist blocklist = loader.load(file.toUri().toString());

        assertThat(blocklist.slugs()).containsExactlyInAnyOrder("one", "two");
    }

    @Test
    void blankLocationMeansEmptyBlocklist() {
        assertThat(loader.load(" ").size()).isZero();
    }

    @Test
    void missingResourceFailsStartup() {
        assertThatThrownBy(() -> loader.load("classpath:does-not-exist.json"))
            .isInstanceOf(BlocklistLoadException.class)
            .hasMessageContaining("does-not-exist.json");
    }

    @Test
    void nonArrayContentIsRejected() throws Exception {
        Path file = tempDir.resolve("blocklist.json");
        Files.writeString(file, "{\"slugs\": [\"one\"]}");

        assertThatThrownBy(() -> loader.load(file.toUri().toString()))
            .isInstanceOf(BlocklistLoadException.class);
    }
}
