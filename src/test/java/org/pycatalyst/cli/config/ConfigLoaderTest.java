package org.pycatalyst.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.pycatalyst.compiler.api.TranslatorOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the configuration precedence of {@link ConfigLoader} and the mapping onto
 * {@link TranslatorOptions}.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    void testDefaultsComeFromReferenceConf() {
        Config config = ConfigLoader.load(null);

        assertThat(config.getString("pycatalyst.output-directory")).isEqualTo("output");
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
        assertThat(TranslatorOptions.fromConfig(config)).isEqualTo(TranslatorOptions.defaults());
    }

    @Test
    @Tag("unit")
    void testExplicitFileOverridesDefaults() throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "pycatalyst {\n  indent = \"\\t\"\n  entry-file-name = \"program\"\n}\n");

        Config config = ConfigLoader.load(file.toFile());
        TranslatorOptions options = TranslatorOptions.fromConfig(config);

        assertThat(options.indentUnit()).isEqualTo("\t");
        assertThat(options.entryFileName()).isEqualTo("program");
        assertThat(config.getString("pycatalyst.output-directory")).isEqualTo("output");
    }

    @Test
    @Tag("unit")
    void testSystemPropertyWinsOverFile() throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "pycatalyst.entry-file-name = \"fromfile\"\n");
        System.setProperty("pycatalyst.entry-file-name", "fromproperty");
        ConfigFactory.invalidateCaches();
        try {
            Config config = ConfigLoader.load(file.toFile());

            assertThat(TranslatorOptions.fromConfig(config).entryFileName()).isEqualTo("fromproperty");
        } finally {
            System.clearProperty("pycatalyst.entry-file-name");
            ConfigFactory.invalidateCaches();
        }
    }

    @Test
    @Tag("unit")
    void testMissingExplicitFileIsRejected() {
        File missing = tempDir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }
}
