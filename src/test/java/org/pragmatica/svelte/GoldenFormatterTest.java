package org.pragmatica.svelte;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Golden tests: the components in format-examples/ are already formatted, so
 * formatting them must not change a single character.
 */
class GoldenFormatterTest {

    private static final Path EXAMPLES_DIR = Path.of("src/test/resources/format-examples");

    private SvelteFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = SvelteFormatter.svelteFormatter();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Component.svelte",
            "Blocks.svelte",
            "Text.svelte",
            "Attributes.svelte"
    })
    void formatter_keepsGoldenExamplesUnchanged(String fileName) throws IOException {
        var content = Files.readString(EXAMPLES_DIR.resolve(fileName));

        var formatted = formatter.format(content);

        if (!formatted.equals(content)) {
            System.err.println("=== Expected (" + fileName + ") ===");
            System.err.println(content);
            System.err.println("=== Actual ===");
            System.err.println(formatted);
            System.err.println("=== End ===");
        }
        assertThat(formatted).isEqualTo(content);
    }

    @Test
    void formatter_reportsAllGoldenExamplesAsFormatted() throws IOException {
        try (var files = Files.list(EXAMPLES_DIR)) {
            files.filter(path -> path.toString().endsWith(".svelte"))
                 .forEach(path -> {
                     try {
                         assertThat(formatter.isFormatted(Files.readString(path)))
                             .as(path.getFileName().toString())
                             .isTrue();
                     } catch (IOException e) {
                         fail("Cannot read " + path + ": " + e.getMessage());
                     }
                 });
        }
    }
}
