package com.codescore.cli;

import com.codescore.core.parser.GrammarUnavailableException;
import com.codescore.core.parser.ParserSelector;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LanguagesCommand}.
 */
class LanguagesCommandTest {

    @Test
    void call_listsEveryLanguageWithItsTier() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        LanguagesCommand command = new LanguagesCommand(new ParserSelector((language, config) -> {
            throw new GrammarUnavailableException(language, "not loaded in tests");
        }));
        command.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));

        int exitCode = new CommandLine(command).execute();

        String text = output.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(text).startsWith("Supported Languages:");
        assertThat(text.lines().filter(line -> line.startsWith("  • "))).hasSize(14);
        assertThat(text).containsPattern("• Go\\s+pattern\\s+\\.go");
        assertThat(text).containsPattern("• C\\+\\+\\s+pattern\\s+\\.cpp \\.cc");
    }
}
