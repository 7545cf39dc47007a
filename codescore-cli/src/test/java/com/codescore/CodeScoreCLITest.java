package com.codescore;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CodeScoreCLI}.
 */
class CodeScoreCLITest {

    @TempDir
    Path tempDir;

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }

    @AfterEach
    void restoreLogLevel() {
        rootLogger().setLevel(Level.INFO);
    }

    @Test
    void execute_version_succeeds() {
        assertThat(CodeScoreCLI.commandLine(new CodeScoreCLI()).execute("--version")).isZero();
    }

    @Test
    void execute_unknownOption_returnsUsageError() {
        assertThat(CodeScoreCLI.commandLine(new CodeScoreCLI()).execute("--frobnicate")).isEqualTo(2);
    }

    @Test
    void execute_quietFlag_raisesRootLevelToError() {
        CodeScoreCLI cli = new CodeScoreCLI();

        int exitCode = CodeScoreCLI.commandLine(cli).execute("-q", "analyze", tempDir.toString(), "--json");

        assertThat(exitCode).isZero();
        assertThat(cli.isQuiet()).isTrue();
        assertThat(rootLogger().getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void execute_verboseFlag_lowersRootLevelToDebug() {
        CodeScoreCLI cli = new CodeScoreCLI();

        CodeScoreCLI.commandLine(cli).execute("-v");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(rootLogger().getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void execute_analyzeMissingDirectory_returnsTwo() {
        int exitCode = CodeScoreCLI.commandLine(new CodeScoreCLI())
            .execute("analyze", tempDir.resolve("nope").toString());

        assertThat(exitCode).isEqualTo(2);
    }
}
