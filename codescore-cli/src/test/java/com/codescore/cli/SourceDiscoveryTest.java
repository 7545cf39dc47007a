package com.codescore.cli;

import com.codescore.core.analyzer.SourceFile;
import com.codescore.core.model.Language;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceDiscovery}.
 */
class SourceDiscoveryTest {

    @TempDir
    Path tempDir;

    @Test
    void discover_skipsDependencyDirectoriesAndUnknownFiles() throws IOException {
        write("src/app.js", "export const a = 1;\n");
        write("src/util/helper.py", "def helper():\n    pass\n");
        write("node_modules/lib/index.js", "module.exports = {};\n");
        write("build/out.js", "var x;\n");
        write("docs/readme.md", "# docs\n");

        List<SourceFile> files = new SourceDiscovery(List.of()).discover(tempDir);

        assertThat(files).extracting(SourceFile::filePath).containsExactly("src/app.js", "src/util/helper.py");
        assertThat(files).extracting(SourceFile::language).containsExactly(Language.JAVASCRIPT, Language.PYTHON);
        assertThat(files.get(0).content()).isEqualTo("export const a = 1;\n");
    }

    @Test
    void discover_appliesExcludeGlobsToRelativePaths() throws IOException {
        write("src/main.ts", "let a = 1;\n");
        write("src/generated/api.ts", "let b = 2;\n");
        write("generated/root.ts", "let c = 3;\n");
        write("bundle.min.js", "var d=4;\n");

        List<SourceFile> files = new SourceDiscovery(List.of("**/generated/**", "*.min.js")).discover(tempDir);

        assertThat(files).extracting(SourceFile::filePath).containsExactly("src/main.ts");
    }

    @Test
    void discover_nonUtf8File_returnedAsUnreadable() throws IOException {
        write("ok.go", "package ok\n");
        Files.write(tempDir.resolve("bad.go"), new byte[] {(byte) 0xC3, (byte) 0x28, (byte) 0xFF});

        List<SourceFile> files = new SourceDiscovery(List.of()).discover(tempDir);

        assertThat(files).extracting(SourceFile::filePath).containsExactly("bad.go", "ok.go");
        SourceFile bad = files.get(0);
        assertThat(bad.isSkipped()).isTrue();
        assertThat(bad.skipReason()).isEqualTo("not valid UTF-8");
        assertThat(bad.language()).isEqualTo(Language.GO);
        assertThat(files.get(1).isSkipped()).isFalse();
    }

    @Test
    void discover_emptyDirectory_returnsNothing() throws IOException {
        assertThat(new SourceDiscovery(List.of()).discover(tempDir)).isEmpty();
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
