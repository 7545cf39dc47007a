package com.codescore.cli;

import com.codescore.core.analyzer.SourceFile;
import com.codescore.core.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Walks a project directory and loads every file with a recognized language.
 *
 * <p>Dependency, build output and VCS directories are never entered. Exclude globs are
 * matched against the path relative to the project root, using {@code /} separators. Files
 * that are not valid UTF-8 or cannot be read are returned as
 * {@link SourceFile#unreadable unreadable} so the analyzer reports them as skipped.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * List<SourceFile> files = new SourceDiscovery(List.of("**&#47;generated/**")).discover(root);
 * }</pre>
 */
public class SourceDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SourceDiscovery.class);

    /** Directory names that are never walked. */
    public static final Set<String> IGNORED_DIRECTORIES = Set.of(
        ".git", "node_modules", "vendor", "dist", "build", "target", "__pycache__", ".venv", "venv"
    );

    private final List<PathMatcher> excludes = new ArrayList<>();

    public SourceDiscovery(List<String> excludeGlobs) {
        for (String glob : excludeGlobs) {
            excludes.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            // Java's ** does not match zero directories
            if (glob.startsWith("**/")) {
                excludes.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
            }
        }
    }

    /**
     * Discovers source files under a root directory.
     *
     * @param root project root
     * @return files sorted by relative path
     * @throws IOException if the directory cannot be walked
     */
    public List<SourceFile> discover(Path root) throws IOException {
        List<SourceFile> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && (IGNORED_DIRECTORIES.contains(dir.getFileName().toString())
                        || isExcluded(root.relativize(dir)))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                Path relative = root.relativize(file);
                Language language = Language.detect(file.getFileName().toString());
                if (language == Language.UNKNOWN || isExcluded(relative)) {
                    return FileVisitResult.CONTINUE;
                }
                files.add(read(file, toUnixPath(relative), language));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot read {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(Comparator.comparing(SourceFile::filePath));
        log.debug("Discovered {} source files under {}", files.size(), root);
        return files;
    }

    private boolean isExcluded(Path relative) {
        Path normalized = Path.of(toUnixPath(relative));
        for (PathMatcher matcher : excludes) {
            if (matcher.matches(normalized)) {
                return true;
            }
        }
        return false;
    }

    private static SourceFile read(Path file, String relativePath, Language language) {
        try {
            return new SourceFile(relativePath, language, Files.readString(file));
        } catch (MalformedInputException e) {
            log.debug("Not valid UTF-8: {}", file);
            return SourceFile.unreadable(relativePath, language, "not valid UTF-8");
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", file, e.getMessage());
            return SourceFile.unreadable(relativePath, language, "cannot read: " + e.getMessage());
        }
    }

    private static String toUnixPath(Path path) {
        return path.toString().replace('\\', '/');
    }
}
