package dev.dimitra.auditor.files;

import dev.dimitra.auditor.model.FileContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Walks a repository and returns the files matching a union of glob patterns.
 *
 * <p>Iteration order is sorted patterns, then sorted paths; the first pattern to match a
 * path wins, so the output is deterministic for a given tree.
 */
public class FileSelector {

    private static final Logger log = LoggerFactory.getLogger(FileSelector.class);

    /** Dependency caches, VCS metadata and build output. Always excluded. */
    public static final List<String> DEFAULT_EXCLUDES = List.of(
            "node_modules", ".git", "__pycache__", ".venv", "venv", "dist", "build", "target");

    /** Larger files are presumed generated or vendored. */
    public static final long MAX_FILE_SIZE = 50_000;

    private final long maxFileSize;

    public FileSelector() {
        this(MAX_FILE_SIZE);
    }

    public FileSelector(long maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public List<FileContent> select(Path repoRoot, Collection<String> patterns, Collection<String> excludes)
            throws IOException {
        Set<String> exclude = new LinkedHashSet<>(DEFAULT_EXCLUDES);
        if (excludes != null) {
            for (String ex : excludes) {
                if (ex != null && !ex.isBlank()) exclude.add(trimSlashes(ex.trim()));
            }
        }

        List<String> candidates = walk(repoRoot, exclude);

        Set<String> seen = new LinkedHashSet<>();
        List<FileContent> files = new ArrayList<>();
        for (String pattern : new TreeSet<>(patterns)) {
            Glob glob = new Glob(pattern);
            for (String rel : candidates) {
                if (seen.contains(rel) || !glob.matches(rel)) continue;
                try {
                    byte[] bytes = Files.readAllBytes(repoRoot.resolve(rel));
                    files.add(new FileContent(rel, new String(bytes, StandardCharsets.UTF_8)));
                    seen.add(rel);
                } catch (IOException e) {
                    log.warn("Skipping unreadable file {}: {}", rel, e.getMessage());
                }
            }
        }
        return files;
    }

    /** Sorted relative paths of regular, non-excluded files under the size ceiling. */
    private List<String> walk(Path repoRoot, Set<String> exclude) throws IOException {
        TreeSet<String> out = new TreeSet<>();
        Files.walkFileTree(repoRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(repoRoot) && isExcluded(relative(repoRoot, dir), exclude)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) return FileVisitResult.CONTINUE;
                if (attrs.size() > maxFileSize) return FileVisitResult.CONTINUE;
                String rel = relative(repoRoot, file);
                if (!isExcluded(rel, exclude)) out.add(rel);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Skipping {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return new ArrayList<>(out);
    }

    static boolean isExcluded(String rel, Set<String> exclude) {
        String[] segments = rel.split("/");
        for (String ex : exclude) {
            if (ex.contains("/")) {
                if (rel.equals(ex) || rel.startsWith(ex + "/")) return true;
                continue;
            }
            for (String seg : segments) {
                if (seg.equals(ex)) return true;
            }
        }
        return false;
    }

    private static String relative(Path root, Path p) {
        return root.relativize(p).toString().replace('\\', '/');
    }

    private static String trimSlashes(String s) {
        String t = s;
        while (t.startsWith("/")) t = t.substring(1);
        while (t.endsWith("/")) t = t.substring(0, t.length() - 1);
        return t;
    }

    /** "**&#47;x" also matches "x" at the repository root. */
    private static final class Glob {
        private final PathMatcher matcher;
        private final PathMatcher rootMatcher;

        Glob(String pattern) {
            this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            this.rootMatcher = pattern.startsWith("**/")
                    ? FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3))
                    : null;
        }

        boolean matches(String rel) {
            Path p = Path.of(rel);
            return matcher.matches(p) || (rootMatcher != null && rootMatcher.matches(p));
        }
    }
}
