package dev.dimitra.auditor.files;

import dev.dimitra.auditor.model.FileContent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FileSelectorTest {

    @TempDir
    Path repo;

    private final FileSelector selector = new FileSelector();

    private void write(String rel, String content) throws IOException {
        Path p = repo.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content);
    }

    private List<String> paths(List<FileContent> files) {
        return files.stream().map(FileContent::path).toList();
    }

    @Test
    @DisplayName("caller and default excludes leave only src/app.py")
    void excludesVendorAndDependencyCache() throws Exception {
        write("src/app.py", "print('hi')");
        write("vendor/lib.py", "x = 1");
        write("node_modules/pkg/index.py", "y = 2");

        List<FileContent> files = selector.select(repo, List.of("**/*.py"), List.of("vendor"));

        assertThat(paths(files)).containsExactly("src/app.py");
        assertThat(files.get(0).content()).isEqualTo("print('hi')");
    }

    @Test
    @DisplayName("a **/ pattern also matches files at the repository root")
    void doubleStarMatchesRoot() throws Exception {
        write("setup.py", "");
        write("pkg/mod.py", "");

        assertThat(paths(selector.select(repo, List.of("**/*.py"), List.of())))
                .containsExactly("pkg/mod.py", "setup.py");
    }

    @Test
    @DisplayName("patterns are visited sorted and the first matching pattern claims a file")
    void firstPatternWinsAndNoDuplicates() throws Exception {
        write("a.yml", "");
        write("b.py", "");
        write("c.py", "");

        List<FileContent> files = selector.select(repo, List.of("**/*.yml", "**/*.py", "**/b.py"), List.of());

        // sorted patterns: **/*.py, **/*.yml, **/b.py
        assertThat(paths(files)).containsExactly("b.py", "c.py", "a.yml");
    }

    @Test
    void oversizedFilesAreSkipped() throws Exception {
        write("small.py", "x");
        write("big.py", "x".repeat((int) FileSelector.MAX_FILE_SIZE + 1));

        assertThat(paths(selector.select(repo, List.of("**/*.py"), List.of()))).containsExactly("small.py");
    }

    @Test
    @DisplayName("excludes match whole segments or path prefixes, not substrings")
    void excludeMatching() {
        Set<String> ex = Set.of("build", "src/generated");

        assertThat(FileSelector.isExcluded("build/out.py", ex)).isTrue();
        assertThat(FileSelector.isExcluded("app/build/out.py", ex)).isTrue();
        assertThat(FileSelector.isExcluded("src/generated/x.py", ex)).isTrue();
        assertThat(FileSelector.isExcluded("buildtools/x.py", ex)).isFalse();
        assertThat(FileSelector.isExcluded("rebuild.py", ex)).isFalse();
        assertThat(FileSelector.isExcluded("src/generated_code/x.py", ex)).isFalse();
    }

    @Test
    void prefixExcludeSkipsNestedDirectory() throws Exception {
        write("src/generated/x.py", "");
        write("src/main.py", "");

        assertThat(paths(selector.select(repo, List.of("**/*.py"), List.of("src/generated/"))))
                .containsExactly("src/main.py");
    }

    @Test
    void malformedUtf8IsReplacedNotFatal() throws Exception {
        Files.write(repo.resolve("bad.py"), new byte[]{'a', (byte) 0xC3, (byte) 0x28});

        List<FileContent> files = selector.select(repo, List.of("*.py"), List.of());

        assertThat(files).hasSize(1);
        assertThat(files.get(0).content()).startsWith("a").contains("�");
    }
}
