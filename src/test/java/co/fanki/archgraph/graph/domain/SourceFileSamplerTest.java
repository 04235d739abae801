package co.fanki.archgraph.graph.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SourceFileSampler}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceFileSamplerTest {

    @Test
    void whenSampling_givenMixedTree_shouldBucketByLanguage(
            @TempDir final Path root) throws IOException {
        write(root, "pkg/a.py");
        write(root, "web/index.js");
        write(root, "cmd/main.go");
        write(root, "README.md");

        final SourceFileSample sample = new SourceFileSampler()
                .sample(root, 3000);

        assertEquals(3, sample.totalFiles());
        assertEquals(List.of(root.resolve("pkg/a.py")),
                sample.files(Language.PYTHON));
        assertEquals(1, sample.files(Language.JAVASCRIPT).size());
        assertEquals(1, sample.files(Language.GO).size());
        assertTrue(sample.files(Language.RUBY).isEmpty());
        assertFalse(sample.truncated());
    }

    @Test
    void whenSampling_givenDenylistedDirectories_shouldSkipThem(
            @TempDir final Path root) throws IOException {
        write(root, "node_modules/react/index.js");
        write(root, "vendor/lib.php");
        write(root, ".git/hooks/x.py");
        write(root, "__pycache__/a.py");
        write(root, "src/app.js");

        final SourceFileSample sample = new SourceFileSampler()
                .sample(root, 3000);

        assertEquals(List.of(root.resolve("src/app.js")), sample.allFiles());
    }

    @Test
    void whenSampling_givenCrowdedDirectory_shouldApplyPerDirectoryCap(
            @TempDir final Path root) throws IOException {
        for (int i = 0; i < 30; i++) {
            write(root, String.format("many/m%02d.py", i));
        }
        write(root, "many/nested/n.py");

        final SourceFileSample sample = new SourceFileSampler()
                .sample(root, 3000);

        assertEquals(21, sample.totalFiles());
        assertEquals(root.resolve("many/m00.py"),
                sample.files(Language.PYTHON).get(0));
        assertTrue(sample.files(Language.PYTHON)
                .contains(root.resolve("many/nested/n.py")));
        assertFalse(sample.files(Language.PYTHON)
                .contains(root.resolve("many/m25.py")));
    }

    @Test
    void whenSampling_givenMoreFilesThanGlobalCap_shouldStopAtCap(
            @TempDir final Path root) throws IOException {
        for (int d = 0; d < 12; d++) {
            for (int i = 0; i < 10; i++) {
                write(root, String.format("d%02d/f%02d.rb", d, i));
            }
        }

        final SourceFileSample sample = new SourceFileSampler()
                .sample(root, 1);

        assertEquals(SourceFileSampler.MIN_FILES, sample.totalFiles());
        assertTrue(sample.truncated());
    }

    @Test
    void whenClampingFileCap_givenOutOfRangeValues_shouldClamp() {
        assertEquals(100, SourceFileSampler.clampFileCap(-5));
        assertEquals(10_000, SourceFileSampler.clampFileCap(1_000_000));
        assertEquals(3000, SourceFileSampler.clampFileCap(3000));
    }

    private static void write(final Path root, final String relative)
            throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }

}
