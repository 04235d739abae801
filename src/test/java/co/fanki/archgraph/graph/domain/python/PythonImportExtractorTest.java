package co.fanki.archgraph.graph.domain.python;

import co.fanki.archgraph.graph.domain.ExtractionContext;
import co.fanki.archgraph.graph.domain.FileImports;
import co.fanki.archgraph.graph.domain.ImportTarget;
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
 * Unit tests for {@link PythonImportExtractor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PythonImportExtractorTest {

    private final PythonImportExtractor extractor = new PythonImportExtractor();

    @Test
    void whenExtracting_givenFromImport_shouldTargetModule(
            @TempDir final Path root) throws IOException {
        final Path file = write(root, "pkg/a.py",
                "from pkg.b import helper\n");

        final FileImports imports = extract(root, file);

        assertEquals("pkg.a", imports.sourceId());
        assertEquals("python", imports.language());
        assertEquals(List.of("pkg.b"), ids(imports));
    }

    @Test
    void whenExtracting_givenPackageInit_shouldUsePackageName(
            @TempDir final Path root) throws IOException {
        final Path file = write(root, "pkg/__init__.py", "import os\n");

        assertEquals("pkg", extract(root, file).sourceId());
    }

    @Test
    void whenExtracting_givenCommaListWithAliases_shouldSplitAndTruncate(
            @TempDir final Path root) throws IOException {
        final Path file = write(root, "app.py", """
                import os, numpy as np
                import google.cloud.storage.blob
                """);

        assertEquals(List.of("os", "numpy", "google.cloud.storage"),
                ids(extract(root, file)));
    }

    @Test
    void whenExtracting_givenRelativeImports_shouldResolveAgainstPackage(
            @TempDir final Path root) throws IOException {
        final Path file = write(root, "pkg/sub/mod.py", """
                from . import sibling
                from .util import x
                from ..core import y
                """);

        assertEquals(List.of("pkg.sub", "pkg.sub.util", "pkg.core"),
                ids(extract(root, file)));
    }

    @Test
    void whenExtracting_givenRelativeImportAboveRoot_shouldSkipIt(
            @TempDir final Path root) throws IOException {
        final Path file = write(root, "top.py", "from ... import nothing\n");

        assertTrue(extract(root, file).targets().isEmpty());
    }

    @Test
    void whenExtracting_givenImportWordInsideText_shouldIgnoreIt(
            @TempDir final Path root) throws IOException {
        final Path file = write(root, "doc.py", """
                x = "we import things"
                # from here import there
                """);

        assertTrue(extract(root, file).targets().isEmpty());
    }

    @Test
    void whenExtracting_givenAnyTarget_shouldNotMarkItInternal(
            @TempDir final Path root) throws IOException {
        final Path file = write(root, "pkg/a.py", "import pkg.b\n");

        assertFalse(extract(root, file).targets().get(0).internal());
    }

    private FileImports extract(final Path root, final Path file)
            throws IOException {
        return extractor.extract(file, Files.readString(file),
                ExtractionContext.forCheckout(root)).orElseThrow();
    }

    private static List<String> ids(final FileImports imports) {
        return imports.targets().stream().map(ImportTarget::id).toList();
    }

    private static Path write(final Path root, final String relative,
            final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

}
