package co.fanki.archgraph.graph.domain.golang;

import co.fanki.archgraph.graph.domain.ExtractionContext;
import co.fanki.archgraph.graph.domain.FileImports;
import co.fanki.archgraph.graph.domain.ImportTarget;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GoImportExtractor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GoImportExtractorTest {

    private final GoImportExtractor extractor = new GoImportExtractor();

    @Test
    void whenExtracting_givenModuleImport_shouldRewriteToInternalPath(
            @TempDir final Path root) throws IOException {
        Files.writeString(root.resolve("go.mod"),
                "module example.com/app\n\ngo 1.21\n");
        final Path file = write(root, "main.go", """
                package main

                import (
                    "fmt"
                    "example.com/app/util"
                )
                """);

        final FileImports imports = extract(root, file);

        assertEquals("main", imports.sourceId());
        assertEquals("go", imports.language());
        final ImportTarget fmt = imports.targets().get(0);
        final ImportTarget util = imports.targets().get(1);
        assertEquals("fmt", fmt.id());
        assertFalse(fmt.internal());
        assertEquals("util", util.id());
        assertTrue(util.internal());
    }

    @Test
    void whenExtracting_givenSingleAliasedImport_shouldCaptureIt(
            @TempDir final Path root) throws IOException {
        final Path file = write(root, "cmd/run.go", """
                package cmd

                import log "github.com/sirupsen/logrus"
                import "os"
                """);

        final FileImports imports = extract(root, file);

        assertEquals("cmd/run", imports.sourceId());
        assertEquals(List.of("github.com/sirupsen/logrus", "os"),
                imports.targets().stream().map(ImportTarget::id).toList());
    }

    @Test
    void whenExtracting_givenImportOfModuleRoot_shouldKeepModuleId(
            @TempDir final Path root) throws IOException {
        Files.writeString(root.resolve("go.mod"), "module example.com/app\n");
        final Path file = write(root, "x/x.go",
                "package x\nimport \"example.com/app\"\n");

        final ImportTarget target = extract(root, file).targets().get(0);

        assertEquals("example.com/app", target.id());
        assertTrue(target.internal());
    }

    @Test
    void whenDetectingModule_givenNoGoMod_shouldReturnEmpty(
            @TempDir final Path root) {
        assertEquals(Optional.empty(), GoImportExtractor.detectModule(root));
    }

    private FileImports extract(final Path root, final Path file)
            throws IOException {
        return extractor.extract(file, Files.readString(file),
                ExtractionContext.forCheckout(root)).orElseThrow();
    }

    private static Path write(final Path root, final String relative,
            final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

}
