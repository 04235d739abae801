package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.graph.domain.ruby.RubyImportExtractor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ArchitectureGraphBuilder} over real directory trees.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ArchitectureGraphBuilderTest {

    private final ArchitectureGraphBuilder builder =
            new ArchitectureGraphBuilder(new SourceFileSampler());

    @Test
    void whenBuilding_givenPythonPackage_shouldLinkInternalModules(
            @TempDir final Path root) throws IOException {
        write(root, "pkg/__init__.py", "");
        write(root, "pkg/a.py", "from pkg.b import helper\n");
        write(root, "pkg/b.py", "");

        final DependencyGraph graph = builder.build(root, 3000);

        assertEquals(3, graph.nodeCount());
        for (final String id : List.of("pkg", "pkg.a", "pkg.b")) {
            assertTrue(graph.node(id).isInternal(), id);
        }
        assertEquals(1, graph.weight("pkg.a", "pkg.b"));

        final ArchitectureGraph relaxed = GraphFilter.apply(graph,
                GraphFilterCriteria.of("all", 1, null));
        assertEquals(List.of(new ArchitectureGraph.Edge("pkg.a", "pkg.b", 1)),
                relaxed.edges());

        final ArchitectureGraph defaults = GraphFilter.apply(graph,
                GraphFilterCriteria.of(null, null, null));
        assertTrue(defaults.edges().isEmpty());
        assertEquals(3, defaults.stats().internalNodes());
    }

    @Test
    void whenBuilding_givenJavaPackages_shouldMarkOnlyDeclaredPackagesInternal(
            @TempDir final Path root) throws IOException {
        write(root, "src/co/acme/web/Api.java", """
                package co.acme.web;
                import co.acme.core.*;
                import org.slf4j.Logger;
                """);
        write(root, "src/co/acme/core/Core.java", "package co.acme.core;\n");

        final DependencyGraph graph = builder.build(root, 3000);

        assertTrue(graph.node("co.acme.core").isInternal());
        assertFalse(graph.node("org.slf4j.Logger").isInternal());
    }

    @Test
    void whenBuilding_givenMixedLanguages_shouldTagEveryNode(
            @TempDir final Path root) throws IOException {
        Files.writeString(root.resolve("go.mod"), "module example.com/app\n");
        write(root, "main.go", """
                package main
                import (
                    "fmt"
                    "example.com/app/util"
                )
                """);
        write(root, "util/util.go", "package util\n");
        write(root, "web/index.js", "import x from 'react'\n");
        write(root, "lib/app.rb", "require 'json'\n");

        final DependencyGraph graph = builder.build(root, 3000);

        assertEquals("go", graph.node("main").language());
        assertEquals("go", graph.node("fmt").language());
        assertTrue(graph.node("util").isInternal());
        assertEquals("npm", graph.node("react").language());
        assertEquals("ruby", graph.node("json").language());
    }

    @Test
    void whenBuilding_givenSameTreeTwice_shouldProduceIdenticalGraphs(
            @TempDir final Path root) throws IOException {
        write(root, "src/a.js", "import b from './b'\nimport r from 'react'\n");
        write(root, "src/b.js", "const l = require('lodash')\n");
        write(root, "app/x.py", "import os\nimport app.y\n");
        write(root, "app/y.py", "import os\n");

        final ArchitectureGraph first = GraphFilter.apply(
                builder.build(root, 3000), GraphFilterCriteria.of(null, 1, 0));
        final ArchitectureGraph second = GraphFilter.apply(
                builder.build(root, 3000), GraphFilterCriteria.of(null, 1, 0));

        assertEquals(first, second);
    }

    @Test
    void whenBuilding_givenFailingExtractor_shouldSkipFileAndContinue(
            @TempDir final Path root) throws IOException {
        write(root, "a.py", "import os\n");
        write(root, "b.rb", "require 'json'\n");
        final ImportExtractor failing = new ImportExtractor() {
            @Override
            public Language language() {
                return Language.PYTHON;
            }

            @Override
            public Optional<FileImports> extract(final Path file,
                    final String content, final ExtractionContext context) {
                throw new IllegalStateException("boom");
            }
        };
        final ArchitectureGraphBuilder partial = new ArchitectureGraphBuilder(
                new SourceFileSampler(), List.of(failing,
                        new RubyImportExtractor()));

        final DependencyGraph graph = partial.build(root, 3000);

        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.weight("b", "json"));
    }

    @Test
    void whenBuilding_givenFileVanishedAfterSampling_shouldKeepNodeWithoutEdges(
            @TempDir final Path root) throws IOException {
        write(root, "src/utils.js", "export const f = 1;\n");
        write(root, "src/gone.js", "import {f} from './utils'\n");
        write(root, "src/keep.js", "import {f} from './utils'\n");
        final SourceFileSampler vanishing = new SourceFileSampler() {
            @Override
            public SourceFileSample sample(final Path theRoot,
                    final int maxFiles) {
                final SourceFileSample sample = super.sample(theRoot, maxFiles);
                try {
                    Files.delete(theRoot.resolve("src/gone.js"));
                } catch (final IOException e) {
                    throw new UncheckedIOException(e);
                }
                return sample;
            }
        };

        final DependencyGraph graph = new ArchitectureGraphBuilder(vanishing)
                .build(root, 3000);

        assertTrue(graph.node("src/gone").isInternal());
        assertEquals(0, outgoing(graph, "src/gone"));
        assertEquals(1, graph.weight("src/keep", "src/utils"));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    void whenBuilding_givenInvalidUtf8File_shouldKeepNodeWithoutEdges(
            @TempDir final Path root) throws IOException {
        write(root, "src/utils.js", "export const f = 1;\n");
        write(root, "src/good.js", "import {f} from './utils'\n");
        final byte[] imports = "\nimport {f} from './utils'\n"
                .getBytes(StandardCharsets.UTF_8);
        final byte[] content = new byte[imports.length + 2];
        content[0] = (byte) 0xC3;
        content[1] = (byte) 0x28;
        System.arraycopy(imports, 0, content, 2, imports.length);
        Files.write(root.resolve("src/bad.js"), content);

        final DependencyGraph graph = builder.build(root, 3000);

        assertTrue(graph.node("src/bad").isInternal());
        assertEquals(0, graph.weight("src/bad", "src/utils"));
        assertEquals(0, outgoing(graph, "src/bad"));
        assertEquals(1, graph.weight("src/good", "src/utils"));
    }

    @Test
    void whenBuilding_givenEmptyTree_shouldReturnEmptyGraph(
            @TempDir final Path root) {
        assertEquals(0, builder.build(root, 3000).nodeCount());
    }

    @Test
    void whenCreating_givenDuplicateExtractors_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ArchitectureGraphBuilder(new SourceFileSampler(),
                        List.of(new RubyImportExtractor(),
                                new RubyImportExtractor())));
    }

    private static long outgoing(final DependencyGraph graph,
            final String source) {
        return graph.edges().stream()
                .filter(edge -> edge.source().equals(source))
                .count();
    }

    private static void write(final Path root, final String relative,
            final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

}
