package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.graph.domain.csharp.CSharpImportExtractor;
import co.fanki.archgraph.graph.domain.golang.GoImportExtractor;
import co.fanki.archgraph.graph.domain.java.JavaImportExtractor;
import co.fanki.archgraph.graph.domain.nodejs.JavaScriptImportExtractor;
import co.fanki.archgraph.graph.domain.php.PhpImportExtractor;
import co.fanki.archgraph.graph.domain.python.PythonImportExtractor;
import co.fanki.archgraph.graph.domain.ruby.RubyImportExtractor;
import co.fanki.archgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the unfiltered dependency graph of a checkout.
 *
 * <p>Samples the source files, dispatches each one to the extractor
 * registered for its language and merges the results into a
 * {@link GraphAccumulator}. Files are processed one language bucket at a
 * time in walk order, which keeps first-writer-wins node attributes
 * stable between builds of the same tree.</p>
 *
 * <p>A file that cannot be read or decoded still yields its source node
 * but contributes no edges. A file whose extraction fails is skipped.
 * Neither aborts the build.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ArchitectureGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            ArchitectureGraphBuilder.class);

    private final SourceFileSampler sampler;

    private final Map<Language, ImportExtractor> extractors;

    /**
     * Creates a builder with the default extractor for every language.
     *
     * @param theSampler the file sampler
     */
    public ArchitectureGraphBuilder(final SourceFileSampler theSampler) {
        this(theSampler, defaultExtractors());
    }

    /**
     * Creates a builder with explicit extractors.
     *
     * <p>Languages without an extractor are sampled but not parsed.</p>
     *
     * @param theSampler the file sampler
     * @param theExtractors the extractors, at most one per language
     */
    public ArchitectureGraphBuilder(final SourceFileSampler theSampler,
            final List<ImportExtractor> theExtractors) {
        this.sampler = Preconditions.requireNonNull(theSampler,
                "Sampler is required");
        Preconditions.requireNonNull(theExtractors, "Extractors are required");
        final Map<Language, ImportExtractor> table =
                new EnumMap<>(Language.class);
        for (final ImportExtractor extractor : theExtractors) {
            Preconditions.require(
                    table.put(extractor.language(), extractor) == null,
                    "Duplicate extractor for " + extractor.language());
        }
        this.extractors = Collections.unmodifiableMap(table);
    }

    /**
     * Returns one extractor per supported language.
     *
     * @return the default extractors
     */
    public static List<ImportExtractor> defaultExtractors() {
        return List.of(
                new PythonImportExtractor(),
                new JavaScriptImportExtractor(),
                new GoImportExtractor(),
                new JavaImportExtractor(),
                new CSharpImportExtractor(),
                new PhpImportExtractor(),
                new RubyImportExtractor());
    }

    /**
     * Builds the graph of a checkout.
     *
     * @param root the checkout root
     * @param maxFiles the requested global file cap, clamped by the
     *        sampler
     * @return the immutable, unfiltered graph
     */
    public DependencyGraph build(final Path root, final int maxFiles) {
        Preconditions.requireNonNull(root, "Root is required");

        LOG.info("Building architecture graph from: {}", root);

        final SourceFileSample sample = sampler.sample(root, maxFiles);
        if (sample.totalFiles() == 0) {
            LOG.warn("No source files found in {}", root);
            return DependencyGraph.empty();
        }

        final ExtractionContext context = ExtractionContext.forCheckout(root);
        final GraphAccumulator accumulator = new GraphAccumulator();
        int skipped = 0;

        for (final Language language : Language.values()) {
            final ImportExtractor extractor = extractors.get(language);
            if (extractor == null) {
                continue;
            }
            for (final Path file : sample.files(language)) {
                if (!extractFile(extractor, file, context, accumulator)) {
                    skipped++;
                }
            }
        }

        final DependencyGraph graph = accumulator.snapshot();
        LOG.info("Architecture graph built: {} nodes, {} edges,"
                + " {} files without edges due to read errors",
                graph.nodeCount(), graph.edgeCount(), skipped);
        return graph;
    }

    /**
     * Extracts and merges one file.
     *
     * @return false if the file could not be read or parsed
     */
    private boolean extractFile(final ImportExtractor extractor,
            final Path file, final ExtractionContext context,
            final GraphAccumulator accumulator) {
        final Optional<String> content = readSource(file);
        try {
            extractor.extract(file, content.orElse(""), context)
                    .ifPresent(accumulator::add);
        } catch (final RuntimeException e) {
            LOG.warn("Failed to extract imports from {}: {}", file,
                    e.getMessage());
            return false;
        }
        return content.isPresent();
    }

    /**
     * Reads a source file as strict UTF-8.
     *
     * @return empty if the file cannot be read or is not valid UTF-8
     */
    private static Optional<String> readSource(final Path file) {
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(Files.readAllBytes(file)))
                    .toString());
        } catch (final IOException | SecurityException e) {
            LOG.debug("Skipping unreadable file {}: {}", file,
                    e.getMessage());
            return Optional.empty();
        }
    }

}
