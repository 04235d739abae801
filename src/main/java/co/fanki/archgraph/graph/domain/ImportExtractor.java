package co.fanki.archgraph.graph.domain;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Extracts the imports of one source file of a given language.
 *
 * <p>Extraction is heuristic text matching, not compilation: it builds a
 * structural approximation of the import graph. Implementations are
 * stateless and pure apart from the filesystem probes the resolver
 * performs, so one instance serves every build.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ImportExtractor {

    /**
     * Returns the language this extractor handles.
     *
     * @return the language
     */
    Language language();

    /**
     * Extracts the imports of a file.
     *
     * @param file the absolute path of the file inside the checkout
     * @param content the decoded file text, empty if it could not be read
     * @param context the per-build context
     * @return the importing node and its resolved imports, empty when the
     *         file maps to no node (e.g. a root-level package marker)
     */
    Optional<FileImports> extract(Path file, String content,
            ExtractionContext context);

}
