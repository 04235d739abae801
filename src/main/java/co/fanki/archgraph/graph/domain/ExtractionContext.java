package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.graph.domain.golang.GoImportExtractor;
import co.fanki.archgraph.shared.Preconditions;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Per-build state shared by the import extractors.
 *
 * <p>Holds the resolver (and through it the memoized manifest lookups)
 * and the facts read once from the repository root, such as the Go
 * module path. A context is created for one checkout and discarded with
 * it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExtractionContext {

    private final ImportResolver resolver;

    private final String goModule;

    private ExtractionContext(final ImportResolver theResolver,
            final String theGoModule) {
        this.resolver = theResolver;
        this.goModule = theGoModule;
    }

    /**
     * Creates the context for a checkout, reading root-level module
     * declarations.
     *
     * @param root the checkout root
     * @return the context
     */
    public static ExtractionContext forCheckout(final Path root) {
        Preconditions.requireNonNull(root, "Root is required");
        final ImportResolver resolver = new ImportResolver(root);
        return new ExtractionContext(resolver,
                GoImportExtractor.detectModule(resolver.root()).orElse(null));
    }

    /**
     * Returns the resolver bound to the checkout.
     *
     * @return the resolver
     */
    public ImportResolver resolver() {
        return resolver;
    }

    /**
     * Returns the checkout root.
     *
     * @return the absolute, normalized root
     */
    public Path root() {
        return resolver.root();
    }

    /**
     * Returns the Go module path declared at the repository root.
     *
     * @return the module path, empty if there is no root go.mod
     */
    public Optional<String> goModule() {
        return Optional.ofNullable(goModule);
    }

}
