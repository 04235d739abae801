package co.fanki.archgraph.repository.domain;

import co.fanki.archgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * A materialized working tree exclusive to one build.
 *
 * <p>Closing the checkout deletes the whole directory tree. Deletion
 * failures are logged and never propagated, so closing can sit in a
 * finally block (or try-with-resources) on every exit path.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Checkout implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(
            Checkout.class);

    private final Path root;

    private Checkout(final Path theRoot) {
        this.root = Preconditions.requireNonNull(theRoot,
                "Checkout root is required");
    }

    /**
     * Wraps a temporary directory that is deleted on close.
     *
     * @param root the checkout root
     * @return the checkout
     */
    public static Checkout temporary(final Path root) {
        return new Checkout(root);
    }

    /**
     * Returns the root directory of the working tree.
     *
     * @return the root
     */
    public Path root() {
        return root;
    }

    @Override
    public void close() {
        delete(root);
    }

    /**
     * Recursively deletes a directory, logging entries that cannot be
     * removed.
     *
     * @param directory the directory to delete, may not exist
     */
    public static void delete(final Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (final IOException e) {
                            LOG.warn("Failed to delete: {}", path);
                        }
                    });
            LOG.debug("Cleaned up checkout directory: {}", directory);
        } catch (final IOException e) {
            LOG.warn("Failed to cleanup checkout directory: {}",
                    directory, e);
        }
    }

}
