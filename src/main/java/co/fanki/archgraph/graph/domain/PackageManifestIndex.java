package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the nearest {@code package.json} above a directory and exposes
 * the dependency versions it declares.
 *
 * <p>The search walks from the directory up to the repository root.
 * Results are memoized per directory for the lifetime of the index, which
 * is a single build. The dependency sections are merged in the order
 * dependencies, devDependencies, peerDependencies, optionalDependencies,
 * later sections overriding earlier ones. A nearest manifest that cannot
 * be parsed yields no versions; the search does not continue above
 * it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PackageManifestIndex {

    private static final Logger LOG = LoggerFactory.getLogger(
            PackageManifestIndex.class);

    private static final String MANIFEST = "package.json";

    private static final List<String> DEPENDENCY_SECTIONS = List.of(
            "dependencies", "devDependencies", "peerDependencies",
            "optionalDependencies");

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Path root;

    private final Map<Path, Map<String, String>> byDirectory = new HashMap<>();

    /**
     * Creates an index for one checkout.
     *
     * @param theRoot the repository root, the search never goes above it
     */
    public PackageManifestIndex(final Path theRoot) {
        this.root = Preconditions.requireNonNull(theRoot, "Root is required")
                .toAbsolutePath().normalize();
    }

    /**
     * Returns the dependency versions declared by the manifest nearest to
     * the given directory.
     *
     * @param directory the directory of the importing file
     * @return package name to declared version, empty if no manifest
     */
    public synchronized Map<String, String> dependenciesFor(
            final Path directory) {
        final Path start = directory.toAbsolutePath().normalize();
        final Map<String, String> cached = byDirectory.get(start);
        if (cached != null) {
            return cached;
        }

        final List<Path> visited = new ArrayList<>();
        Map<String, String> found = Map.of();
        Path current = start;
        while (current != null) {
            final Map<String, String> known = byDirectory.get(current);
            if (known != null) {
                found = known;
                break;
            }
            visited.add(current);
            final Path manifest = current.resolve(MANIFEST);
            if (Files.isRegularFile(manifest)) {
                found = readDependencies(manifest);
                break;
            }
            if (current.equals(root)) {
                break;
            }
            current = current.getParent();
        }

        for (final Path path : visited) {
            byDirectory.put(path, found);
        }
        return found;
    }

    private Map<String, String> readDependencies(final Path manifest) {
        final JsonNode tree;
        try {
            tree = OBJECT_MAPPER.readTree(manifest.toFile());
        } catch (final IOException e) {
            LOG.warn("Ignoring unreadable manifest {}: {}", manifest,
                    e.getMessage());
            return Map.of();
        }
        if (tree == null || !tree.isObject()) {
            return Map.of();
        }

        final Map<String, String> dependencies = new LinkedHashMap<>();
        for (final String section : DEPENDENCY_SECTIONS) {
            final JsonNode node = tree.get(section);
            if (node == null || !node.isObject()) {
                continue;
            }
            final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual()) {
                    dependencies.put(field.getKey(),
                            field.getValue().asText());
                }
            }
        }
        LOG.debug("Loaded {} declared dependencies from {}",
                dependencies.size(), manifest);
        return Collections.unmodifiableMap(dependencies);
    }

}
