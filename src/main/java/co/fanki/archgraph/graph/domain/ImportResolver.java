package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.Preconditions;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns import specifiers into canonical node ids for one checkout.
 *
 * <p>File-backed ids are the repository-relative path with the source
 * extension stripped. Relative specifiers are probed on disk in this
 * order: the literal path, the path with each of the language's
 * extensions appended, then the path as a directory holding an
 * {@code index} file under each extension. When nothing exists the
 * computed path is still used, because the file may only have been left
 * out of the sample.</p>
 *
 * <p>This is pattern-level resolution: it does not understand build-tool
 * path aliases or computed specifiers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImportResolver {

    private static final String INDEX_FILE = "index";

    private final Path root;

    private final PackageManifestIndex manifests;

    /**
     * Creates a resolver for one checkout.
     *
     * @param theRoot the repository root
     */
    public ImportResolver(final Path theRoot) {
        this.root = Preconditions.requireNonNull(theRoot, "Root is required")
                .toAbsolutePath().normalize();
        this.manifests = new PackageManifestIndex(this.root);
    }

    /**
     * Returns the repository root.
     *
     * @return the absolute, normalized root
     */
    public Path root() {
        return root;
    }

    /**
     * Builds the id of a file: its repository-relative path without the
     * language extension, segments joined by the separator.
     *
     * @param file the file
     * @param language the language whose extensions are stripped
     * @param separator the segment separator ('/' or '.')
     * @return the id, empty when nothing remains after stripping
     */
    public Optional<String> fileId(final Path file, final Language language,
            final char separator) {
        final String relative = relativePath(file);
        final String stripped = stripExtension(relative, language);
        final String trimmed = trimSlashes(stripped);
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(trimmed.replace('/', separator));
    }

    /**
     * Resolves a specifier relative to a directory.
     *
     * @param fromDirectory the directory of the importing file
     * @param specifier the relative specifier (e.g. "../utils")
     * @param language the importing language
     * @return the internal node id
     */
    public String resolveRelative(final Path fromDirectory,
            final String specifier, final Language language) {
        try {
            return resolvePath(fromDirectory.resolve(specifier).normalize(),
                    language);
        } catch (final InvalidPathException e) {
            return specifier;
        }
    }

    /**
     * Resolves a specifier rooted at the repository root (leading "/").
     *
     * @param specifier the rooted specifier
     * @param language the importing language
     * @return the internal node id
     */
    public String resolveRooted(final String specifier,
            final Language language) {
        final String relative = specifier.replaceFirst("^/+", "");
        try {
            return resolvePath(root.resolve(relative).normalize(), language);
        } catch (final InvalidPathException e) {
            return relative;
        }
    }

    /**
     * Probes the candidates for a target path and returns the id of the
     * first existing source file, or the best-effort id of the target.
     *
     * @param target the absolute target path
     * @param language the language whose extensions are probed
     * @return the internal node id
     */
    public String resolvePath(final Path target, final Language language) {
        for (final Path candidate : candidates(target, language)) {
            if (Files.isRegularFile(candidate)
                    && language.matchingExtension(
                            candidate.getFileName().toString()).isPresent()) {
                final Optional<String> id = fileId(candidate, language, '/');
                if (id.isPresent()) {
                    return id.get();
                }
            }
        }
        return fileId(target, language, '/').orElse(".");
    }

    /**
     * Returns the npm provenance of an external package, looked up in the
     * nearest manifest above the importing directory.
     *
     * @param fromDirectory the directory of the importing file
     * @param packageName the package name
     * @return the provenance, empty when no version is declared
     */
    public Optional<PackageMetadata> npmMetadata(final Path fromDirectory,
            final String packageName) {
        final String version = manifests.dependenciesFor(fromDirectory)
                .get(packageName);
        if (version == null || version.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(PackageMetadata.npm(packageName, version));
    }

    /**
     * Truncates a package specifier to its package name: scoped names
     * ("@scope/pkg/sub") keep two segments, others keep one.
     *
     * @param specifier the non-relative specifier
     * @return the package name
     */
    public static String packageName(final String specifier) {
        if (specifier.startsWith("@")) {
            final String[] parts = specifier.split("/", 3);
            return parts.length >= 2 ? parts[0] + "/" + parts[1] : specifier;
        }
        return firstSegment(specifier);
    }

    /**
     * Returns the first slash-separated segment of a specifier.
     *
     * @param specifier the specifier
     * @return the first segment
     */
    public static String firstSegment(final String specifier) {
        return specifier.split("/", 2)[0];
    }

    private List<Path> candidates(final Path target, final Language language) {
        final List<Path> candidates = new ArrayList<>();
        candidates.add(target);
        final String name = target.getFileName() == null
                ? "" : target.getFileName().toString();
        for (final String extension : language.extensions()) {
            candidates.add(target.resolveSibling(name + extension));
        }
        for (final String extension : language.extensions()) {
            candidates.add(target.resolve(INDEX_FILE + extension));
        }
        return candidates;
    }

    private String relativePath(final Path file) {
        final Path absolute = file.toAbsolutePath().normalize();
        return root.relativize(absolute).toString().replace('\\', '/');
    }

    private static String stripExtension(final String path,
            final Language language) {
        return language.matchingExtension(path)
                .map(ext -> path.substring(0, path.length() - ext.length()))
                .orElse(path);
    }

    private static String trimSlashes(final String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }

}
