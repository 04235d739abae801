package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a checkout and selects the source files to analyze.
 *
 * <p>The walk is depth first, files of a directory before its
 * subdirectories, entries in name order, so the same tree always yields
 * the same sample. Two caps bound the work:</p>
 * <ul>
 *   <li>a per-directory cap on recognized source files, which keeps huge
 *       flat directories from dominating the sample;</li>
 *   <li>a global cap across all languages, clamped to
 *       [{@value #MIN_FILES}, {@value #MAX_FILES}], which stops the walk.</li>
 * </ul>
 *
 * <p>Files dropped by either cap are never parsed, so very large
 * repositories yield an incomplete graph.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceFileSampler {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceFileSampler.class);

    /** Lowest accepted global cap. */
    public static final int MIN_FILES = 100;

    /** Highest accepted global cap. */
    public static final int MAX_FILES = 10_000;

    /** Default number of source files sampled per directory. */
    public static final int DEFAULT_PER_DIRECTORY_CAP = 20;

    /** Directories never descended into. */
    private static final Set<String> EXCLUDED_DIRS = Set.of(
            ".git", ".hg", ".svn",
            ".venv", "venv", "node_modules", "vendor", "bower_components",
            "dist", "build", "target",
            "__pycache__", ".mypy_cache", ".tox");

    private final int perDirectoryCap;

    /**
     * Creates a sampler with the default per-directory cap.
     */
    public SourceFileSampler() {
        this(DEFAULT_PER_DIRECTORY_CAP);
    }

    /**
     * Creates a sampler.
     *
     * @param thePerDirectoryCap the maximum number of source files taken
     *        from a single directory, must be positive
     */
    public SourceFileSampler(final int thePerDirectoryCap) {
        this.perDirectoryCap = Preconditions.requirePositive(
                thePerDirectoryCap, "Per-directory cap must be positive");
    }

    /**
     * Clamps a requested file cap into the accepted range.
     *
     * @param requested the requested cap
     * @return the effective cap
     */
    public static int clampFileCap(final int requested) {
        return Preconditions.clamp(requested, MIN_FILES, MAX_FILES);
    }

    /**
     * Samples the source files under a checkout root.
     *
     * @param root the checkout root
     * @param maxFiles the requested global cap, clamped before use
     * @return the sample
     */
    public SourceFileSample sample(final Path root, final int maxFiles) {
        Preconditions.requireNonNull(root, "Root is required");
        Preconditions.require(Files.isDirectory(root),
                "Root is not a directory: " + root);

        final Walk walk = new Walk(clampFileCap(maxFiles));
        walk.visit(root);

        final SourceFileSample sample = new SourceFileSample(walk.buckets,
                walk.stopped);
        LOG.info("Sampled {} source files under {} (cap {}, truncated: {})",
                sample.totalFiles(), root, walk.globalCap, walk.stopped);
        return sample;
    }

    /** Mutable state of a single walk. */
    private final class Walk {

        private final int globalCap;

        private final Map<Language, List<Path>> buckets =
                new EnumMap<>(Language.class);

        private int total;

        private boolean stopped;

        private Walk(final int theGlobalCap) {
            this.globalCap = theGlobalCap;
        }

        private void visit(final Path directory) {
            final List<Path> entries = list(directory);
            final List<Path> subdirectories = new ArrayList<>();
            int takenHere = 0;

            for (final Path entry : entries) {
                if (stopped) {
                    return;
                }
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    subdirectories.add(entry);
                    continue;
                }
                if (takenHere >= perDirectoryCap
                        || !Files.isRegularFile(entry)) {
                    continue;
                }
                final Optional<Language> language = Language.classify(entry);
                if (language.isEmpty()) {
                    continue;
                }
                buckets.computeIfAbsent(language.get(),
                        k -> new ArrayList<>()).add(entry);
                takenHere++;
                total++;
                if (total >= globalCap) {
                    stopped = true;
                }
            }

            for (final Path subdirectory : subdirectories) {
                if (stopped) {
                    return;
                }
                if (!EXCLUDED_DIRS.contains(
                        subdirectory.getFileName().toString())) {
                    visit(subdirectory);
                }
            }
        }

        private List<Path> list(final Path directory) {
            final List<Path> entries = new ArrayList<>();
            try (DirectoryStream<Path> stream =
                         Files.newDirectoryStream(directory)) {
                for (final Path entry : stream) {
                    entries.add(entry);
                }
            } catch (final IOException | DirectoryIteratorException
                    | SecurityException e) {
                LOG.debug("Skipping unreadable directory {}: {}",
                        directory, e.getMessage());
                return List.of();
            }
            entries.sort(Comparator.comparing(
                    p -> p.getFileName().toString()));
            return entries;
        }
    }

}
