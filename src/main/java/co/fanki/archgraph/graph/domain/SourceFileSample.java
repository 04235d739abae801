package co.fanki.archgraph.graph.domain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The source files selected for analysis, bucketed by language in walk
 * order.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceFileSample {

    private final Map<Language, List<Path>> buckets;

    private final boolean truncated;

    SourceFileSample(final Map<Language, List<Path>> theBuckets,
            final boolean theTruncated) {
        final Map<Language, List<Path>> copy = new EnumMap<>(Language.class);
        for (final Language language : Language.values()) {
            copy.put(language, List.copyOf(
                    theBuckets.getOrDefault(language, List.of())));
        }
        this.buckets = Collections.unmodifiableMap(copy);
        this.truncated = theTruncated;
    }

    /**
     * Returns the sampled files of one language.
     *
     * @param language the language
     * @return the files in walk order, never null
     */
    public List<Path> files(final Language language) {
        return buckets.get(language);
    }

    /**
     * Returns every sampled file, grouped by language in declaration
     * order of {@link Language}.
     *
     * @return all files
     */
    List<Path> allFiles() {
        final List<Path> all = new ArrayList<>();
        for (final Language language : Language.values()) {
            all.addAll(buckets.get(language));
        }
        return all;
    }

    /**
     * Returns the number of sampled files across all languages.
     *
     * @return the total
     */
    public int totalFiles() {
        int total = 0;
        for (final List<Path> files : buckets.values()) {
            total += files.size();
        }
        return total;
    }

    /**
     * Checks whether the walk stopped at the global cap.
     *
     * @return true if files may have been left out by the global cap
     */
    public boolean truncated() {
        return truncated;
    }

}
