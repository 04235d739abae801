package co.fanki.archgraph.graph.domain;

import java.util.Optional;

/**
 * Caller-selected filtering of a dependency graph.
 *
 * @param language the selected language, null for all languages
 * @param minWeight the minimum edge weight kept, at least 1
 * @param nodeCap the maximum number of nodes kept, 0 or less for no cap
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphFilterCriteria(Language language, int minWeight,
        int nodeCap) {

    /** Default minimum edge weight. */
    public static final int DEFAULT_MIN_WEIGHT = 2;

    /** Default node cap. */
    public static final int DEFAULT_NODE_CAP = 200;

    /** Normalizes the minimum weight. */
    public GraphFilterCriteria {
        minWeight = Math.max(1, minWeight);
    }

    /**
     * Builds criteria from raw request values.
     *
     * @param languageSelector the language selector ("all", a tag or a
     *        synonym), null for all
     * @param minWeight the minimum weight, null for the default
     * @param nodeCap the node cap, null for the default
     * @return the criteria
     * @throws co.fanki.archgraph.shared.DomainException if the selector
     *         names no known language
     */
    public static GraphFilterCriteria of(final String languageSelector,
            final Integer minWeight, final Integer nodeCap) {
        return new GraphFilterCriteria(
                Language.fromSelector(languageSelector).orElse(null),
                minWeight == null ? DEFAULT_MIN_WEIGHT : minWeight,
                nodeCap == null ? DEFAULT_NODE_CAP : nodeCap);
    }

    /**
     * Returns the selected language.
     *
     * @return the language, empty for all languages
     */
    public Optional<Language> selectedLanguage() {
        return Optional.ofNullable(language);
    }

    /**
     * Checks whether a node cap applies.
     *
     * @return true if the cap is positive
     */
    public boolean isCapped() {
        return nodeCap > 0;
    }

}
