package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.Preconditions;

import java.util.List;

/**
 * The imports extracted from one source file.
 *
 * <p>Targets keep every occurrence, duplicates included: each one adds
 * one unit of weight to its edge.</p>
 *
 * @param sourceId the node id of the importing file
 * @param language the language tag of the importing node
 * @param targets the resolved import occurrences in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileImports(String sourceId, String language,
        List<ImportTarget> targets) {

    /** Validates and copies the components. */
    public FileImports {
        Preconditions.requireNonBlank(sourceId, "Source id is required");
        Preconditions.requireNonBlank(language, "Language is required");
        targets = List.copyOf(Preconditions.requireNonNull(targets,
                "Targets are required"));
    }

}
