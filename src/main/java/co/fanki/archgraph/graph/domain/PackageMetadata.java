package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.Preconditions;

/**
 * Provenance of an external package node, as declared by the nearest
 * package manifest.
 *
 * @param manager the package manager (e.g. "npm")
 * @param name the package name
 * @param version the declared version or range, verbatim
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PackageMetadata(String manager, String name, String version) {

    /** Validates the components. */
    public PackageMetadata {
        Preconditions.requireNonBlank(manager, "Package manager is required");
        Preconditions.requireNonBlank(name, "Package name is required");
        Preconditions.requireNonBlank(version, "Package version is required");
    }

    /**
     * Creates npm provenance.
     *
     * @param name the package name
     * @param version the declared version
     * @return the metadata
     */
    public static PackageMetadata npm(final String name, final String version) {
        return new PackageMetadata("npm", name, version);
    }

}
