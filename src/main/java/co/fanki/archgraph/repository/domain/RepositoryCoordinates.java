package co.fanki.archgraph.repository.domain;

import co.fanki.archgraph.shared.Preconditions;
import co.fanki.archgraph.shared.ValueObject;

import java.util.regex.Pattern;

/**
 * Value object identifying a hosted repository by owner and name.
 *
 * <p>Both segments are restricted to the characters a hosting service
 * accepts in a repository path, so the coordinates can be safely
 * concatenated into a clone URL.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RepositoryCoordinates implements ValueObject {

    private static final long serialVersionUID = 1L;

    private static final Pattern SEGMENT_PATTERN = Pattern.compile(
            "^[\\w.-]+$");

    private final String owner;

    private final String name;

    private RepositoryCoordinates(final String theOwner,
            final String theName) {
        Preconditions.requireNonBlank(theOwner,
                "Repository owner cannot be null or blank");
        Preconditions.requireNonBlank(theName,
                "Repository name cannot be null or blank");
        Preconditions.require(isValidSegment(theOwner),
                "Invalid repository owner: " + theOwner);
        Preconditions.require(isValidSegment(theName),
                "Invalid repository name: " + theName);
        this.owner = theOwner;
        this.name = theName;
    }

    /**
     * Creates coordinates from an owner and a repository name.
     *
     * @param owner the owning user or organization
     * @param name the repository name
     * @return the coordinates
     * @throws IllegalArgumentException if either segment is invalid
     */
    public static RepositoryCoordinates of(final String owner,
            final String name) {
        return new RepositoryCoordinates(owner, name);
    }

    /**
     * Returns the owning user or organization.
     *
     * @return the owner
     */
    public String owner() {
        return owner;
    }

    /**
     * Returns the repository name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Returns the {@code owner/name} form used as cache key component.
     *
     * @return the full name
     */
    public String fullName() {
        return owner + "/" + name;
    }

    /**
     * Builds the HTTPS clone URL for these coordinates.
     *
     * @param baseUrl the hosting base URL (e.g. "https://github.com")
     * @return the clone URL ending in ".git"
     */
    public String cloneUrl(final String baseUrl) {
        Preconditions.requireNonBlank(baseUrl, "Base URL is required");
        final String base = baseUrl.endsWith("/")
                ? baseUrl.substring(0, baseUrl.length() - 1)
                : baseUrl;
        return base + "/" + fullName() + ".git";
    }

    private static boolean isValidSegment(final String segment) {
        return SEGMENT_PATTERN.matcher(segment).matches()
                && !".".equals(segment) && !"..".equals(segment);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RepositoryCoordinates that = (RepositoryCoordinates) obj;
        return owner.equals(that.owner) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return 31 * owner.hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return fullName();
    }

}
