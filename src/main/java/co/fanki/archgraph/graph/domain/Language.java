package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.DomainException;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The source languages the graph builder understands.
 *
 * <p>Each language owns its file extensions (in probing order), the
 * language tag written on the nodes it produces, the extra tags a
 * language filter for it also accepts, and the selector synonyms a
 * caller may use to name it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Language {

    PYTHON("python", List.of(".py"), Set.of(), Set.of("py")),

    JAVASCRIPT("js", List.of(".ts", ".tsx", ".js", ".jsx"), Set.of("npm"),
            Set.of("javascript", "typescript", "ts", "npm")),

    GO("go", List.of(".go"), Set.of(), Set.of("golang")),

    JAVA("java", List.of(".java"), Set.of(), Set.of()),

    CSHARP("csharp", List.of(".cs"), Set.of(), Set.of("cs", ".net", "dotnet")),

    PHP("php", List.of(".php"), Set.of(), Set.of()),

    RUBY("ruby", List.of(".rb"), Set.of(), Set.of("rb"));

    /** Tag written on JavaScript package nodes. */
    public static final String NPM_TAG = "npm";

    private final String tag;

    private final List<String> extensions;

    private final Set<String> relatedTags;

    private final Set<String> synonyms;

    Language(final String theTag, final List<String> theExtensions,
            final Set<String> theRelatedTags, final Set<String> theSynonyms) {
        this.tag = theTag;
        this.extensions = theExtensions;
        this.relatedTags = theRelatedTags;
        this.synonyms = theSynonyms;
    }

    /**
     * Returns the node language tag.
     *
     * @return the tag (e.g. "python", "js")
     */
    public String tag() {
        return tag;
    }

    /**
     * Returns the recognized source extensions, in probing order.
     *
     * @return the extensions including the leading dot
     */
    public List<String> extensions() {
        return extensions;
    }

    /**
     * Checks whether a node tag belongs to this language for filtering.
     *
     * @param nodeTag the tag recorded on a node, may be null
     * @return true if the tag is this language's tag or a related one
     */
    public boolean acceptsTag(final String nodeTag) {
        if (nodeTag == null) {
            return false;
        }
        final String normalized = nodeTag.toLowerCase(Locale.ROOT);
        return tag.equals(normalized) || relatedTags.contains(normalized);
    }

    /**
     * Returns the extension of the given file name this language
     * recognizes, if any.
     *
     * @param fileName the file name
     * @return the matching extension
     */
    public Optional<String> matchingExtension(final String fileName) {
        for (final String extension : extensions) {
            if (fileName.endsWith(extension)) {
                return Optional.of(extension);
            }
        }
        return Optional.empty();
    }

    /**
     * Classifies a file by its extension.
     *
     * @param file the file path
     * @return the language, empty when the file is not a source file
     */
    public static Optional<Language> classify(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        final String name = fileName.toString();
        for (final Language language : values()) {
            if (language.matchingExtension(name).isPresent()) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a language selector.
     *
     * <p>Accepts the language tag, its synonyms and {@code all}, case
     * insensitively. {@code all}, null and blank select every language
     * and yield an empty optional.</p>
     *
     * @param selector the selector
     * @return the selected language, empty for all languages
     * @throws DomainException if the selector names no known language
     */
    public static Optional<Language> fromSelector(final String selector) {
        if (selector == null || selector.isBlank()) {
            return Optional.empty();
        }
        final String normalized = selector.trim().toLowerCase(Locale.ROOT);
        if ("all".equals(normalized)) {
            return Optional.empty();
        }
        for (final Language language : values()) {
            if (language.tag.equals(normalized)
                    || language.synonyms.contains(normalized)) {
                return Optional.of(language);
            }
        }
        throw new DomainException("Unknown language selector: " + selector,
                "INVALID_LANGUAGE");
    }

}
