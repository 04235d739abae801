package co.fanki.archgraph.graph.domain.java;

import co.fanki.archgraph.graph.domain.ExtractionContext;
import co.fanki.archgraph.graph.domain.FileImports;
import co.fanki.archgraph.graph.domain.ImportExtractor;
import co.fanki.archgraph.graph.domain.ImportTarget;
import co.fanki.archgraph.graph.domain.Language;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Java implementation of {@link ImportExtractor}.
 *
 * <p>The importing node is the file's package declaration, so all files
 * of a package collapse into one node; files without a declaration fall
 * back to their dotted path. Import statements are used verbatim as
 * target ids, except that wildcard imports target the package and static
 * imports target the declaring type.</p>
 *
 * <p>A target is internal only when some sampled file declares exactly
 * that package.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JavaImportExtractor implements ImportExtractor {

    private static final String UNKNOWN = "unknown";

    private static final Pattern PACKAGE_PATTERN = Pattern.compile(
            "^\\s*package\\s+([\\w.]+)\\s*;", Pattern.MULTILINE);

    /** Group 1: static keyword, group 2: name, group 3: wildcard suffix. */
    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "^\\s*import\\s+(static\\s+)?([\\w.]+?)(\\.\\*)?\\s*;",
            Pattern.MULTILINE);

    /** {@inheritDoc} */
    @Override
    public Language language() {
        return Language.JAVA;
    }

    /** {@inheritDoc} */
    @Override
    public Optional<FileImports> extract(final Path file, final String content,
            final ExtractionContext context) {

        final Matcher packageMatcher = PACKAGE_PATTERN.matcher(content);
        final String sourceId = packageMatcher.find()
                ? packageMatcher.group(1)
                : context.resolver().fileId(file, Language.JAVA, '.')
                        .orElse(UNKNOWN);

        final List<ImportTarget> targets = new ArrayList<>();
        final Matcher matcher = IMPORT_PATTERN.matcher(content);
        while (matcher.find()) {
            String target = matcher.group(2);
            final boolean isStatic = matcher.group(1) != null;
            final boolean isWildcard = matcher.group(3) != null;
            if (isStatic && !isWildcard && target.lastIndexOf('.') > 0) {
                target = target.substring(0, target.lastIndexOf('.'));
            }
            targets.add(ImportTarget.external(target, language().tag()));
        }

        return Optional.of(new FileImports(sourceId, language().tag(),
                targets));
    }

}
