package co.fanki.archgraph.graph.domain.php;

import co.fanki.archgraph.graph.domain.ExtractionContext;
import co.fanki.archgraph.graph.domain.FileImports;
import co.fanki.archgraph.graph.domain.ImportExtractor;
import co.fanki.archgraph.graph.domain.ImportResolver;
import co.fanki.archgraph.graph.domain.ImportTarget;
import co.fanki.archgraph.graph.domain.Language;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PHP implementation of {@link ImportExtractor}.
 *
 * <p>Matches {@code require}, {@code require_once}, {@code include} and
 * {@code include_once} with a literal string argument, in call or
 * statement form. Specifiers starting with "." or "/" resolve against the
 * importing file's directory (a leading "/" is dropped first) and are
 * internal; anything else is external, keyed by its first path
 * segment. Computed arguments such as {@code __DIR__ . '/x.php'} are not
 * matched.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PhpImportExtractor implements ImportExtractor {

    private static final Pattern REQUIRE_PATTERN = Pattern.compile(
            "\\b(?:require|require_once|include|include_once)"
                    + "\\s*\\(?\\s*['\"]([^'\"]+)['\"]");

    /** {@inheritDoc} */
    @Override
    public Language language() {
        return Language.PHP;
    }

    /** {@inheritDoc} */
    @Override
    public Optional<FileImports> extract(final Path file, final String content,
            final ExtractionContext context) {

        final Optional<String> sourceId = context.resolver().fileId(file,
                Language.PHP, '/');
        if (sourceId.isEmpty()) {
            return Optional.empty();
        }

        final Path fileDir = file.toAbsolutePath().normalize().getParent();
        final List<ImportTarget> targets = new ArrayList<>();
        final Matcher matcher = REQUIRE_PATTERN.matcher(content);
        while (matcher.find()) {
            final String specifier = matcher.group(1).trim();
            if (specifier.isEmpty()) {
                continue;
            }
            if (specifier.startsWith(".") || specifier.startsWith("/")) {
                final String relative = specifier.startsWith("/")
                        ? specifier.substring(1) : specifier;
                targets.add(ImportTarget.internal(
                        context.resolver().resolveRelative(fileDir, relative,
                                Language.PHP),
                        language().tag()));
            } else {
                targets.add(ImportTarget.external(
                        ImportResolver.firstSegment(specifier),
                        language().tag()));
            }
        }

        return Optional.of(new FileImports(sourceId.get(), language().tag(),
                targets));
    }

}
