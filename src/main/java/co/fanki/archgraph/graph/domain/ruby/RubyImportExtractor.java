package co.fanki.archgraph.graph.domain.ruby;

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
 * Ruby implementation of {@link ImportExtractor}.
 *
 * <p>{@code require_relative} always resolves against the importing
 * file's directory. Plain {@code require} does so only when its argument
 * starts with "."; otherwise the first path segment names an external
 * gem.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RubyImportExtractor implements ImportExtractor {

    private static final Pattern REQUIRE_RELATIVE_PATTERN = Pattern.compile(
            "^\\s*require_relative\\s*\\(?\\s*['\"]([^'\"]+)['\"]",
            Pattern.MULTILINE);

    private static final Pattern REQUIRE_PATTERN = Pattern.compile(
            "^\\s*require\\s*\\(?\\s*['\"]([^'\"]+)['\"]",
            Pattern.MULTILINE);

    /** {@inheritDoc} */
    @Override
    public Language language() {
        return Language.RUBY;
    }

    /** {@inheritDoc} */
    @Override
    public Optional<FileImports> extract(final Path file, final String content,
            final ExtractionContext context) {

        final Optional<String> sourceId = context.resolver().fileId(file,
                Language.RUBY, '/');
        if (sourceId.isEmpty()) {
            return Optional.empty();
        }

        final Path fileDir = file.toAbsolutePath().normalize().getParent();
        final ImportResolver resolver = context.resolver();
        final List<ImportTarget> targets = new ArrayList<>();

        final Matcher relative = REQUIRE_RELATIVE_PATTERN.matcher(content);
        while (relative.find()) {
            targets.add(ImportTarget.internal(resolver.resolveRelative(
                    fileDir, relative.group(1).trim(), Language.RUBY),
                    language().tag()));
        }

        final Matcher plain = REQUIRE_PATTERN.matcher(content);
        while (plain.find()) {
            final String specifier = plain.group(1).trim();
            if (specifier.isEmpty()) {
                continue;
            }
            if (specifier.startsWith(".")) {
                targets.add(ImportTarget.internal(resolver.resolveRelative(
                        fileDir, specifier, Language.RUBY), language().tag()));
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
