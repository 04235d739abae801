package co.fanki.archgraph.graph.domain.csharp;

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
 * C# implementation of {@link ImportExtractor}.
 *
 * <p>Deliberately coarse: it mirrors the Java package strategy. The
 * first namespace declaration is the importing node and plain
 * {@code using X.Y;} directives are the targets. Alias and static
 * usings are not matched, and a target is internal only when some
 * sampled file declares exactly that namespace.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CSharpImportExtractor implements ImportExtractor {

    private static final String UNKNOWN = "unknown";

    private static final Pattern NAMESPACE_PATTERN = Pattern.compile(
            "^\\s*namespace\\s+([\\w.]+)", Pattern.MULTILINE);

    private static final Pattern USING_PATTERN = Pattern.compile(
            "^\\s*using\\s+([\\w.]+)\\s*;", Pattern.MULTILINE);

    /** {@inheritDoc} */
    @Override
    public Language language() {
        return Language.CSHARP;
    }

    /** {@inheritDoc} */
    @Override
    public Optional<FileImports> extract(final Path file, final String content,
            final ExtractionContext context) {

        final Matcher namespace = NAMESPACE_PATTERN.matcher(content);
        final String sourceId = namespace.find()
                ? namespace.group(1)
                : context.resolver().fileId(file, Language.CSHARP, '.')
                        .orElse(UNKNOWN);

        final List<ImportTarget> targets = new ArrayList<>();
        final Matcher matcher = USING_PATTERN.matcher(content);
        while (matcher.find()) {
            targets.add(ImportTarget.external(matcher.group(1),
                    language().tag()));
        }

        return Optional.of(new FileImports(sourceId, language().tag(),
                targets));
    }

}
