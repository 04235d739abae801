package co.fanki.archgraph.graph.domain.nodejs;

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
 * JavaScript/TypeScript implementation of {@link ImportExtractor}.
 *
 * <p>Matches static ES imports (including side-effect and multi-line
 * named imports) and CommonJS {@code require("...")} calls. The importing
 * node id is the file's repository-relative path without its extension
 * ({@code src/index.js} is {@code src/index}).</p>
 *
 * <p>Specifiers starting with "." resolve against the file's directory
 * and "/" against the repository root; both are internal. Anything else
 * is an npm package, truncated to its package name and annotated with the
 * version declared in the nearest {@code package.json}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JavaScriptImportExtractor implements ImportExtractor {

    /** Matches ES6 imports, with or without bindings. */
    private static final Pattern ES6_IMPORT_PATTERN = Pattern.compile(
            "^\\s*import\\s+(?:[^'\";]+?\\s+from\\s+)?['\"]([^'\"]+)['\"]",
            Pattern.MULTILINE);

    /** Matches CommonJS require calls. */
    private static final Pattern REQUIRE_PATTERN = Pattern.compile(
            "require\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    /** {@inheritDoc} */
    @Override
    public Language language() {
        return Language.JAVASCRIPT;
    }

    /** {@inheritDoc} */
    @Override
    public Optional<FileImports> extract(final Path file, final String content,
            final ExtractionContext context) {

        final Optional<String> sourceId = context.resolver().fileId(file,
                Language.JAVASCRIPT, '/');
        if (sourceId.isEmpty()) {
            return Optional.empty();
        }

        final Path fileDir = file.toAbsolutePath().normalize().getParent();
        final List<ImportTarget> targets = new ArrayList<>();
        collect(content, ES6_IMPORT_PATTERN, fileDir, context, targets);
        collect(content, REQUIRE_PATTERN, fileDir, context, targets);

        return Optional.of(new FileImports(sourceId.get(), language().tag(),
                targets));
    }

    private void collect(final String content, final Pattern pattern,
            final Path fileDir, final ExtractionContext context,
            final List<ImportTarget> targets) {
        final Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            final String specifier = matcher.group(1).trim();
            if (!specifier.isEmpty()) {
                targets.add(resolve(specifier, fileDir, context.resolver()));
            }
        }
    }

    private ImportTarget resolve(final String specifier, final Path fileDir,
            final ImportResolver resolver) {
        if (specifier.startsWith(".")) {
            return ImportTarget.internal(resolver.resolveRelative(fileDir,
                    specifier, Language.JAVASCRIPT), language().tag());
        }
        if (specifier.startsWith("/")) {
            return ImportTarget.internal(resolver.resolveRooted(specifier,
                    Language.JAVASCRIPT), language().tag());
        }
        final String packageName = ImportResolver.packageName(specifier);
        return ImportTarget.externalPackage(packageName, Language.NPM_TAG,
                resolver.npmMetadata(fileDir, packageName).orElse(null));
    }

}
